package com.insightflo.news.search;

import com.insightflo.core.model.NewsRecord;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TF-IDF over a candidate set. Document frequency is counted within the candidates
 * only, so scores are comparable inside one search and nowhere else.
 * <p>
 * {@code tf = occurrences / documentTerms}, {@code idf = ln(N / df)}; the per-document
 * score is the mean over query terms. A term found in every candidate contributes nothing.
 */
public final class TfIdfScorer {

    private TfIdfScorer() {
    }

    public static double[] score(String query, List<NewsRecord> candidates) {
        double[] scores = new double[candidates.size()];
        if (candidates.isEmpty()) {
            return scores;
        }
        List<String> queryTerms = TextTokenizer.tokenize(query);
        if (queryTerms.isEmpty()) {
            return scores;
        }

        List<List<String>> documents = candidates.stream().map(TextTokenizer::tokenize).toList();

        Map<String, Integer> documentFrequency = new HashMap<>();
        for (List<String> document : documents) {
            Set<String> distinct = new HashSet<>(document);
            for (String term : queryTerms) {
                if (distinct.contains(term)) {
                    documentFrequency.merge(term, 1, Integer::sum);
                }
            }
        }

        int totalDocuments = documents.size();
        for (int i = 0; i < documents.size(); i++) {
            List<String> document = documents.get(i);
            if (document.isEmpty()) {
                continue;
            }
            Map<String, Integer> termFrequency = new HashMap<>();
            for (String term : document) {
                termFrequency.merge(term, 1, Integer::sum);
            }

            double score = 0.0;
            for (String term : queryTerms) {
                double tf = (double) termFrequency.getOrDefault(term, 0) / document.size();
                int df = documentFrequency.getOrDefault(term, 1);
                score += tf * Math.log((double) totalDocuments / df);
            }
            scores[i] = score / queryTerms.size();
        }
        return scores;
    }
}
