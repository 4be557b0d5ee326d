package com.insightflo.news.search;

import com.insightflo.core.model.NewsRecord;

public record ScoredResult(NewsRecord news, double score, ScoreBreakdown breakdown) {
}
