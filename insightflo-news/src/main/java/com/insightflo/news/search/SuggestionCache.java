package com.insightflo.news.search;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory suggestion lists with a TTL. When the key count exceeds the bound,
 * the entry with the oldest timestamp is evicted.
 */
public class SuggestionCache {

    private record Entry(List<SearchSuggestion> suggestions, Instant cachedAt) {}

    private final Map<String, Entry> entries = new HashMap<>();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    public SuggestionCache(Duration ttl, int maxEntries, Clock clock) {
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public static String key(String userId, String prefix, List<SuggestionType> types) {
        String typeKey = types == null || types.isEmpty() ? "all" : String.join(",", types.stream().map(Enum::name).toList());
        return userId + "_" + prefix + "_" + typeKey;
    }

    public synchronized Optional<List<SearchSuggestion>> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.cachedAt().plus(ttl))) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.suggestions());
    }

    public synchronized void put(String key, List<SearchSuggestion> suggestions) {
        entries.put(key, new Entry(List.copyOf(suggestions), clock.instant()));
        while (entries.size() > maxEntries) {
            String oldest = null;
            Instant oldestAt = null;
            for (Map.Entry<String, Entry> e : entries.entrySet()) {
                if (oldestAt == null || e.getValue().cachedAt().isBefore(oldestAt)) {
                    oldest = e.getKey();
                    oldestAt = e.getValue().cachedAt();
                }
            }
            entries.remove(oldest);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
