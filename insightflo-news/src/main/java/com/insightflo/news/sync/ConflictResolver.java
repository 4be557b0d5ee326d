package com.insightflo.news.sync;

import com.insightflo.core.model.NewsRecord;
import com.insightflo.news.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reconciles a downloaded record with the local copy sharing its {@code (id, userId)}.
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final LocalStore store;

    public ConflictResolver(LocalStore store) {
        this.store = store;
    }

    /**
     * @return the record to write, or empty when the local copy must stay untouched
     */
    public Optional<NewsRecord> resolve(NewsRecord remote, ConflictStrategy strategy) {
        try {
            Optional<NewsRecord> local = store.getRecord(remote.id(), remote.userId());
            if (local.isEmpty()) {
                return Optional.of(remote);
            }
            return switch (strategy) {
                case SERVER_WINS -> Optional.of(remote);
                case CLIENT_WINS -> Optional.empty();
                case MERGE -> Optional.of(merge(local.get(), remote));
            };
        } catch (RuntimeException e) {
            log.warn("Conflict resolution failed for {}, keeping remote: {}", remote.id(), e.getMessage());
            return Optional.of(remote);
        }
    }

    /**
     * Remote content wins; the bookmark flag belongs to the user and is kept.
     */
    static NewsRecord merge(NewsRecord local, NewsRecord remote) {
        return remote.withBookmarked(local.bookmarked());
    }
}
