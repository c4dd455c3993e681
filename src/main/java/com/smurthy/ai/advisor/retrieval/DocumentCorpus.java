package com.smurthy.ai.advisor.retrieval;

import com.smurthy.ai.advisor.config.CorpusConfig;
import com.smurthy.ai.advisor.exceptions.CorpusUnavailableException;
import com.smurthy.ai.advisor.model.Document;
import com.smurthy.ai.advisor.store.DocumentParser;
import com.smurthy.ai.advisor.store.DocumentStore;
import com.smurthy.ai.advisor.store.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cached snapshot of the responder corpus with a bounded TTL.
 *
 * Readers always get a complete immutable list. A refresh builds a new list off to the side and
 * publishes it with a single volatile write; the lock only serialises concurrent refreshes.
 * When the store cannot be read, the previous snapshot keeps being served (or an empty corpus
 * when nothing was ever loaded), and the store is left alone for {@code retryAfterFailure}.
 */
@Service
public class DocumentCorpus {

    private static final Logger log = LoggerFactory.getLogger(DocumentCorpus.class);

    private final DocumentStore documentStore;
    private final DocumentParser documentParser;
    private final String prefix;
    private final Duration ttl;
    private final Duration retryAfterFailure;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile Snapshot snapshot;

    public DocumentCorpus(DocumentStore documentStore, DocumentParser documentParser,
                          CorpusConfig config, Clock clock) {
        this.documentStore = documentStore;
        this.documentParser = documentParser;
        this.prefix = config.prefix();
        this.ttl = config.ttl();
        this.retryAfterFailure = config.retryAfterFailure();
        this.clock = clock;
        log.info("DocumentCorpus initialized: prefix='{}', ttl={}", prefix, ttl);
    }

    /**
     * Return the current snapshot, refetching it first when it is older than the TTL.
     */
    public List<Document> load() {
        Snapshot current = snapshot;
        if (current != null && isFresh(current)) {
            return current.documents();
        }

        refreshLock.lock();
        try {
            // another thread may have refreshed while we waited
            current = snapshot;
            if (current != null && isFresh(current)) {
                return current.documents();
            }
            return fetchAndPublish(current);
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Refetch regardless of age.
     *
     * @return the snapshot being served afterwards
     */
    public List<Document> refresh() {
        refreshLock.lock();
        try {
            return fetchAndPublish(snapshot);
        } finally {
            refreshLock.unlock();
        }
    }

    public Optional<Instant> lastLoadedAt() {
        Snapshot current = snapshot;
        return current == null ? Optional.empty() : Optional.ofNullable(current.loadedAt());
    }

    private List<Document> fetchAndPublish(Snapshot previous) {
        long start = System.currentTimeMillis();
        List<StoredObject> objects;
        try {
            objects = documentStore.listDocuments(prefix);
        } catch (CorpusUnavailableException e) {
            Instant retryAt = clock.instant().plus(retryAfterFailure);
            if (previous != null && previous.loadedAt() != null) {
                log.warn("Corpus refetch failed, serving stale snapshot of {} document(s) from {} until {}: {}",
                        previous.documents().size(), previous.loadedAt(), retryAt, e.getMessage());
                snapshot = new Snapshot(previous.documents(), previous.loadedAt(), retryAt);
                return previous.documents();
            }
            log.warn("Corpus fetch failed and no snapshot is cached, serving an empty corpus until {}: {}",
                    retryAt, e.getMessage());
            snapshot = new Snapshot(List.of(), null, retryAt);
            return List.of();
        }

        List<Document> documents = new ArrayList<>(objects.size());
        Set<String> seenIds = new HashSet<>();
        for (StoredObject object : objects) {
            documentParser.parse(object).ifPresent(doc -> {
                if (seenIds.add(doc.id())) {
                    documents.add(doc);
                } else {
                    log.warn("Duplicate document id '{}' from '{}', keeping the first", doc.id(), object.id());
                }
            });
        }

        Instant now = clock.instant();
        Snapshot fresh = new Snapshot(List.copyOf(documents), now, now.plus(ttl));
        snapshot = fresh;
        log.info("Corpus loaded: {} document(s) from {} object(s) in {}ms",
                documents.size(), objects.size(), System.currentTimeMillis() - start);
        return fresh.documents();
    }

    private boolean isFresh(Snapshot current) {
        return clock.instant().isBefore(current.nextFetchAt());
    }

    /**
     * @param loadedAt    when the documents were fetched, null while nothing was ever loaded
     * @param nextFetchAt when {@link #load()} asks the store again
     */
    private record Snapshot(List<Document> documents, Instant loadedAt, Instant nextFetchAt) {
    }
}
