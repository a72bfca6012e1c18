package com.memberhub.search.index;

import com.memberhub.search.retrieval.lexical.LexicalIndex;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ContentIndexStore {
    private static final Logger log = LoggerFactory.getLogger(ContentIndexStore.class);

    private final ContentIndexRepository repository;
    private final LexicalIndex lexicalIndex;
    private final IndexProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<ContentKey, IndexedContent> contents = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ContentKey, Long> pendingVectors = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ContentKey, KeyLock> keyLocks = new ConcurrentHashMap<>();
    private final AtomicLong vectorRevisions = new AtomicLong();

    public ContentIndexStore(
        ContentIndexRepository repository,
        LexicalIndex lexicalIndex,
        IndexProperties properties,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.repository = repository;
        this.lexicalIndex = lexicalIndex;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public UpsertResult upsert(UpsertCommand command) {
        validate(command);
        ContentKey key = command.key();
        UpsertResult outcome = withKeyLock(key, () -> {
            IndexedContent existing = contents.get(key);
            IndexedContent merged = merge(existing, command);
            if (merged.sameContentAs(existing)) {
                return UpsertResult.UNCHANGED;
            }
            if (!merged.hasVector() && !merged.hasLexical()) {
                throw new InvalidContentException("content " + key + " needs a vector or lexical fields");
            }
            repository.upsert(merged);
            if (merged.hasLexical() && (existing == null || !Objects.equals(existing.getLexical(), merged.getLexical()))) {
                lexicalIndex.index(key, merged.getLexical());
            }
            contents.put(key, merged);
            if (merged.hasVector() && (existing == null || existing.getVectorRevision() != merged.getVectorRevision())) {
                pendingVectors.put(key, merged.getVectorRevision());
            }
            return existing == null ? UpsertResult.CREATED : UpsertResult.UPDATED;
        });
        meterRegistry.counter("search.index.upserts", "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
        log.debug("content_upserted key={} outcome={}", key, outcome);
        return outcome;
    }

    public boolean remove(ContentKey key) {
        Objects.requireNonNull(key, "key");
        boolean removed = withKeyLock(key, () -> {
            boolean deleted = repository.delete(key);
            IndexedContent existing = contents.remove(key);
            if (existing != null) {
                lexicalIndex.remove(key);
            }
            pendingVectors.remove(key);
            return deleted || existing != null;
        });
        if (removed) {
            meterRegistry.counter("search.index.removals").increment();
            log.debug("content_removed key={}", key);
        }
        return removed;
    }

    public int restore(List<ContentIndexRepository.StoredRow> rows) {
        int restored = 0;
        for (ContentIndexRepository.StoredRow row : rows) {
            if (row.vector() != null && row.vector().length != properties.getDimension()) {
                log.warn(
                    "content_restore_skipped_vector key={} dimension={} expected={}",
                    row.key(),
                    row.vector().length,
                    properties.getDimension()
                );
            }
            float[] vector = row.vector() != null && row.vector().length == properties.getDimension() ? row.vector() : null;
            if (vector == null && row.lexical() == null) {
                continue;
            }
            long revision = vector == null ? 0L : vectorRevisions.incrementAndGet();
            IndexedContent content = new IndexedContent(
                row.key(),
                vector,
                row.contentText(),
                row.lexical(),
                row.metadata(),
                revision,
                row.updatedAt()
            );
            boolean published = withKeyLock(row.key(), () -> {
                if (contents.containsKey(row.key())) {
                    return false;
                }
                if (content.hasLexical()) {
                    lexicalIndex.stage(row.key(), content.getLexical());
                }
                contents.put(row.key(), content);
                if (content.hasVector()) {
                    pendingVectors.put(row.key(), content.getVectorRevision());
                }
                return true;
            });
            if (published) {
                restored++;
            }
        }
        lexicalIndex.refresh();
        return restored;
    }

    public IndexedContent get(ContentKey key) {
        return key == null ? null : contents.get(key);
    }

    public Collection<IndexedContent> all() {
        return Collections.unmodifiableCollection(contents.values());
    }

    public int size() {
        return contents.size();
    }

    public int dimension() {
        return properties.getDimension();
    }

    public Map<ContentType, Integer> countsByType() {
        Map<ContentType, Integer> counts = new EnumMap<>(ContentType.class);
        for (IndexedContent content : contents.values()) {
            counts.merge(content.getKey().contentType(), 1, Integer::sum);
        }
        return counts;
    }

    public int vectorCount() {
        int count = 0;
        for (IndexedContent content : contents.values()) {
            if (content.hasVector()) {
                count++;
            }
        }
        return count;
    }

    public Set<ContentKey> pendingVectorKeys() {
        return Collections.unmodifiableSet(pendingVectors.keySet());
    }

    public int pendingVectorCount() {
        return pendingVectors.size();
    }

    public void acknowledgeIndexed(Map<ContentKey, Long> indexedRevisions) {
        for (Map.Entry<ContentKey, Long> entry : indexedRevisions.entrySet()) {
            pendingVectors.remove(entry.getKey(), entry.getValue());
        }
    }

    public Map<ContentKey, Long> pendingVectorsSnapshot() {
        return new HashMap<>(pendingVectors);
    }

    private void validate(UpsertCommand command) {
        if (command == null || command.key() == null) {
            throw new InvalidContentException("content key is required");
        }
        String contentId = command.key().contentId();
        if (contentId.isBlank()) {
            throw new InvalidContentException("content_id must not be blank");
        }
        if (command.vector() == null && command.lexical() == null && command.metadata() == null
            && command.contentText() == null) {
            throw new InvalidContentException("upsert for " + command.key() + " carries no content");
        }
        float[] vector = command.vector();
        if (vector != null) {
            if (vector.length != properties.getDimension()) {
                throw new DimensionMismatchException(properties.getDimension(), vector.length);
            }
            for (float value : vector) {
                if (!Float.isFinite(value)) {
                    throw new InvalidContentException("vector for " + command.key() + " contains non-finite values");
                }
            }
        }
        LexicalFields lexical = command.lexical();
        if (lexical != null && (lexical.getTitle() == null || lexical.getTitle().isBlank())) {
            throw new InvalidContentException("lexical fields for " + command.key() + " need a title");
        }
    }

    private IndexedContent merge(IndexedContent existing, UpsertCommand command) {
        float[] vector = command.vector() != null ? command.vector() : existing == null ? null : existing.vectorView();
        String contentText = command.contentText() != null
            ? command.contentText()
            : existing == null ? null : existing.getContentText();
        LexicalFields lexical = command.lexical() != null
            ? command.lexical()
            : existing == null ? null : existing.getLexical();
        Map<String, Object> metadata = command.metadata() != null
            ? command.metadata()
            : existing == null ? Map.of() : existing.getMetadata();

        long revision;
        if (vector == null) {
            revision = 0L;
        } else if (existing != null && Arrays.equals(existing.vectorView(), vector)) {
            revision = existing.getVectorRevision();
        } else {
            revision = vectorRevisions.incrementAndGet();
        }
        Instant now = clock.instant();
        return new IndexedContent(command.key(), vector, contentText, lexical, metadata, revision, now);
    }

    private <T> T withKeyLock(ContentKey key, Supplier<T> action) {
        KeyLock keyLock = keyLocks.compute(key, (k, current) -> {
            KeyLock target = current == null ? new KeyLock() : current;
            target.holders++;
            return target;
        });
        keyLock.lock.lock();
        try {
            return action.get();
        } finally {
            keyLock.lock.unlock();
            keyLocks.computeIfPresent(key, (k, current) -> --current.holders == 0 ? null : current);
        }
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
