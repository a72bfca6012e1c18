package com.memberhub.search.querylog;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class QueryLogService {
    private static final Logger log = LoggerFactory.getLogger(QueryLogService.class);

    private final QueryLogRepository repository;
    private final QueryLogProperties properties;
    private final Executor queryLogExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public QueryLogService(
        QueryLogRepository repository,
        QueryLogProperties properties,
        @Qualifier("queryLogExecutor") Executor queryLogExecutor,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.repository = repository;
        this.properties = properties;
        this.queryLogExecutor = queryLogExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public String recordQuery(QueryRecord record) {
        QueryLogEntry entry = newEntry(record);
        persist(entry);
        return entry.id();
    }

    /**
     * Returns the entry id at once and persists the record on the query-log executor. Until that
     * write lands the id is unknown to {@link #recordClick}, so an early click is dropped.
     */
    public String recordQueryAsync(QueryRecord record) {
        QueryLogEntry entry = newEntry(record);
        if (!properties.isEnabled()) {
            return entry.id();
        }
        try {
            queryLogExecutor.execute(() -> persist(entry));
        } catch (RejectedExecutionException e) {
            failed("rejected", entry.id(), e);
        }
        return entry.id();
    }

    public boolean recordClick(String logEntryId, String contentId) {
        if (!properties.isEnabled() || isBlank(logEntryId) || isBlank(contentId)) {
            return false;
        }
        Instant now = clock.instant();
        try {
            boolean stored = repository.insertClick(
                logEntryId.trim(),
                contentId.trim(),
                now,
                now.minus(properties.getClickWindow())
            );
            if (!stored) {
                log.debug("query_click_ignored query_id={} content_id={}", logEntryId, contentId);
            }
            return stored;
        } catch (RuntimeException e) {
            failed("click", logEntryId, e);
            return false;
        }
    }

    public Optional<QueryLogEntry> findEntry(String id) {
        if (isBlank(id)) {
            return Optional.empty();
        }
        return Optional.ofNullable(repository.findById(id.trim()));
    }

    public List<QueryLogEntry> recentQueries(String memberId, int limit) {
        if (isBlank(memberId) || limit <= 0) {
            return List.of();
        }
        return repository.findByMember(memberId.trim(), Math.min(limit, properties.getMaxRecentQueries()));
    }

    public List<QueryKindStats> stats(Instant since) {
        return repository.stats(since);
    }

    private QueryLogEntry newEntry(QueryRecord record) {
        return new QueryLogEntry(
            UUID.randomUUID().toString(),
            record.issuedBy(),
            record.queryText(),
            record.queryKind(),
            record.appliedFilters() == null ? List.of() : record.appliedFilters(),
            Math.max(0, record.resultCount()),
            record.topResultId(),
            record.topResultScore(),
            Math.max(0L, record.latencyMs()),
            List.of(),
            clock.instant()
        );
    }

    private void persist(QueryLogEntry entry) {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            repository.insert(entry);
            meterRegistry.counter("search.querylog.writes", "kind", entry.queryKind().getTag()).increment();
        } catch (RuntimeException e) {
            failed("insert", entry.id(), e);
        }
    }

    private void failed(String operation, String id, Exception e) {
        meterRegistry.counter("search.querylog.failures", "operation", operation).increment();
        log.warn("query_log_failed operation={} query_id={} message={}", operation, id, e.getMessage());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
