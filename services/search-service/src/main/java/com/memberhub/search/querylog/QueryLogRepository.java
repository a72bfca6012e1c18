package com.memberhub.search.querylog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memberhub.search.common.JdbcUtils;
import com.memberhub.search.common.JsonUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class QueryLogRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public QueryLogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void insert(QueryLogEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO search_query (id, member_id, query_text, query_kind, filters_json, result_count, "
                + "top_result_id, top_result_score, latency_ms, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entry.id(),
            entry.issuedBy(),
            entry.queryText(),
            entry.queryKind().getTag(),
            JsonUtils.toJson(objectMapper, entry.appliedFilters() == null ? List.of() : entry.appliedFilters()),
            entry.resultCount(),
            entry.topResultId(),
            entry.topResultScore(),
            entry.latencyMs(),
            JdbcUtils.asTimestamp(entry.createdAt())
        );
    }

    public boolean insertClick(String queryId, String contentId, Instant clickedAt, Instant notBefore) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO search_query_click (query_id, content_id, clicked_at) "
                + "SELECT id, ?, ? FROM search_query WHERE id = ? AND created_at >= ?",
            contentId,
            JdbcUtils.asTimestamp(clickedAt),
            queryId,
            JdbcUtils.asTimestamp(notBefore)
        );
        return inserted > 0;
    }

    public QueryLogEntry findById(String id) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT id, member_id, query_text, query_kind, filters_json, result_count, top_result_id, "
                + "top_result_score, latency_ms, created_at FROM search_query WHERE id = ?",
            id
        );
        if (rows.isEmpty()) {
            return null;
        }
        return toEntry(rows.get(0), findClicks(id));
    }

    public List<String> findClicks(String queryId) {
        return jdbcTemplate.queryForList(
            "SELECT content_id FROM search_query_click WHERE query_id = ? ORDER BY clicked_at, click_id",
            String.class,
            queryId
        );
    }

    public List<QueryLogEntry> findByMember(String memberId, int limit) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT id, member_id, query_text, query_kind, filters_json, result_count, top_result_id, "
                + "top_result_score, latency_ms, created_at FROM search_query WHERE member_id = ? "
                + "ORDER BY created_at DESC, id LIMIT ?",
            memberId,
            limit
        );
        List<QueryLogEntry> entries = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            entries.add(toEntry(row, findClicks(JdbcUtils.asString(row.get("id")))));
        }
        return entries;
    }

    public List<QueryKindStats> stats(Instant since) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT q.query_kind, COUNT(*) AS query_count, AVG(q.latency_ms) AS avg_latency_ms, "
                + "SUM(CASE WHEN q.result_count = 0 THEN 1 ELSE 0 END) AS zero_result_count, "
                + "SUM(CASE WHEN EXISTS (SELECT 1 FROM search_query_click c WHERE c.query_id = q.id) "
                + "THEN 1 ELSE 0 END) AS clicked_count "
                + "FROM search_query q WHERE q.created_at >= ? GROUP BY q.query_kind ORDER BY q.query_kind",
            JdbcUtils.asTimestamp(since)
        );
        List<QueryKindStats> stats = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            QueryKind kind = QueryKind.fromTag(JdbcUtils.asString(row.get("query_kind")));
            if (kind == null) {
                continue;
            }
            Long count = JdbcUtils.asLong(row.get("query_count"));
            Double latency = JdbcUtils.asDouble(row.get("avg_latency_ms"));
            Long zero = JdbcUtils.asLong(row.get("zero_result_count"));
            Long clicked = JdbcUtils.asLong(row.get("clicked_count"));
            stats.add(new QueryKindStats(
                kind,
                count == null ? 0L : count,
                latency == null ? 0.0 : latency,
                zero == null ? 0L : zero,
                clicked == null ? 0L : clicked
            ));
        }
        return stats;
    }

    private QueryLogEntry toEntry(Map<String, Object> row, List<String> clicks) {
        Integer resultCount = JdbcUtils.asInt(row.get("result_count"));
        Long latency = JdbcUtils.asLong(row.get("latency_ms"));
        return new QueryLogEntry(
            JdbcUtils.asString(row.get("id")),
            JdbcUtils.asString(row.get("member_id")),
            JdbcUtils.asString(row.get("query_text")),
            QueryKind.fromTag(JdbcUtils.asString(row.get("query_kind"))),
            JsonUtils.readMapList(objectMapper, JdbcUtils.asString(row.get("filters_json"))),
            resultCount == null ? 0 : resultCount,
            JdbcUtils.asString(row.get("top_result_id")),
            JdbcUtils.asDouble(row.get("top_result_score")),
            latency == null ? 0L : latency,
            clicks,
            JdbcUtils.asInstant(row.get("created_at"))
        );
    }
}
