package com.memberhub.search.api;

import com.memberhub.search.api.dto.QueryKindStatsDto;
import com.memberhub.search.api.dto.QueryLogEntryDto;
import com.memberhub.search.api.dto.RecordClickRequest;
import com.memberhub.search.api.dto.RecordQueryRequest;
import com.memberhub.search.querylog.QueryKind;
import com.memberhub.search.querylog.QueryKindStats;
import com.memberhub.search.querylog.QueryLogEntry;
import com.memberhub.search.querylog.QueryLogService;
import com.memberhub.search.querylog.QueryRecord;
import com.memberhub.search.service.InvalidSearchRequestException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class QueryLogController {
    private final QueryLogService queryLogService;
    private final Clock clock;

    public QueryLogController(QueryLogService queryLogService, Clock clock) {
        this.queryLogService = queryLogService;
        this.clock = clock;
    }

    @PostMapping("/query-log")
    public ResponseEntity<Map<String, Object>> record(@RequestBody(required = false) RecordQueryRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        QueryKind kind = QueryKind.fromTag(request.getQueryKind());
        if (kind == null) {
            throw new InvalidSearchRequestException("query_kind must be one of lexical, semantic, hybrid");
        }
        String id = queryLogService.recordQuery(new QueryRecord(
            request.getMemberId(),
            request.getQueryText(),
            kind,
            request.getFilters(),
            request.getResultCount() == null ? 0 : request.getResultCount(),
            request.getTopResultId(),
            request.getTopResultScore(),
            request.getLatencyMs() == null ? 0L : request.getLatencyMs()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    /**
     * Always answers 202; unknown or expired entries are ignored. Search responses hand out the
     * query log id before the entry is written, so a click sent right after a search can land
     * before its entry and is then reported as {@code recorded: false}.
     */
    @PostMapping("/query-log/{id}/clicks")
    public ResponseEntity<Map<String, Object>> click(
        @PathVariable("id") String id,
        @RequestBody(required = false) RecordClickRequest request
    ) {
        boolean recorded = request != null && queryLogService.recordClick(id, request.getContentId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("recorded", recorded));
    }

    @GetMapping("/query-log/{id}")
    public ResponseEntity<QueryLogEntryDto> find(@PathVariable("id") String id) {
        return queryLogService.findEntry(id)
            .map(ApiMapper::queryLogEntry)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/query-log/stats")
    public List<QueryKindStatsDto> stats(@RequestParam(value = "since", required = false) String since) {
        Instant from = parseSince(since);
        List<QueryKindStatsDto> result = new ArrayList<>();
        for (QueryKindStats stats : queryLogService.stats(from)) {
            QueryKindStatsDto dto = new QueryKindStatsDto();
            dto.setQueryKind(stats.queryKind().getTag());
            dto.setQueryCount(stats.queryCount());
            dto.setAverageLatencyMs(stats.averageLatencyMs());
            dto.setZeroResultCount(stats.zeroResultCount());
            dto.setClickedQueryCount(stats.clickedQueryCount());
            result.add(dto);
        }
        return result;
    }

    @GetMapping("/query-log/members/{memberId}")
    public List<QueryLogEntryDto> memberHistory(
        @PathVariable("memberId") String memberId,
        @RequestParam(value = "limit", defaultValue = "20") int limit
    ) {
        if (limit < 0) {
            throw new InvalidSearchRequestException("limit must be >= 0");
        }
        List<QueryLogEntryDto> result = new ArrayList<>();
        for (QueryLogEntry entry : queryLogService.recentQueries(memberId, limit)) {
            result.add(ApiMapper.queryLogEntry(entry));
        }
        return result;
    }

    private Instant parseSince(String since) {
        if (since == null || since.isBlank()) {
            return clock.instant().minus(Duration.ofDays(7));
        }
        try {
            return Instant.parse(since.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidSearchRequestException("since must be an ISO-8601 instant");
        }
    }
}
