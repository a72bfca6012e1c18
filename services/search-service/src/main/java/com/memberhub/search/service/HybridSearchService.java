package com.memberhub.search.service;

import com.memberhub.search.filter.MetadataFilter;
import com.memberhub.search.filter.MetadataFilters;
import com.memberhub.search.index.ContentIndexStore;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.DimensionMismatchException;
import com.memberhub.search.merge.FusedHit;
import com.memberhub.search.merge.FusionMethod;
import com.memberhub.search.merge.FusionPolicyProperties;
import com.memberhub.search.merge.RrfFusion;
import com.memberhub.search.merge.WeightedFusion;
import com.memberhub.search.querylog.QueryKind;
import com.memberhub.search.querylog.QueryLogService;
import com.memberhub.search.querylog.QueryRecord;
import com.memberhub.search.retrieval.LexicalHit;
import com.memberhub.search.retrieval.LexicalRankingEngine;
import com.memberhub.search.retrieval.SemanticHit;
import com.memberhub.search.retrieval.SimilarityEngine;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class HybridSearchService {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

    private final SimilarityEngine similarityEngine;
    private final LexicalRankingEngine lexicalEngine;
    private final ContentIndexStore store;
    private final FusionPolicyProperties fusionPolicy;
    private final SearchLimitsProperties limits;
    private final QueryLogService queryLogService;
    private final ExecutorService searchExecutor;
    private final MeterRegistry meterRegistry;

    public HybridSearchService(
        SimilarityEngine similarityEngine,
        LexicalRankingEngine lexicalEngine,
        ContentIndexStore store,
        FusionPolicyProperties fusionPolicy,
        SearchLimitsProperties limits,
        QueryLogService queryLogService,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        MeterRegistry meterRegistry
    ) {
        this.similarityEngine = similarityEngine;
        this.lexicalEngine = lexicalEngine;
        this.store = store;
        this.fusionPolicy = fusionPolicy;
        this.limits = limits;
        this.queryLogService = queryLogService;
        this.searchExecutor = searchExecutor;
        this.meterRegistry = meterRegistry;
    }

    public SearchOutcome<SemanticHit> semanticSearch(SemanticSearch query) {
        if (query == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        requireVector(query.queryVector());
        int limit = limits.resolveLimit(query.limit(), limits.getDefaultLimit());
        double minSimilarity = resolveMinSimilarity(query.minSimilarity());

        long started = System.nanoTime();
        List<SemanticHit> hits = similarityEngine.search(
            query.queryVector(),
            query.contentTypes(),
            query.filters(),
            limit,
            minSimilarity,
            null
        );
        long tookMs = elapsedMs(started);

        SemanticHit top = hits.isEmpty() ? null : hits.get(0);
        String logId = logQuery(
            query.issuedBy(),
            query.queryText(),
            QueryKind.SEMANTIC,
            query.contentTypes(),
            query.filters(),
            hits.size(),
            top == null ? null : top.key().contentId(),
            top == null ? null : top.similarity(),
            tookMs
        );
        record(QueryKind.SEMANTIC, hits.size(), tookMs);
        return new SearchOutcome<>(hits, logId, tookMs);
    }

    public SearchOutcome<LexicalHit> lexicalSearch(LexicalSearch query) {
        if (query == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        if (query.queryText() == null || query.queryText().isBlank()) {
            throw new InvalidSearchRequestException("query_text is required");
        }
        int limit = limits.resolveLimit(query.limit(), limits.getDefaultLimit());

        long started = System.nanoTime();
        List<LexicalHit> hits = lexicalEngine.search(query.queryText(), query.contentTypes(), query.filters(), limit);
        long tookMs = elapsedMs(started);

        LexicalHit top = hits.isEmpty() ? null : hits.get(0);
        String logId = logQuery(
            query.issuedBy(),
            query.queryText(),
            QueryKind.LEXICAL,
            query.contentTypes(),
            query.filters(),
            hits.size(),
            top == null ? null : top.key().contentId(),
            top == null ? null : top.rank(),
            tookMs
        );
        record(QueryKind.LEXICAL, hits.size(), tookMs);
        return new SearchOutcome<>(hits, logId, tookMs);
    }

    public SearchOutcome<FusedHit> hybridSearch(HybridSearch query) {
        if (query == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        requireVector(query.queryVector());
        int limit = limits.resolveLimit(query.limit(), limits.getDefaultLimit());
        double keywordWeight = resolveWeight("keyword_weight", query.keywordWeight(), fusionPolicy.getDefaultKeywordWeight());
        double semanticWeight = resolveWeight(
            "semantic_weight",
            query.semanticWeight(),
            fusionPolicy.getDefaultSemanticWeight()
        );
        if (keywordWeight == 0.0 && semanticWeight == 0.0) {
            throw new InvalidSearchRequestException("at least one of keyword_weight and semantic_weight must be > 0");
        }
        FusionMethod method = query.fusionMethod() != null ? query.fusionMethod() : defaultMethod();

        long started = System.nanoTime();
        List<FusedHit> hits;
        if (limit == 0) {
            hits = List.of();
        } else {
            int candidates = fusionPolicy.candidatesFor(limit);
            String text = query.queryText();
            CompletableFuture<List<LexicalHit>> lexicalFuture = text == null || text.isBlank()
                ? CompletableFuture.completedFuture(List.of())
                : CompletableFuture.supplyAsync(
                    () -> lexicalEngine.search(text, query.contentTypes(), query.filters(), candidates),
                    searchExecutor
                );
            CompletableFuture<List<SemanticHit>> semanticFuture = CompletableFuture.supplyAsync(
                () -> similarityEngine.search(
                    query.queryVector(),
                    query.contentTypes(),
                    query.filters(),
                    candidates,
                    0.0,
                    null
                ),
                searchExecutor
            );
            List<LexicalHit> lexical = await(lexicalFuture);
            List<SemanticHit> semantic = await(semanticFuture);
            hits = fuse(method, lexical, semantic, keywordWeight, semanticWeight, limit);
            log.debug(
                "hybrid_fused method={} lexical={} semantic={} returned={}",
                method.getTag(),
                lexical.size(),
                semantic.size(),
                hits.size()
            );
        }
        long tookMs = elapsedMs(started);

        FusedHit top = hits.isEmpty() ? null : hits.get(0);
        String logId = logQuery(
            query.issuedBy(),
            query.queryText(),
            QueryKind.HYBRID,
            query.contentTypes(),
            query.filters(),
            hits.size(),
            top == null ? null : top.getKey().contentId(),
            top == null ? null : top.getCombinedScore(),
            tookMs
        );
        record(QueryKind.HYBRID, hits.size(), tookMs);
        return new SearchOutcome<>(hits, logId, tookMs);
    }

    private List<FusedHit> fuse(
        FusionMethod method,
        List<LexicalHit> lexical,
        List<SemanticHit> semantic,
        double keywordWeight,
        double semanticWeight,
        int limit
    ) {
        return switch (method) {
            case RRF -> RrfFusion.fuse(lexical, semantic, fusionPolicy.getRrfK(), keywordWeight, semanticWeight, limit);
            case NORMALIZED -> WeightedFusion.fuseNormalized(lexical, semantic, keywordWeight, semanticWeight, limit);
            case WEIGHTED -> WeightedFusion.fuse(lexical, semantic, keywordWeight, semanticWeight, limit);
        };
    }

    private FusionMethod defaultMethod() {
        FusionMethod configured = FusionMethod.fromString(fusionPolicy.getDefaultMethod());
        return configured == null ? FusionMethod.WEIGHTED : configured;
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(30, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("search stage failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("search interrupted", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IllegalStateException("search stage timed out", e);
        }
    }

    private void requireVector(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new InvalidSearchRequestException("query_vector is required");
        }
        if (vector.length != store.dimension()) {
            throw new DimensionMismatchException(store.dimension(), vector.length);
        }
        for (float value : vector) {
            if (!Float.isFinite(value)) {
                throw new InvalidSearchRequestException("query_vector contains non-finite values");
            }
        }
    }

    private double resolveMinSimilarity(Double requested) {
        if (requested == null) {
            return limits.getDefaultMinSimilarity();
        }
        if (requested.isNaN() || requested < 0.0 || requested > 1.0) {
            throw new InvalidSearchRequestException("min_similarity must be within [0, 1]");
        }
        return requested;
    }

    private static double resolveWeight(String name, Double requested, double fallback) {
        double value = requested == null ? fallback : requested;
        if (!Double.isFinite(value) || value < 0.0) {
            throw new InvalidSearchRequestException(name + " must be a finite number >= 0");
        }
        return value;
    }

    private String logQuery(
        String issuedBy,
        String queryText,
        QueryKind kind,
        Set<ContentType> types,
        List<MetadataFilter> filters,
        int resultCount,
        String topResultId,
        Double topResultScore,
        long latencyMs
    ) {
        try {
            return queryLogService.recordQueryAsync(new QueryRecord(
                issuedBy,
                queryText,
                kind,
                appliedFilters(types, filters),
                resultCount,
                topResultId,
                topResultScore,
                latencyMs
            ));
        } catch (RuntimeException e) {
            meterRegistry.counter("search.querylog.failures", "operation", "submit").increment();
            log.warn("query_log_submit_failed kind={} message={}", kind.getTag(), e.getMessage());
            return null;
        }
    }

    private static List<Map<String, Object>> appliedFilters(Set<ContentType> types, List<MetadataFilter> filters) {
        List<Map<String, Object>> applied = new ArrayList<>();
        if (types != null && !types.isEmpty()) {
            Map<String, Object> typeFilter = new LinkedHashMap<>();
            typeFilter.put("type", "content_type");
            typeFilter.put("values", types.stream().map(ContentType::getTag).sorted().toList());
            applied.add(typeFilter);
        }
        applied.addAll(MetadataFilters.describe(filters));
        return applied;
    }

    private void record(QueryKind kind, int resultCount, long tookMs) {
        meterRegistry.timer("search.query.latency", "kind", kind.getTag()).record(tookMs, TimeUnit.MILLISECONDS);
        if (resultCount == 0) {
            meterRegistry.counter("search.query.zero_results", "kind", kind.getTag()).increment();
        }
    }

    private static long elapsedMs(long started) {
        return (System.nanoTime() - started) / 1_000_000L;
    }
}
