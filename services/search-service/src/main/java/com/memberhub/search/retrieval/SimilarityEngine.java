package com.memberhub.search.retrieval;

import com.memberhub.search.filter.MetadataFilter;
import com.memberhub.search.index.ContentIndexStore;
import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.DimensionMismatchException;
import com.memberhub.search.index.IndexedContent;
import com.memberhub.search.retrieval.ann.AnnIndex;
import com.memberhub.search.retrieval.ann.VectorIndexMaintenance;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SimilarityEngine {
    private static final Logger log = LoggerFactory.getLogger(SimilarityEngine.class);

    static final Comparator<SemanticHit> ORDER = Comparator
        .comparingDouble(SemanticHit::similarity).reversed()
        .thenComparing(SemanticHit::key);

    private final ContentIndexStore store;
    private final VectorIndexMaintenance maintenance;
    private final VectorSearchProperties properties;
    private final MeterRegistry meterRegistry;

    public SimilarityEngine(
        ContentIndexStore store,
        VectorIndexMaintenance maintenance,
        VectorSearchProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.store = store;
        this.maintenance = maintenance;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public List<SemanticHit> search(
        float[] queryVector,
        Set<ContentType> types,
        List<MetadataFilter> filters,
        int limit,
        double minSimilarity,
        ContentKey exclude
    ) {
        Objects.requireNonNull(queryVector, "queryVector");
        if (queryVector.length != store.dimension()) {
            throw new DimensionMismatchException(store.dimension(), queryVector.length);
        }
        if (limit <= 0) {
            return List.of();
        }
        boolean filtered = (types != null && !types.isEmpty()) || (filters != null && !filters.isEmpty());

        AnnIndex ann = maintenance.activeIndex();
        if (ann != null && ann.size() >= properties.getExactScanThreshold() && !VectorMath.isZero(queryVector)) {
            List<SemanticHit> hits = rank(
                approximateCandidates(ann, queryVector, limit, filtered, exclude),
                queryVector,
                types,
                filters,
                limit,
                minSimilarity,
                exclude
            );
            // filtered graph results can run dry before the limit; fall back to a full scan
            if (hits.size() >= limit || !filtered) {
                meterRegistry.counter("search.semantic.queries", "path", "ann").increment();
                return hits;
            }
            log.debug("semantic_ann_fallback returned={} limit={}", hits.size(), limit);
        }
        meterRegistry.counter("search.semantic.queries", "path", "exact").increment();
        return rank(store.all(), queryVector, types, filters, limit, minSimilarity, exclude);
    }

    private List<IndexedContent> approximateCandidates(
        AnnIndex ann,
        float[] queryVector,
        int limit,
        boolean filtered,
        ContentKey exclude
    ) {
        int wanted = Math.max(limit + (exclude == null ? 0 : 1), properties.getAnn().getCandidateListSize());
        if (filtered) {
            wanted *= Math.max(1, properties.getAnn().getFilteredCandidateMultiplier());
        }
        Set<ContentKey> keys = new LinkedHashSet<>(ann.search(queryVector, wanted));
        keys.addAll(store.pendingVectorKeys());

        List<IndexedContent> candidates = new ArrayList<>(keys.size());
        for (ContentKey key : keys) {
            IndexedContent content = store.get(key);
            if (content != null) {
                candidates.add(content);
            }
        }
        return candidates;
    }

    private List<SemanticHit> rank(
        Iterable<IndexedContent> candidates,
        float[] queryVector,
        Set<ContentType> types,
        List<MetadataFilter> filters,
        int limit,
        double minSimilarity,
        ContentKey exclude
    ) {
        List<SemanticHit> hits = new ArrayList<>();
        for (IndexedContent content : candidates) {
            ContentKey key = content.getKey();
            if (!content.hasVector() || key.equals(exclude)) {
                continue;
            }
            if (types != null && !types.isEmpty() && !types.contains(key.contentType())) {
                continue;
            }
            if (!MetadataFilter.allMatch(filters, content.getMetadata())) {
                continue;
            }
            double similarity = VectorMath.similarity(queryVector, content.vectorView());
            if (similarity < minSimilarity) {
                continue;
            }
            hits.add(new SemanticHit(key, similarity, content.getContentText(), content.title(), content.getMetadata()));
        }
        hits.sort(ORDER);
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }
}
