package com.memberhub.search.service;

import com.memberhub.search.index.ContentIndexStore;
import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.IndexedContent;
import com.memberhub.search.retrieval.SemanticHit;
import com.memberhub.search.retrieval.SimilarityEngine;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Service;

@Service
public class RecommendationService {
    private final ContentIndexStore store;
    private final SimilarityEngine similarityEngine;
    private final SearchLimitsProperties limits;

    public RecommendationService(ContentIndexStore store, SimilarityEngine similarityEngine, SearchLimitsProperties limits) {
        this.store = store;
        this.similarityEngine = similarityEngine;
        this.limits = limits;
    }

    public List<SemanticHit> findSimilar(ContentKey source, Integer limit, Set<ContentType> contentTypes) {
        if (source == null) {
            throw new InvalidSearchRequestException("content type and id are required");
        }
        int resolvedLimit = limits.resolveLimit(limit, limits.getDefaultRecommendationLimit());
        IndexedContent content = store.get(source);
        if (content == null || !content.hasVector()) {
            throw new EmbeddingNotFoundException(source);
        }
        return similarityEngine.search(content.copyVector(), contentTypes, List.of(), resolvedLimit, 0.0, source);
    }
}
