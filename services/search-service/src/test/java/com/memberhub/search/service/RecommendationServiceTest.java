package com.memberhub.search.service;

import static com.memberhub.search.support.IndexFixtures.key;
import static com.memberhub.search.support.IndexFixtures.lexical;
import static com.memberhub.search.support.IndexFixtures.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.retrieval.SemanticHit;
import com.memberhub.search.retrieval.SimilarityEngine;
import com.memberhub.search.support.IndexFixtures;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecommendationServiceTest {
    private IndexFixtures fixtures;
    private RecommendationService service;

    @BeforeEach
    void setUp() {
        fixtures = new IndexFixtures(2);
        SimilarityEngine engine = new SimilarityEngine(
            fixtures.store,
            fixtures.maintenance,
            fixtures.vectorProperties,
            fixtures.meterRegistry
        );
        service = new RecommendationService(fixtures.store, engine, new SearchLimitsProperties());
    }

    @Test
    void neighboursExcludeSourceAndHaveNoSimilarityFloor() {
        ContentKey source = key(ContentType.COURSE, "source");
        fixtures.putVector(source, vector(1f, 0f), Map.of());
        fixtures.putVector(key(ContentType.COURSE, "twin"), vector(2f, 0f), Map.of());
        fixtures.putVector(key(ContentType.COURSE, "near"), vector(0.8f, 0.6f), Map.of());
        fixtures.putVector(key(ContentType.EVENT, "opposite"), vector(-1f, 0f), Map.of());

        List<SemanticHit> hits = service.findSimilar(source, null, null);

        assertThat(hits).extracting(hit -> hit.key().contentId()).containsExactly("twin", "near", "opposite");
        assertThat(hits.get(2).similarity()).isZero();
    }

    @Test
    void typesAndLimitNarrowTheNeighbours() {
        ContentKey source = key(ContentType.COURSE, "source");
        fixtures.putVector(source, vector(1f, 0f), Map.of());
        for (int i = 0; i < 8; i++) {
            fixtures.putVector(key(ContentType.LESSON, "lesson-" + i), vector(1f, i * 0.1f), Map.of());
        }
        fixtures.putVector(key(ContentType.EVENT, "event"), vector(1f, 0f), Map.of());

        assertThat(service.findSimilar(source, null, null)).hasSize(5);
        assertThat(service.findSimilar(source, 3, Set.of(ContentType.LESSON)))
            .extracting(hit -> hit.key().contentId())
            .containsExactly("lesson-0", "lesson-1", "lesson-2");
    }

    @Test
    void itemWithoutVectorHasNoRecommendations() {
        ContentKey textOnly = key(ContentType.FAQ, "text-only");
        fixtures.putLexical(textOnly, lexical("Refund policy", null, null), Map.of());

        assertThatThrownBy(() -> service.findSimilar(textOnly, null, null))
            .isInstanceOf(EmbeddingNotFoundException.class);
        assertThatThrownBy(() -> service.findSimilar(key(ContentType.FAQ, "missing"), null, null))
            .isInstanceOf(EmbeddingNotFoundException.class);
        assertThatThrownBy(() -> service.findSimilar(null, null, null))
            .isInstanceOf(InvalidSearchRequestException.class);
    }
}
