package com.memberhub.search.retrieval;

import static com.memberhub.search.support.IndexFixtures.key;
import static com.memberhub.search.support.IndexFixtures.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.memberhub.search.filter.MetadataFilters;
import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.DimensionMismatchException;
import com.memberhub.search.support.IndexFixtures;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimilarityEngineTest {

    private IndexFixtures fixtures;
    private SimilarityEngine engine;

    @BeforeEach
    void setUp() {
        fixtures = new IndexFixtures(3);
        engine = new SimilarityEngine(fixtures.store, fixtures.maintenance, fixtures.vectorProperties, fixtures.meterRegistry);
    }

    @Test
    void ranksByCosineSimilarityAndAppliesThreshold() {
        fixtures.putVector(key(ContentType.ARTICLE, "same"), vector(1f, 0f, 0f), Map.of());
        fixtures.putVector(key(ContentType.ARTICLE, "close"), vector(1f, 1f, 0f), Map.of());
        fixtures.putVector(key(ContentType.ARTICLE, "orthogonal"), vector(0f, 0f, 1f), Map.of());
        fixtures.putVector(key(ContentType.ARTICLE, "opposite"), vector(-1f, 0f, 0f), Map.of());

        List<SemanticHit> all = engine.search(vector(1f, 0f, 0f), null, null, 10, 0.0, null);
        List<SemanticHit> strict = engine.search(vector(1f, 0f, 0f), null, null, 10, 0.7, null);

        assertThat(all).extracting(hit -> hit.key().contentId())
            .containsExactly("same", "close", "opposite", "orthogonal");
        assertThat(all.get(0).similarity()).isCloseTo(1.0, within(1e-9));
        assertThat(all.get(1).similarity()).isCloseTo(Math.sqrt(0.5), within(1e-6));
        assertThat(all.get(2).similarity()).isZero();
        assertThat(strict).extracting(hit -> hit.key().contentId()).containsExactly("same", "close");
        assertThat(strict).allSatisfy(hit -> assertThat(hit.similarity()).isGreaterThanOrEqualTo(0.7));
    }

    @Test
    void equalSimilarityBreaksTiesByIdThenType() {
        fixtures.putVector(key(ContentType.EVENT, "x"), vector(0f, 1f, 0f), Map.of());
        fixtures.putVector(key(ContentType.ARTICLE, "x"), vector(0f, 2f, 0f), Map.of());
        fixtures.putVector(key(ContentType.ARTICLE, "b"), vector(0f, 3f, 0f), Map.of());

        List<SemanticHit> hits = engine.search(vector(0f, 1f, 0f), null, null, 10, 0.0, null);

        assertThat(hits).extracting(SemanticHit::key).containsExactly(
            key(ContentType.ARTICLE, "b"),
            key(ContentType.EVENT, "x"),
            key(ContentType.ARTICLE, "x")
        );
    }

    @Test
    void filtersExcludeItemsBeforeRanking() {
        fixtures.putVector(key(ContentType.EVENT, "e1"), vector(1f, 0f, 0f), Map.of("chapter", "north"));
        fixtures.putVector(key(ContentType.EVENT, "e2"), vector(1f, 0.1f, 0f), Map.of("chapter", "south"));
        fixtures.putVector(key(ContentType.COURSE, "c1"), vector(1f, 0f, 0f), Map.of("chapter", "south"));

        List<SemanticHit> hits = engine.search(
            vector(1f, 0f, 0f),
            Set.of(ContentType.EVENT),
            MetadataFilters.parse(null, Map.of("chapter", "south")),
            10,
            0.0,
            null
        );

        assertThat(hits).extracting(SemanticHit::key).containsExactly(key(ContentType.EVENT, "e2"));
    }

    @Test
    void limitCapsResultsAndExcludedKeyIsSkipped() {
        ContentKey source = key(ContentType.DOCUMENT, "d0");
        fixtures.putVector(source, vector(1f, 0f, 0f), Map.of());
        for (int i = 1; i <= 5; i++) {
            fixtures.putVector(key(ContentType.DOCUMENT, "d" + i), vector(1f, i, 0f), Map.of());
        }

        List<SemanticHit> hits = engine.search(vector(1f, 0f, 0f), null, null, 3, 0.0, source);

        assertThat(hits).hasSize(3);
        assertThat(hits).extracting(SemanticHit::key).doesNotContain(source);
        assertThat(engine.search(vector(1f, 0f, 0f), null, null, 0, 0.0, null)).isEmpty();
    }

    @Test
    void queryVectorOfWrongDimensionIsRejected() {
        assertThatThrownBy(() -> engine.search(vector(1f, 0f), null, null, 5, 0.0, null))
            .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void approximateIndexCandidatesAreRescoredAndMergedWithPendingVectors() {
        fixtures.vectorProperties.setExactScanThreshold(0);
        for (int i = 0; i < 40; i++) {
            float angle = (float) (i * Math.PI / 80);
            fixtures.putVector(
                key(ContentType.ARTICLE, String.format("a%02d", i)),
                vector((float) Math.cos(angle), (float) Math.sin(angle), 0.1f),
                Map.of()
            );
        }
        assertThat(fixtures.maintenance.rebuildNow()).isTrue();
        assertThat(fixtures.store.pendingVectorCount()).isZero();

        ContentKey fresh = key(ContentType.EVENT, "fresh");
        fixtures.putVector(fresh, vector(1f, 0f, 0f), Map.of());
        fixtures.store.remove(key(ContentType.ARTICLE, "a00"));

        List<SemanticHit> hits = engine.search(vector(1f, 0f, 0f), null, null, 5, 0.0, null);

        assertThat(hits).hasSize(5);
        assertThat(hits.get(0).key()).isEqualTo(fresh);
        assertThat(hits).extracting(SemanticHit::key).doesNotContain(key(ContentType.ARTICLE, "a00"));
        for (int i = 1; i < hits.size(); i++) {
            assertThat(hits.get(i - 1).similarity()).isGreaterThanOrEqualTo(hits.get(i).similarity());
        }
        assertThat(fixtures.meterRegistry.counter("search.semantic.queries", "path", "ann").count()).isEqualTo(1.0);
    }

    @Test
    void filteredApproximateSearchFallsBackToExactScanWhenShort() {
        fixtures.vectorProperties.setExactScanThreshold(0);
        fixtures.vectorProperties.getAnn().setCandidateListSize(2);
        fixtures.vectorProperties.getAnn().setFilteredCandidateMultiplier(1);
        for (int i = 0; i < 20; i++) {
            fixtures.putVector(key(ContentType.ARTICLE, "a" + i), vector(1f, i * 0.01f, 0f), Map.of("kind", "news"));
        }
        fixtures.putVector(key(ContentType.ARTICLE, "far"), vector(0f, 0f, 1f), Map.of("kind", "report"));
        fixtures.maintenance.rebuildNow();

        List<SemanticHit> hits = engine.search(
            vector(1f, 0f, 0f),
            null,
            MetadataFilters.parse(null, Map.of("kind", "report")),
            1,
            0.0,
            null
        );

        assertThat(hits).extracting(hit -> hit.key().contentId()).containsExactly("far");
    }

    @Test
    void zeroQueryVectorScansEveryItemEvenWithApproximateIndex() {
        fixtures.vectorProperties.setExactScanThreshold(0);
        for (int i = 0; i < 5; i++) {
            fixtures.putVector(key(ContentType.LESSON, "l" + i), vector(1f, i, 0f), Map.of());
        }
        assertThat(fixtures.maintenance.rebuildNow()).isTrue();

        List<SemanticHit> hits = engine.search(vector(0f, 0f, 0f), null, null, 10, 0.0, null);

        assertThat(hits).extracting(hit -> hit.key().contentId()).containsExactly("l0", "l1", "l2", "l3", "l4");
        assertThat(hits).allSatisfy(hit -> assertThat(hit.similarity()).isZero());
        assertThat(fixtures.meterRegistry.counter("search.semantic.queries", "path", "exact").count()).isEqualTo(1.0);
        assertThat(fixtures.meterRegistry.counter("search.semantic.queries", "path", "ann").count()).isZero();
    }
}
