package com.memberhub.search.service;

import static com.memberhub.search.support.IndexFixtures.key;
import static com.memberhub.search.support.IndexFixtures.lexical;
import static com.memberhub.search.support.IndexFixtures.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.memberhub.search.filter.EqualsFilter;
import com.memberhub.search.filter.MetadataFilter;
import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.DimensionMismatchException;
import com.memberhub.search.merge.FusedHit;
import com.memberhub.search.merge.FusionMethod;
import com.memberhub.search.merge.FusionPolicyProperties;
import com.memberhub.search.querylog.QueryKind;
import com.memberhub.search.querylog.QueryLogService;
import com.memberhub.search.querylog.QueryRecord;
import com.memberhub.search.retrieval.LexicalHit;
import com.memberhub.search.retrieval.LexicalRankingEngine;
import com.memberhub.search.retrieval.SemanticHit;
import com.memberhub.search.retrieval.SimilarityEngine;
import com.memberhub.search.support.IndexFixtures;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class HybridSearchServiceTest {
    private static final float[] QUERY = {1f, 0f, 0f};

    private IndexFixtures fixtures;
    private LexicalRankingEngine lexicalEngine;
    private QueryLogService queryLogService;
    private ExecutorService executor;
    private HybridSearchService service;

    @BeforeEach
    void setUp() {
        fixtures = new IndexFixtures(3);
        SimilarityEngine similarityEngine = new SimilarityEngine(
            fixtures.store,
            fixtures.maintenance,
            fixtures.vectorProperties,
            fixtures.meterRegistry
        );
        lexicalEngine = new LexicalRankingEngine(fixtures.store, fixtures.lexicalIndex);
        queryLogService = mock(QueryLogService.class);
        when(queryLogService.recordQueryAsync(any())).thenReturn("log-1");
        executor = Executors.newFixedThreadPool(2);
        service = new HybridSearchService(
            similarityEngine,
            lexicalEngine,
            fixtures.store,
            new FusionPolicyProperties(),
            new SearchLimitsProperties(),
            queryLogService,
            executor,
            fixtures.meterRegistry
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void weightedHybridCombinesOneSidedItemsWithRawWeights() {
        ContentKey vectorOnly = key(ContentType.EVENT, "vector-only");
        ContentKey lexicalOnly = key(ContentType.ARTICLE, "lexical-only");
        fixtures.putVector(vectorOnly, vector(0.95f, (float) Math.sqrt(1 - 0.95 * 0.95), 0f), Map.of());
        fixtures.putLexical(lexicalOnly, lexical("Guitar workshop", "Beginner guitar session", null), Map.of());
        double lexicalRank = lexicalEngine.search("guitar", null, List.of(), 10).get(0).rank();

        SearchOutcome<FusedHit> outcome = service.hybridSearch(
            new HybridSearch("guitar", QUERY, null, List.of(), 10, 0.5, 0.5, null, "member-1")
        );

        assertThat(outcome.queryLogId()).isEqualTo("log-1");
        assertThat(outcome.hits()).hasSize(2);
        FusedHit lexicalHit = find(outcome.hits(), lexicalOnly);
        FusedHit vectorHit = find(outcome.hits(), vectorOnly);
        assertThat(lexicalHit.getCombinedScore()).isCloseTo(lexicalRank * 0.5, within(1e-9));
        assertThat(vectorHit.getCombinedScore()).isCloseTo(0.95 * 0.5, within(1e-5));
        ContentKey expectedFirst = lexicalRank * 0.5 > vectorHit.getCombinedScore() ? lexicalOnly : vectorOnly;
        assertThat(outcome.hits().get(0).getKey()).isEqualTo(expectedFirst);
    }

    @Test
    void hybridAppliesFiltersToBothSidesAndLogsThem() {
        ContentKey madrid = key(ContentType.EVENT, "madrid");
        ContentKey lisbon = key(ContentType.EVENT, "lisbon");
        fixtures.put(madrid, vector(0.5f, 0.5f, 0f), lexical("Chess night", null, null), Map.of("city", "madrid"));
        fixtures.put(lisbon, vector(1f, 0f, 0f), lexical("Chess night", null, null), Map.of("city", "lisbon"));
        List<MetadataFilter> filters = List.of(new EqualsFilter("city", "madrid"));

        SearchOutcome<FusedHit> outcome = service.hybridSearch(
            new HybridSearch("chess", QUERY, Set.of(ContentType.EVENT), filters, 10, null, null, FusionMethod.RRF, "m")
        );

        assertThat(outcome.hits()).extracting(FusedHit::getKey).containsExactly(madrid);
        ArgumentCaptor<QueryRecord> captor = ArgumentCaptor.forClass(QueryRecord.class);
        verify(queryLogService).recordQueryAsync(captor.capture());
        QueryRecord record = captor.getValue();
        assertThat(record.queryKind()).isEqualTo(QueryKind.HYBRID);
        assertThat(record.resultCount()).isEqualTo(1);
        assertThat(record.topResultId()).isEqualTo("madrid");
        assertThat(record.appliedFilters()).containsExactly(
            Map.of("type", "content_type", "values", List.of("event")),
            Map.of("type", "eq", "key", "city", "value", "madrid")
        );
    }

    @Test
    void hybridWithoutTextRanksBySimilarityOnly() {
        ContentKey close = key(ContentType.FAQ, "close");
        ContentKey far = key(ContentType.FAQ, "far");
        fixtures.put(close, vector(1f, 0.1f, 0f), lexical("Unrelated", null, null), Map.of());
        fixtures.putVector(far, vector(0f, 1f, 0f), Map.of());

        SearchOutcome<FusedHit> outcome = service.hybridSearch(
            new HybridSearch(" ", QUERY, null, null, 10, 0.5, 0.5, null, null)
        );

        assertThat(outcome.hits()).extracting(FusedHit::getKey).containsExactly(close, far);
        assertThat(outcome.hits().get(0).getKeywordRank()).isZero();
    }

    @Test
    void semanticSearchAppliesDefaultThresholdAndCapsLimit() {
        for (int i = 0; i < 120; i++) {
            fixtures.putVector(key(ContentType.LESSON, String.format("l%03d", i)), vector(1f, i * 0.001f, 0f), Map.of());
        }
        fixtures.putVector(key(ContentType.LESSON, "orthogonal"), vector(0f, 1f, 0f), Map.of());

        SearchOutcome<SemanticHit> outcome = service.semanticSearch(
            new SemanticSearch(QUERY, "lessons", null, List.of(), 500, null, "member-1")
        );

        assertThat(outcome.hits()).hasSize(100);
        assertThat(outcome.hits().get(0).key().contentId()).isEqualTo("l000");
        assertThat(outcome.hits()).extracting(SemanticHit::similarity).allMatch(similarity -> similarity >= 0.7);
    }

    @Test
    void lexicalSearchReturnsMatchingItemsOnly() {
        fixtures.putLexical(key(ContentType.COURSE, "c1"), lexical("Pottery basics", null, "clay and wheel"), Map.of());
        fixtures.putLexical(key(ContentType.COURSE, "c2"), lexical("Painting", null, "oil on canvas"), Map.of());

        SearchOutcome<LexicalHit> outcome = service.lexicalSearch(new LexicalSearch("clay", null, null, null, null));

        assertThat(outcome.hits()).extracting(hit -> hit.key().contentId()).containsExactly("c1");
    }

    @Test
    void removedItemDisappearsFromEveryEntryPoint() {
        ContentKey gone = key(ContentType.DOCUMENT, "gone");
        ContentKey kept = key(ContentType.DOCUMENT, "kept");
        fixtures.put(gone, vector(1f, 0f, 0f), lexical("Bylaws", null, "annual meeting"), Map.of());
        fixtures.put(kept, vector(0.9f, 0.1f, 0f), lexical("Minutes", null, "annual meeting"), Map.of());

        fixtures.store.remove(gone);

        assertThat(service.semanticSearch(new SemanticSearch(QUERY, null, null, null, 10, 0.0, null)).hits())
            .extracting(SemanticHit::key)
            .containsExactly(kept);
        assertThat(service.lexicalSearch(new LexicalSearch("annual meeting", null, null, 10, null)).hits())
            .extracting(LexicalHit::key)
            .containsExactly(kept);
        assertThat(service.hybridSearch(new HybridSearch("annual", QUERY, null, null, 10, null, null, null, null)).hits())
            .extracting(FusedHit::getKey)
            .containsExactly(kept);
    }

    @Test
    void failingQueryLogDoesNotFailSearch() {
        when(queryLogService.recordQueryAsync(any())).thenThrow(new IllegalStateException("log down"));
        fixtures.putVector(key(ContentType.EVENT, "e1"), vector(1f, 0f, 0f), Map.of());

        SearchOutcome<SemanticHit> outcome = service.semanticSearch(
            new SemanticSearch(QUERY, null, null, null, 5, 0.5, null)
        );

        assertThat(outcome.hits()).hasSize(1);
        assertThat(outcome.queryLogId()).isNull();
        assertThat(fixtures.meterRegistry.counter("search.querylog.failures", "operation", "submit").count())
            .isEqualTo(1.0);
    }

    @Test
    void zeroLimitReturnsNothingButIsStillLogged() {
        fixtures.putVector(key(ContentType.EVENT, "e1"), vector(1f, 0f, 0f), Map.of());

        SearchOutcome<FusedHit> outcome = service.hybridSearch(
            new HybridSearch("e1", QUERY, null, null, 0, null, null, null, null)
        );

        assertThat(outcome.hits()).isEmpty();
        verify(queryLogService).recordQueryAsync(any());
        assertThat(fixtures.meterRegistry.counter("search.query.zero_results", "kind", "hybrid").count()).isEqualTo(1.0);
    }

    @Test
    void invalidInputsAreRejectedBeforeRetrieval() {
        assertThatThrownBy(() -> service.semanticSearch(new SemanticSearch(null, null, null, null, null, null, null)))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.semanticSearch(new SemanticSearch(vector(1f, 0f), null, null, null, null, null, null)))
            .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> service.semanticSearch(new SemanticSearch(vector(Float.NaN, 0f, 0f), null, null, null, null, null, null)))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.semanticSearch(new SemanticSearch(QUERY, null, null, null, null, 1.5, null)))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.semanticSearch(new SemanticSearch(QUERY, null, null, null, -1, null, null)))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.lexicalSearch(new LexicalSearch("  ", null, null, null, null)))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.hybridSearch(new HybridSearch("x", QUERY, null, null, null, -0.1, 0.5, null, null)))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> service.hybridSearch(new HybridSearch("x", QUERY, null, null, null, 0.0, 0.0, null, null)))
            .isInstanceOf(InvalidSearchRequestException.class)
            .hasMessageContaining("at least one");
        assertThatThrownBy(() -> service.hybridSearch(new HybridSearch("x", null, null, null, null, null, null, null, null)))
            .isInstanceOf(InvalidSearchRequestException.class);
    }

    private static FusedHit find(List<FusedHit> hits, ContentKey key) {
        return hits.stream().filter(hit -> hit.getKey().equals(key)).findFirst().orElseThrow();
    }
}
