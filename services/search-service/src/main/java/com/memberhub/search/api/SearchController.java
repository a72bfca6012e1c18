package com.memberhub.search.api;

import com.memberhub.search.api.dto.SearchRequest;
import com.memberhub.search.api.dto.SearchResponse;
import com.memberhub.search.filter.MetadataFilter;
import com.memberhub.search.filter.MetadataFilters;
import com.memberhub.search.index.ContentKey;
import com.memberhub.search.merge.FusedHit;
import com.memberhub.search.merge.FusionMethod;
import com.memberhub.search.retrieval.LexicalHit;
import com.memberhub.search.retrieval.SemanticHit;
import com.memberhub.search.service.HybridSearch;
import com.memberhub.search.service.HybridSearchService;
import com.memberhub.search.service.InvalidSearchRequestException;
import com.memberhub.search.service.LexicalSearch;
import com.memberhub.search.service.RecommendationService;
import com.memberhub.search.service.SearchOutcome;
import com.memberhub.search.service.SemanticSearch;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private final HybridSearchService searchService;
    private final RecommendationService recommendationService;

    public SearchController(HybridSearchService searchService, RecommendationService recommendationService) {
        this.searchService = searchService;
        this.recommendationService = recommendationService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search/semantic")
    public SearchResponse semantic(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        SearchRequest body = requireBody(request);
        List<MetadataFilter> filters = MetadataFilters.parse(body.getFilters(), body.getMetadataFilter());
        SearchOutcome<SemanticHit> outcome = searchService.semanticSearch(new SemanticSearch(
            body.getQueryVector(),
            body.getQueryText(),
            ApiMapper.contentTypes(body.getContentTypes()),
            filters,
            body.getLimit(),
            body.getMinSimilarity(),
            body.getMemberId()
        ));
        SearchResponse response = response(traceIdHeader, requestIdHeader, outcome.tookMs(), outcome.queryLogId());
        response.setHits(ApiMapper.semanticHits(outcome.hits()));
        return response;
    }

    @PostMapping("/search/lexical")
    public SearchResponse lexical(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        SearchRequest body = requireBody(request);
        List<MetadataFilter> filters = MetadataFilters.parse(body.getFilters(), body.getMetadataFilter());
        SearchOutcome<LexicalHit> outcome = searchService.lexicalSearch(new LexicalSearch(
            body.getQueryText(),
            ApiMapper.contentTypes(body.getContentTypes()),
            filters,
            body.getLimit(),
            body.getMemberId()
        ));
        SearchResponse response = response(traceIdHeader, requestIdHeader, outcome.tookMs(), outcome.queryLogId());
        response.setHits(ApiMapper.lexicalHits(outcome.hits()));
        return response;
    }

    @PostMapping("/search/hybrid")
    public SearchResponse hybrid(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        SearchRequest body = requireBody(request);
        List<MetadataFilter> filters = MetadataFilters.parse(body.getFilters(), body.getMetadataFilter());
        FusionMethod method = ApiMapper.fusionMethod(body.getFusionMethod());
        SearchOutcome<FusedHit> outcome = searchService.hybridSearch(new HybridSearch(
            body.getQueryText(),
            body.getQueryVector(),
            ApiMapper.contentTypes(body.getContentTypes()),
            filters,
            body.getLimit(),
            body.getKeywordWeight(),
            body.getSemanticWeight(),
            method,
            body.getMemberId()
        ));
        SearchResponse response = response(traceIdHeader, requestIdHeader, outcome.tookMs(), outcome.queryLogId());
        response.setFusionMethod(method == null ? null : method.getTag());
        response.setHits(ApiMapper.fusedHits(outcome.hits()));
        return response;
    }

    @GetMapping("/content/{type}/{id}/similar")
    public SearchResponse similar(
        @PathVariable("type") String type,
        @PathVariable("id") String id,
        @RequestParam(value = "limit", required = false) Integer limit,
        @RequestParam(value = "types", required = false) List<String> types,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        ContentKey source = ApiMapper.contentKey(type, id);
        long started = System.nanoTime();
        List<SemanticHit> hits = recommendationService.findSimilar(source, limit, ApiMapper.contentTypes(types));
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        SearchResponse response = response(traceIdHeader, requestIdHeader, tookMs, null);
        response.setHits(ApiMapper.semanticHits(hits));
        return response;
    }

    private static SearchRequest requireBody(SearchRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        return request;
    }

    private static SearchResponse response(String traceIdHeader, String requestIdHeader, long tookMs, String queryLogId) {
        SearchResponse response = new SearchResponse();
        response.setTraceId(RequestIdUtil.resolveOrGenerate(traceIdHeader));
        response.setRequestId(RequestIdUtil.resolveOrGenerate(requestIdHeader));
        response.setTookMs(tookMs);
        response.setQueryLogId(queryLogId);
        return response;
    }
}
