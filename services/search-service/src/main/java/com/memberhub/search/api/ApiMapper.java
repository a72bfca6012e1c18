package com.memberhub.search.api;

import com.memberhub.search.api.dto.QueryLogEntryDto;
import com.memberhub.search.api.dto.SearchHitDto;
import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.merge.FusedHit;
import com.memberhub.search.merge.FusionMethod;
import com.memberhub.search.querylog.QueryLogEntry;
import com.memberhub.search.retrieval.LexicalHit;
import com.memberhub.search.retrieval.SemanticHit;
import com.memberhub.search.service.InvalidSearchRequestException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

final class ApiMapper {
    private ApiMapper() {
    }

    static ContentType contentType(String tag) {
        ContentType type = ContentType.fromTag(tag);
        if (type == null) {
            throw new InvalidSearchRequestException("unknown content type: " + tag);
        }
        return type;
    }

    static ContentKey contentKey(String typeTag, String contentId) {
        if (contentId == null || contentId.isBlank()) {
            throw new InvalidSearchRequestException("content id is required");
        }
        return ContentKey.of(contentType(typeTag), contentId.trim());
    }

    static Set<ContentType> contentTypes(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Set.of();
        }
        Set<ContentType> types = EnumSet.noneOf(ContentType.class);
        for (String tag : tags) {
            types.add(contentType(tag));
        }
        return types;
    }

    static FusionMethod fusionMethod(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        FusionMethod method = FusionMethod.fromString(value);
        if (method == null) {
            throw new InvalidSearchRequestException("unknown fusion method: " + value);
        }
        return method;
    }

    static List<SearchHitDto> semanticHits(List<SemanticHit> hits) {
        List<SearchHitDto> dtos = new ArrayList<>(hits.size());
        for (SemanticHit hit : hits) {
            SearchHitDto dto = base(hit.key());
            dto.setScore(hit.similarity());
            dto.setSimilarity(hit.similarity());
            dto.setTitle(hit.title());
            dto.setContentText(hit.contentText());
            dto.setMetadata(hit.metadata());
            dtos.add(dto);
        }
        return dtos;
    }

    static List<SearchHitDto> lexicalHits(List<LexicalHit> hits) {
        List<SearchHitDto> dtos = new ArrayList<>(hits.size());
        for (LexicalHit hit : hits) {
            SearchHitDto dto = base(hit.key());
            dto.setScore(hit.rank());
            dto.setKeywordRank(hit.rank());
            dto.setTitle(hit.title());
            dto.setDescription(hit.description());
            dto.setMetadata(hit.metadata());
            dtos.add(dto);
        }
        return dtos;
    }

    static List<SearchHitDto> fusedHits(List<FusedHit> hits) {
        List<SearchHitDto> dtos = new ArrayList<>(hits.size());
        for (FusedHit hit : hits) {
            SearchHitDto dto = base(hit.getKey());
            dto.setScore(hit.getCombinedScore());
            dto.setCombinedScore(hit.getCombinedScore());
            dto.setKeywordRank(hit.getKeywordRank());
            dto.setSemanticSimilarity(hit.getSemanticSimilarity());
            dto.setTitle(hit.getTitle());
            dto.setDescription(hit.getDescription());
            dto.setContentText(hit.getContentText());
            dto.setMetadata(hit.getMetadata());
            dtos.add(dto);
        }
        return dtos;
    }

    static QueryLogEntryDto queryLogEntry(QueryLogEntry entry) {
        QueryLogEntryDto dto = new QueryLogEntryDto();
        dto.setId(entry.id());
        dto.setMemberId(entry.issuedBy());
        dto.setQueryText(entry.queryText());
        dto.setQueryKind(entry.queryKind() == null ? null : entry.queryKind().getTag());
        dto.setAppliedFilters(entry.appliedFilters());
        dto.setResultCount(entry.resultCount());
        dto.setTopResultId(entry.topResultId());
        dto.setTopResultScore(entry.topResultScore());
        dto.setLatencyMs(entry.latencyMs());
        dto.setClickedResultIds(entry.clickedResultIds());
        dto.setCreatedAt(entry.createdAt());
        return dto;
    }

    private static SearchHitDto base(ContentKey key) {
        SearchHitDto dto = new SearchHitDto();
        dto.setContentType(key.contentType().getTag());
        dto.setContentId(key.contentId());
        return dto;
    }
}
