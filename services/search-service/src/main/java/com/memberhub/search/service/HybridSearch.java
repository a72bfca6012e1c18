package com.memberhub.search.service;

import com.memberhub.search.filter.MetadataFilter;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.merge.FusionMethod;
import java.util.List;
import java.util.Set;

public record HybridSearch(
    String queryText,
    float[] queryVector,
    Set<ContentType> contentTypes,
    List<MetadataFilter> filters,
    Integer limit,
    Double keywordWeight,
    Double semanticWeight,
    FusionMethod fusionMethod,
    String issuedBy
) {
}
