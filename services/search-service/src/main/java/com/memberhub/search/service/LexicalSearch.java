package com.memberhub.search.service;

import com.memberhub.search.filter.MetadataFilter;
import com.memberhub.search.index.ContentType;
import java.util.List;
import java.util.Set;

public record LexicalSearch(
    String queryText,
    Set<ContentType> contentTypes,
    List<MetadataFilter> filters,
    Integer limit,
    String issuedBy
) {
}
