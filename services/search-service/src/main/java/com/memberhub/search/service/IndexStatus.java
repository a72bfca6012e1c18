package com.memberhub.search.service;

import com.memberhub.search.index.ContentType;
import com.memberhub.search.retrieval.ann.AnnIndexStatus;
import java.util.Map;

public record IndexStatus(
    int dimension,
    int items,
    Map<ContentType, Integer> itemsByType,
    int vectors,
    int lexicalDocuments,
    AnnIndexStatus ann
) {
}
