package com.memberhub.search.retrieval;

import com.memberhub.search.index.ContentKey;
import java.util.Map;

public record SemanticHit(ContentKey key, double similarity, String contentText, String title, Map<String, Object> metadata) {
}
