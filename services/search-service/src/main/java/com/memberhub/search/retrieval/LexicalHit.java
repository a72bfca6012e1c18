package com.memberhub.search.retrieval;

import com.memberhub.search.index.ContentKey;
import java.util.Map;

public record LexicalHit(ContentKey key, double rank, String title, String description, Map<String, Object> metadata) {
}
