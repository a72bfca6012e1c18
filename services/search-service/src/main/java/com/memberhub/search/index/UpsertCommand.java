package com.memberhub.search.index;

import java.util.Map;

public record UpsertCommand(
    ContentKey key,
    float[] vector,
    String contentText,
    LexicalFields lexical,
    Map<String, Object> metadata
) {
}
