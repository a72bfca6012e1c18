package com.memberhub.search.service;

import com.memberhub.search.index.ContentKey;

public class EmbeddingNotFoundException extends RuntimeException {
    private final ContentKey key;

    public EmbeddingNotFoundException(ContentKey key) {
        super("no embedding stored for " + key);
        this.key = key;
    }

    public ContentKey getKey() {
        return key;
    }
}
