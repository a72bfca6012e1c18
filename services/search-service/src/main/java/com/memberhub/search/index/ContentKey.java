package com.memberhub.search.index;

import java.util.Comparator;
import java.util.Objects;

public record ContentKey(ContentType contentType, String contentId) implements Comparable<ContentKey> {

    private static final Comparator<ContentKey> ORDER = Comparator
        .comparing(ContentKey::contentId)
        .thenComparing(ContentKey::contentType);

    public ContentKey {
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(contentId, "contentId");
    }

    public static ContentKey of(ContentType contentType, String contentId) {
        return new ContentKey(contentType, contentId);
    }

    @Override
    public int compareTo(ContentKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return contentType.getTag() + ":" + contentId;
    }
}
