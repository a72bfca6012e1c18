package com.memberhub.search.index;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class IndexedContent {
    private final ContentKey key;
    private final float[] vector;
    private final String contentText;
    private final LexicalFields lexical;
    private final Map<String, Object> metadata;
    private final long vectorRevision;
    private final Instant updatedAt;

    public IndexedContent(
        ContentKey key,
        float[] vector,
        String contentText,
        LexicalFields lexical,
        Map<String, Object> metadata,
        long vectorRevision,
        Instant updatedAt
    ) {
        this.key = Objects.requireNonNull(key, "key");
        this.vector = vector == null ? null : vector.clone();
        this.contentText = contentText;
        this.lexical = lexical;
        this.metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.vectorRevision = vectorRevision;
        this.updatedAt = updatedAt;
    }

    public ContentKey getKey() {
        return key;
    }

    public boolean hasVector() {
        return vector != null;
    }

    public boolean hasLexical() {
        return lexical != null;
    }

    public float[] vectorView() {
        return vector;
    }

    public float[] copyVector() {
        return vector == null ? null : vector.clone();
    }

    public String getContentText() {
        return contentText;
    }

    public LexicalFields getLexical() {
        return lexical;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public long getVectorRevision() {
        return vectorRevision;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String title() {
        if (lexical != null && lexical.getTitle() != null) {
            return lexical.getTitle();
        }
        Object title = metadata.get("title");
        return title == null ? null : title.toString();
    }

    public boolean sameContentAs(IndexedContent other) {
        if (other == null) {
            return false;
        }
        return key.equals(other.key)
            && Arrays.equals(vector, other.vector)
            && Objects.equals(contentText, other.contentText)
            && Objects.equals(lexical, other.lexical)
            && metadata.equals(other.metadata);
    }
}
