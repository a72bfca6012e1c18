package com.memberhub.search.merge;

import com.memberhub.search.index.ContentKey;
import java.util.Map;

public final class FusedHit {
    private final ContentKey key;
    private final double combinedScore;
    private final double keywordRank;
    private final double semanticSimilarity;
    private final Integer lexicalPosition;
    private final Integer semanticPosition;
    private final String title;
    private final String description;
    private final String contentText;
    private final Map<String, Object> metadata;

    public FusedHit(
        ContentKey key,
        double combinedScore,
        double keywordRank,
        double semanticSimilarity,
        Integer lexicalPosition,
        Integer semanticPosition,
        String title,
        String description,
        String contentText,
        Map<String, Object> metadata
    ) {
        this.key = key;
        this.combinedScore = combinedScore;
        this.keywordRank = keywordRank;
        this.semanticSimilarity = semanticSimilarity;
        this.lexicalPosition = lexicalPosition;
        this.semanticPosition = semanticPosition;
        this.title = title;
        this.description = description;
        this.contentText = contentText;
        this.metadata = metadata == null ? Map.of() : metadata;
    }

    public ContentKey getKey() {
        return key;
    }

    public double getCombinedScore() {
        return combinedScore;
    }

    public double getKeywordRank() {
        return keywordRank;
    }

    public double getSemanticSimilarity() {
        return semanticSimilarity;
    }

    public Integer getLexicalPosition() {
        return lexicalPosition;
    }

    public Integer getSemanticPosition() {
        return semanticPosition;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getContentText() {
        return contentText;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
