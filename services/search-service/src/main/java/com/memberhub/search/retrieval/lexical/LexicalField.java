package com.memberhub.search.retrieval.lexical;

public enum LexicalField {
    TITLE("title"),
    DESCRIPTION("description"),
    BODY("body"),
    TAGS("tags");

    private final String propertyName;

    LexicalField(String propertyName) {
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
