package com.memberhub.search.index;

import java.util.List;
import java.util.Objects;

public final class LexicalFields {
    private final String title;
    private final String description;
    private final String body;
    private final List<String> tags;

    public LexicalFields(String title, String description, String body, List<String> tags) {
        this.title = title;
        this.description = description;
        this.body = body;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getBody() {
        return body;
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isBlank() {
        return isBlank(title) && isBlank(description) && isBlank(body) && tags.stream().allMatch(LexicalFields::isBlank);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LexicalFields other)) {
            return false;
        }
        return Objects.equals(title, other.title)
            && Objects.equals(description, other.description)
            && Objects.equals(body, other.body)
            && tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, description, body, tags);
    }
}
