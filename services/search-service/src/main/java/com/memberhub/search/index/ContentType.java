package com.memberhub.search.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ContentType {
    MEMBER_PROFILE("member_profile"),
    EVENT("event"),
    COURSE("course"),
    LESSON("lesson"),
    DOCUMENT("document"),
    FAQ("faq"),
    ARTICLE("article");

    private final String tag;

    ContentType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static ContentType fromTag(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ContentType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return tag;
    }
}
