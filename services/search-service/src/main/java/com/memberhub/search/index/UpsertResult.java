package com.memberhub.search.index;

public enum UpsertResult {
    CREATED,
    UPDATED,
    UNCHANGED
}
