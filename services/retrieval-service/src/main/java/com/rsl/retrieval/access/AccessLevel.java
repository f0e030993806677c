package com.rsl.retrieval.access;

public enum AccessLevel {
    VIEW,
    COMMENT,
    EDIT,
    ADMIN;

    public boolean canEdit() {
        return this == EDIT || this == ADMIN;
    }
}
