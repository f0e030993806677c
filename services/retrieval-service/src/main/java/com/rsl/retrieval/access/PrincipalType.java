package com.rsl.retrieval.access;

public enum PrincipalType {
    USER,
    ROLE,
    TENANT
}
