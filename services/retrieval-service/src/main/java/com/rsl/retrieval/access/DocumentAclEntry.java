package com.rsl.retrieval.access;

public record DocumentAclEntry(PrincipalType principalType, String principalId, AccessLevel accessLevel) {
}
