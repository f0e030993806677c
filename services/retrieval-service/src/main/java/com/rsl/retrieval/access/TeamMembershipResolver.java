package com.rsl.retrieval.access;

/**
 * Answers whether a resource owner belongs to a manager's team. The default bean knows no
 * teams; deployments with a team model register their own implementation.
 */
@FunctionalInterface
public interface TeamMembershipResolver {
    boolean isTeamMember(String managerId, String tenantId, String memberId);
}
