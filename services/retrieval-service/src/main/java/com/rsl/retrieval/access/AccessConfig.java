package com.rsl.retrieval.access;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AccessConfig {

    @Bean
    @ConditionalOnMissingBean
    public TeamMembershipResolver teamMembershipResolver() {
        return (managerId, tenantId, memberId) -> false;
    }
}
