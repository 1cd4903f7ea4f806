package com.ardesk.collections.repository;

import com.ardesk.collections.model.CategoryRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CategoryRuleRepository extends JpaRepository<CategoryRule, Long> {
    List<CategoryRule> findByTenantIdOrderByPriorityAscIdAsc(String tenantId);

    long countByTenantId(String tenantId);
}
