package com.ardesk.collections.repository;

import com.ardesk.collections.model.FollowUp;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface FollowUpRepository extends JpaRepository<FollowUp, Long> {
    List<FollowUp> findByTenantId(String tenantId);

    List<FollowUp> findByTenantIdAndCustomerIdIn(String tenantId, Collection<Long> customerIds);
}
