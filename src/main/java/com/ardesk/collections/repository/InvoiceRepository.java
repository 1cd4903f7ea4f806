package com.ardesk.collections.repository;

import com.ardesk.collections.model.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {
    List<Invoice> findByTenantId(String tenantId);

    List<Invoice> findByTenantIdAndCustomerIdIn(String tenantId, Collection<Long> customerIds);

    @Query("SELECT COALESCE(SUM(i.amount), 0), COUNT(i) FROM Invoice i WHERE i.tenantId = :tenantId "
            + "AND i.customerId IN (" + CustomerRepository.VALID_CUSTOMER_IDS + ")")
    List<Object[]> totalsByTenant(String tenantId); // single row: [sum, count]
}
