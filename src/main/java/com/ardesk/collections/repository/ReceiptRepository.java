package com.ardesk.collections.repository;

import com.ardesk.collections.model.Receipt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;

public interface ReceiptRepository extends JpaRepository<Receipt, Long> {
    List<Receipt> findByTenantId(String tenantId);

    List<Receipt> findByTenantIdAndCustomerIdIn(String tenantId, Collection<Long> customerIds);

    @Query("SELECT COALESCE(SUM(r.amount), 0), COUNT(r) FROM Receipt r WHERE r.tenantId = :tenantId "
            + "AND r.customerId IN (" + CustomerRepository.VALID_CUSTOMER_IDS + ")")
    List<Object[]> totalsByTenant(String tenantId); // single row: [sum, count]

    @Query("SELECT r.voucherType, COUNT(r), COALESCE(SUM(r.amount), 0) FROM Receipt r WHERE r.tenantId = :tenantId "
            + "AND r.customerId IN (" + CustomerRepository.VALID_CUSTOMER_IDS + ") "
            + "GROUP BY r.voucherType ORDER BY r.voucherType")
    List<Object[]> breakdownByVoucherType(String tenantId); // [type, count, total]
}
