package com.ardesk.collections.repository;

import com.ardesk.collections.model.Customer;
import com.ardesk.collections.model.CustomerCategory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.math.BigDecimal;
import java.util.List;

public interface CustomerRepository extends JpaRepository<Customer, Long> {

    // Customers whose ledger rows all pass amount and date validation; the others are skipped by the engine
    String VALID_CUSTOMER_IDS = "SELECT vc.id FROM Customer vc WHERE vc.tenantId = :tenantId "
            + "AND (vc.openingBalance IS NULL OR vc.openingBalance >= 0) "
            + "AND NOT EXISTS (SELECT bi.id FROM Invoice bi WHERE bi.tenantId = vc.tenantId AND bi.customerId = vc.id "
            + "AND (bi.amount IS NULL OR bi.amount < 0 OR bi.invoiceDate IS NULL)) "
            + "AND NOT EXISTS (SELECT br.id FROM Receipt br WHERE br.tenantId = vc.tenantId AND br.customerId = vc.id "
            + "AND (br.amount IS NULL OR br.amount < 0 OR br.receiptDate IS NULL))";

    List<Customer> findByTenantIdOrderByNameAscIdAsc(String tenantId);

    Page<Customer> findByTenantId(String tenantId, Pageable pageable);

    long countByTenantId(String tenantId);

    // Touches only the category column; a concurrent manual override wins
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Customer c SET c.category = :category WHERE c.id = :id AND c.tenantId = :tenantId "
            + "AND c.categoryManualOverride = false AND c.category <> :category")
    int updateCategory(String tenantId, Long id, CustomerCategory category);

    @Query("SELECT c.category, COUNT(c) FROM Customer c WHERE c.tenantId = :tenantId AND c.id IN ("
            + VALID_CUSTOMER_IDS + ") GROUP BY c.category")
    List<Object[]> countByCategory(String tenantId); // [category, count]

    @Query("SELECT COALESCE(SUM(c.openingBalance), 0) FROM Customer c WHERE c.tenantId = :tenantId AND c.id IN ("
            + VALID_CUSTOMER_IDS + ")")
    BigDecimal sumOpeningBalance(String tenantId);

    @Query("SELECT COUNT(c) FROM Customer c WHERE c.tenantId = :tenantId AND c.id NOT IN (" + VALID_CUSTOMER_IDS + ")")
    long countInvalidCustomers(String tenantId);
}
