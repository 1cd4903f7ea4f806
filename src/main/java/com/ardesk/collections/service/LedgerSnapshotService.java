package com.ardesk.collections.service;

import com.ardesk.collections.engine.CustomerLedger;
import com.ardesk.collections.exception.DependencyUnavailableException;
import com.ardesk.collections.exception.TenantIsolationException;
import com.ardesk.collections.model.Customer;
import com.ardesk.collections.model.FollowUp;
import com.ardesk.collections.model.Invoice;
import com.ardesk.collections.model.Receipt;
import com.ardesk.collections.repository.CustomerRepository;
import com.ardesk.collections.repository.FollowUpRepository;
import com.ardesk.collections.repository.InvoiceRepository;
import com.ardesk.collections.repository.ReceiptRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reads one tenant's customers, invoices, receipts and follow-ups in a single read-only transaction
 * and checks that nothing in the result belongs to another tenant.
 */
@Slf4j
@Service
public class LedgerSnapshotService {

    private final CustomerRepository customerRepository;
    private final InvoiceRepository invoiceRepository;
    private final ReceiptRepository receiptRepository;
    private final FollowUpRepository followUpRepository;
    private final TransactionTemplate readOnly;

    public LedgerSnapshotService(CustomerRepository customerRepository,
            InvoiceRepository invoiceRepository,
            ReceiptRepository receiptRepository,
            FollowUpRepository followUpRepository,
            PlatformTransactionManager transactionManager) {
        this.customerRepository = customerRepository;
        this.invoiceRepository = invoiceRepository;
        this.receiptRepository = receiptRepository;
        this.followUpRepository = followUpRepository;
        this.readOnly = new TransactionTemplate(transactionManager);
        this.readOnly.setReadOnly(true);
    }

    /**
     * The whole tenant.
     */
    public TenantLedger load(String tenantId) {
        return inReadOnlyTransaction(tenantId, () -> {
            List<Customer> customers = customerRepository.findByTenantIdOrderByNameAscIdAsc(tenantId);
            return assemble(tenantId, customers,
                    invoiceRepository.findByTenantId(tenantId),
                    receiptRepository.findByTenantId(tenantId),
                    followUpRepository.findByTenantId(tenantId));
        });
    }

    /**
     * Only the given customers of the tenant, e.g. one page of a recalculation pass.
     */
    public TenantLedger load(String tenantId, List<Customer> customers) {
        if (customers.isEmpty()) {
            return new TenantLedger(tenantId, List.of());
        }
        return inReadOnlyTransaction(tenantId, () -> {
            Set<Long> ids = new HashSet<>();
            customers.forEach(c -> ids.add(c.getId()));
            return assemble(tenantId, customers,
                    invoiceRepository.findByTenantIdAndCustomerIdIn(tenantId, ids),
                    receiptRepository.findByTenantIdAndCustomerIdIn(tenantId, ids),
                    followUpRepository.findByTenantIdAndCustomerIdIn(tenantId, ids));
        });
    }

    private TenantLedger inReadOnlyTransaction(String tenantId, Supplier<TenantLedger> work) {
        try {
            return readOnly.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            throw new DependencyUnavailableException("Ledger storage unavailable for tenant " + tenantId, e);
        }
    }

    private TenantLedger assemble(String tenantId, List<Customer> customers, List<Invoice> invoices,
            List<Receipt> receipts, List<FollowUp> followUps) {
        Map<Long, List<Invoice>> invoicesByCustomer = new LinkedHashMap<>();
        Map<Long, List<Receipt>> receiptsByCustomer = new HashMap<>();
        Map<Long, List<FollowUp>> followUpsByCustomer = new HashMap<>();
        for (Customer customer : customers) {
            requireTenant(tenantId, customer.getTenantId(), "customer " + customer.getId());
            invoicesByCustomer.put(customer.getId(), new ArrayList<>());
            receiptsByCustomer.put(customer.getId(), new ArrayList<>());
            followUpsByCustomer.put(customer.getId(), new ArrayList<>());
        }

        Set<Long> invoiceIds = new HashSet<>();
        Set<Long> foreignCustomerIds = new HashSet<>();
        for (Invoice invoice : invoices) {
            requireTenant(tenantId, invoice.getTenantId(), "invoice " + invoice.getId());
            invoiceIds.add(invoice.getId());
            group(invoicesByCustomer, invoice.getCustomerId(), invoice, foreignCustomerIds);
        }
        Set<Long> linkedElsewhere = new HashSet<>();
        for (Receipt receipt : receipts) {
            requireTenant(tenantId, receipt.getTenantId(), "receipt " + receipt.getId());
            if (receipt.getLinkedInvoiceId() != null && !invoiceIds.contains(receipt.getLinkedInvoiceId())) {
                linkedElsewhere.add(receipt.getLinkedInvoiceId());
            }
            group(receiptsByCustomer, receipt.getCustomerId(), receipt, foreignCustomerIds);
        }
        for (FollowUp followUp : followUps) {
            requireTenant(tenantId, followUp.getTenantId(), "follow-up " + followUp.getId());
            group(followUpsByCustomer, followUp.getCustomerId(), followUp, foreignCustomerIds);
        }

        checkReferences(tenantId, "customer", foreignCustomerIds,
                ids -> customerRepository.findAllById(ids).stream().map(Customer::getTenantId).toList());
        checkReferences(tenantId, "linked invoice", linkedElsewhere,
                ids -> invoiceRepository.findAllById(ids).stream().map(Invoice::getTenantId).toList());

        List<CustomerLedger> ledgers = new ArrayList<>(customers.size());
        for (Customer customer : customers) {
            ledgers.add(new CustomerLedger(customer,
                    invoicesByCustomer.get(customer.getId()),
                    receiptsByCustomer.get(customer.getId()),
                    followUpsByCustomer.get(customer.getId())));
        }
        log.debug("Loaded ledger for tenant {}: {} customers, {} invoices, {} receipts, {} follow-ups",
                tenantId, customers.size(), invoices.size(), receipts.size(), followUps.size());
        return new TenantLedger(tenantId, ledgers);
    }

    private static <T> void group(Map<Long, List<T>> byCustomer, Long customerId, T row, Set<Long> unknown) {
        List<T> rows = byCustomer.get(customerId);
        if (rows == null) {
            unknown.add(customerId);
        } else {
            rows.add(row);
        }
    }

    /*
     * Rows pointing outside the loaded set are either dangling (ignored) or point into another
     * tenant, which aborts the request.
     */
    private void checkReferences(String tenantId, String kind, Set<Long> ids,
            Function<Set<Long>, List<String>> ownerTenants) {
        if (ids.isEmpty()) {
            return;
        }
        for (String owner : ownerTenants.apply(ids)) {
            requireTenant(tenantId, owner, kind + " referenced from tenant " + tenantId);
        }
        log.warn("Tenant {}: ignoring rows that reference missing {} ids {}", tenantId, kind, ids);
    }

    private static void requireTenant(String tenantId, String found, String record) {
        if (!tenantId.equals(found)) {
            TenantIsolationException e = new TenantIsolationException(tenantId, found, record);
            log.error(e.getMessage());
            throw e;
        }
    }
}
