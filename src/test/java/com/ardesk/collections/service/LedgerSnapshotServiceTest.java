package com.ardesk.collections.service;

import com.ardesk.collections.exception.DependencyUnavailableException;
import com.ardesk.collections.exception.TenantIsolationException;
import com.ardesk.collections.model.Customer;
import com.ardesk.collections.model.Invoice;
import com.ardesk.collections.model.Receipt;
import com.ardesk.collections.repository.CustomerRepository;
import com.ardesk.collections.repository.FollowUpRepository;
import com.ardesk.collections.repository.InvoiceRepository;
import com.ardesk.collections.repository.ReceiptRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDate;
import java.util.List;

import static com.ardesk.collections.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerSnapshotServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 2, 1);

    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private InvoiceRepository invoiceRepository;
    @Mock
    private ReceiptRepository receiptRepository;
    @Mock
    private FollowUpRepository followUpRepository;
    @Mock
    private PlatformTransactionManager transactionManager;

    private LedgerSnapshotService service;

    @BeforeEach
    void setUp() {
        service = new LedgerSnapshotService(customerRepository, invoiceRepository, receiptRepository,
                followUpRepository, transactionManager);
    }

    @Test
    void load_ShouldGroupRowsPerCustomer() {
        when(customerRepository.findByTenantIdOrderByNameAscIdAsc(TENANT))
                .thenReturn(List.of(customer(1L, "A"), customer(2L, "B")));
        when(invoiceRepository.findByTenantId(TENANT)).thenReturn(List.of(
                invoice(10L, 1L, DAY, "100.00"), invoice(11L, 2L, DAY, "50.00"), invoice(12L, 1L, DAY, "5.00")));
        when(receiptRepository.findByTenantId(TENANT)).thenReturn(List.of(receipt(20L, 2L, DAY, "50.00")));
        when(followUpRepository.findByTenantId(TENANT)).thenReturn(List.of());

        TenantLedger ledger = service.load(TENANT);

        assertEquals(2, ledger.getCustomers().size());
        assertEquals(2, ledger.getCustomers().get(0).getInvoices().size());
        assertEquals(1, ledger.getCustomers().get(1).getInvoices().size());
        assertEquals(1, ledger.getCustomers().get(1).getReceipts().size());
        verify(transactionManager).commit(any());
    }

    @Test
    void load_ShouldAbort_WhenRowCarriesForeignTenant() {
        Invoice foreign = invoice(10L, 1L, DAY, "100.00");
        foreign.setTenantId("globex");
        when(customerRepository.findByTenantIdOrderByNameAscIdAsc(TENANT)).thenReturn(List.of(customer(1L, "A")));
        when(invoiceRepository.findByTenantId(TENANT)).thenReturn(List.of(foreign));

        TenantIsolationException e = assertThrows(TenantIsolationException.class, () -> service.load(TENANT));
        assertEquals("globex", e.getFoundTenantId());
    }

    @Test
    void load_ShouldAbort_WhenReceiptPointsAtAnotherTenantsCustomer() {
        Customer outsider = customer(99L, "Elsewhere");
        outsider.setTenantId("globex");
        when(customerRepository.findByTenantIdOrderByNameAscIdAsc(TENANT)).thenReturn(List.of(customer(1L, "A")));
        when(invoiceRepository.findByTenantId(TENANT)).thenReturn(List.of());
        when(receiptRepository.findByTenantId(TENANT)).thenReturn(List.of(receipt(20L, 99L, DAY, "10.00")));
        when(followUpRepository.findByTenantId(TENANT)).thenReturn(List.of());
        when(customerRepository.findAllById(any())).thenReturn(List.of(outsider));

        assertThrows(TenantIsolationException.class, () -> service.load(TENANT));
    }

    @Test
    void load_ShouldAbort_WhenReceiptLinksAnotherTenantsInvoice() {
        Receipt receipt = receipt(20L, 1L, DAY, "10.00");
        receipt.setLinkedInvoiceId(500L);
        Invoice foreignInvoice = invoice(500L, 7L, DAY, "10.00");
        foreignInvoice.setTenantId("globex");
        when(customerRepository.findByTenantIdOrderByNameAscIdAsc(TENANT)).thenReturn(List.of(customer(1L, "A")));
        when(invoiceRepository.findByTenantId(TENANT)).thenReturn(List.of());
        when(receiptRepository.findByTenantId(TENANT)).thenReturn(List.of(receipt));
        when(followUpRepository.findByTenantId(TENANT)).thenReturn(List.of());
        when(invoiceRepository.findAllById(any())).thenReturn(List.of(foreignInvoice));

        assertThrows(TenantIsolationException.class, () -> service.load(TENANT));
    }

    @Test
    void load_ShouldIgnoreDanglingRows() {
        when(customerRepository.findByTenantIdOrderByNameAscIdAsc(TENANT)).thenReturn(List.of(customer(1L, "A")));
        when(invoiceRepository.findByTenantId(TENANT)).thenReturn(List.of(invoice(10L, 42L, DAY, "10.00")));
        when(receiptRepository.findByTenantId(TENANT)).thenReturn(List.of());
        when(followUpRepository.findByTenantId(TENANT)).thenReturn(List.of());
        when(customerRepository.findAllById(any())).thenReturn(List.of());

        TenantLedger ledger = service.load(TENANT);

        assertTrue(ledger.getCustomers().get(0).getInvoices().isEmpty());
    }

    @Test
    void load_ShouldReportStorageFailure() {
        when(customerRepository.findByTenantIdOrderByNameAscIdAsc(TENANT))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(DependencyUnavailableException.class, () -> service.load(TENANT));
    }

    @Test
    void loadPage_ShouldSkipQueries_WhenPageEmpty() {
        assertTrue(service.load(TENANT, List.of()).isEmpty());
        verifyNoInteractions(invoiceRepository, receiptRepository, followUpRepository);
    }
}
