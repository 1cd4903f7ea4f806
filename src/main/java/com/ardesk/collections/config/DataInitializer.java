package com.ardesk.collections.config;

import com.ardesk.collections.model.CategoryRule;
import com.ardesk.collections.model.Customer;
import com.ardesk.collections.model.CustomerCategory;
import com.ardesk.collections.model.FollowUp;
import com.ardesk.collections.model.FollowUpStatus;
import com.ardesk.collections.model.Invoice;
import com.ardesk.collections.model.Receipt;
import com.ardesk.collections.repository.CategoryRuleRepository;
import com.ardesk.collections.repository.CustomerRepository;
import com.ardesk.collections.repository.FollowUpRepository;
import com.ardesk.collections.repository.InvoiceRepository;
import com.ardesk.collections.repository.ReceiptRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Seeds a small demo tenant on an empty database.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "collections.demo-data", name = "enabled", havingValue = "true")
public class DataInitializer {

    @Bean
    CommandLineRunner seedDemoTenant(CollectionsProperties properties,
            CustomerRepository customerRepo,
            InvoiceRepository invoiceRepo,
            ReceiptRepository receiptRepo,
            FollowUpRepository followUpRepo,
            CategoryRuleRepository ruleRepo,
            Clock clock) {
        return args -> {
            String tenant = properties.getDemoData().getTenantId();
            if (customerRepo.countByTenantId(tenant) > 0) {
                return;
            }
            LocalDate today = LocalDate.now(clock);

            // Tier rules, most severe first
            ruleRepo.save(rule(tenant, 1, "500000.00", null, 60, null, CustomerCategory.DELTA));
            ruleRepo.save(rule(tenant, 2, "100000.00", null, 30, null, CustomerCategory.GAMMA));
            ruleRepo.save(rule(tenant, 3, "1.00", null, 0, null, CustomerCategory.BETA));
            ruleRepo.save(rule(tenant, 4, null, "0.00", null, null, CustomerCategory.ALPHA));

            Customer punctual = customerRepo.save(customer(tenant, "Annapurna Traders", "Ravi", "250000.00", "0.00", 30));
            Customer slow = customerRepo.save(customer(tenant, "Bharat Wholesale", "Meena", "400000.00", "50000.00", 15));
            Customer overridden = customerRepo.save(customer(tenant, "Coastal Foods", "Ravi", "100000.00", "0.00", 30));
            overridden.setCategory(CustomerCategory.GAMMA);
            overridden.setCategoryManualOverride(true);
            customerRepo.save(overridden);

            Invoice p1 = invoiceRepo.save(invoice(tenant, punctual, "INV-1001", today.minusDays(90), "120000.00"));
            invoiceRepo.save(invoice(tenant, punctual, "INV-1002", today.minusDays(20), "80000.00"));
            receiptRepo.save(receipt(tenant, punctual, today.minusDays(65), "120000.00", p1.getId()));

            invoiceRepo.save(invoice(tenant, slow, "INV-2001", today.minusDays(150), "300000.00"));
            invoiceRepo.save(invoice(tenant, slow, "INV-2002", today.minusDays(100), "325000.00"));
            invoiceRepo.save(invoice(tenant, slow, "INV-2003", today.minusDays(10), "90000.00"));
            receiptRepo.save(receipt(tenant, slow, today.minusDays(80), "200000.00", null));

            invoiceRepo.save(invoice(tenant, overridden, "INV-3001", today.minusDays(45), "60000.00"));

            followUpRepo.save(followUp(tenant, slow, today.minusDays(3).atTime(11, 0), today.plusDays(1).atTime(10, 0)));
            followUpRepo.save(followUp(tenant, punctual, today.minusDays(1).atTime(16, 30), null));

            log.info("Seeded demo tenant '{}'", tenant);
        };
    }

    private static CategoryRule rule(String tenant, int priority, String minBalance, String maxBalance,
            Integer minOverdue, Integer maxOverdue, CustomerCategory target) {
        CategoryRule rule = new CategoryRule();
        rule.setTenantId(tenant);
        rule.setPriority(priority);
        rule.setMinBalance(minBalance == null ? null : new BigDecimal(minBalance));
        rule.setMaxBalance(maxBalance == null ? null : new BigDecimal(maxBalance));
        rule.setMinOverdueDays(minOverdue);
        rule.setMaxOverdueDays(maxOverdue);
        rule.setTargetCategory(target);
        return rule;
    }

    private static Customer customer(String tenant, String name, String salesPerson, String creditLimit,
            String openingBalance, int terms) {
        Customer c = new Customer();
        c.setTenantId(tenant);
        c.setName(name);
        c.setSalesPerson(salesPerson);
        c.setCreditLimit(new BigDecimal(creditLimit));
        c.setOpeningBalance(new BigDecimal(openingBalance));
        c.setPaymentTermsDays(terms);
        return c;
    }

    private static Invoice invoice(String tenant, Customer customer, String number, LocalDate date, String amount) {
        Invoice invoice = new Invoice();
        invoice.setTenantId(tenant);
        invoice.setCustomerId(customer.getId());
        invoice.setInvoiceNumber(number);
        invoice.setInvoiceDate(date);
        invoice.setAmount(new BigDecimal(amount));
        return invoice;
    }

    private static Receipt receipt(String tenant, Customer customer, LocalDate date, String amount, Long invoiceId) {
        Receipt receipt = new Receipt();
        receipt.setTenantId(tenant);
        receipt.setCustomerId(customer.getId());
        receipt.setReceiptDate(date);
        receipt.setAmount(new BigDecimal(amount));
        receipt.setLinkedInvoiceId(invoiceId);
        return receipt;
    }

    private static FollowUp followUp(String tenant, Customer customer, LocalDateTime at, LocalDateTime next) {
        FollowUp followUp = new FollowUp();
        followUp.setTenantId(tenant);
        followUp.setCustomerId(customer.getId());
        followUp.setFollowUpDateTime(at);
        followUp.setNextFollowUpDate(next);
        followUp.setStatus(FollowUpStatus.COMPLETED);
        followUp.setType("Call");
        return followUp;
    }
}
