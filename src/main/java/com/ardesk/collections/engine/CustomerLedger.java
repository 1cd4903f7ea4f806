package com.ardesk.collections.engine;

import com.ardesk.collections.model.Customer;
import com.ardesk.collections.model.FollowUp;
import com.ardesk.collections.model.Invoice;
import com.ardesk.collections.model.Receipt;
import lombok.Value;

import java.util.List;

/**
 * One customer's rows from a tenant-scoped ledger snapshot.
 */
@Value
public class CustomerLedger {
    Customer customer;
    List<Invoice> invoices;
    List<Receipt> receipts;
    List<FollowUp> followUps;

    public Long getCustomerId() {
        return customer.getId();
    }
}
