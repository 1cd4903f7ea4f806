package com.ardesk.collections.dto;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class DebtorReport {
    List<DebtorSnapshot> debtors;
    Map<String, CategoryTotal> categoryWise; // over exactly the rows in debtors
    List<SkippedCustomer> skipped;
}
