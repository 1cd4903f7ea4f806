package com.ardesk.collections.service;

import com.ardesk.collections.dto.SkippedCustomer;
import lombok.Value;

import java.util.List;

@Value
public class ComputationResult<R> {
    List<R> results;
    List<SkippedCustomer> skipped;
}
