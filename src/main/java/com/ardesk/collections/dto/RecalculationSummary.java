package com.ardesk.collections.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecalculationSummary {
    String tenantId;
    int reassigned;
    int unchanged;
    int skippedOverride;
    int skippedDataError;
    int pagesProcessed;
    boolean complete;
    Integer resumeFromPage; // null once every page has been processed
}
