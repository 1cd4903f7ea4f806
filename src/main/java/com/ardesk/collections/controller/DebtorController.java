package com.ardesk.collections.controller;

import com.ardesk.collections.dto.BucketStat;
import com.ardesk.collections.dto.CreditUtilization;
import com.ardesk.collections.dto.DebtorFilter;
import com.ardesk.collections.dto.DebtorReport;
import com.ardesk.collections.engine.FollowUpBucket;
import com.ardesk.collections.model.CustomerCategory;
import com.ardesk.collections.service.DebtorExportService;
import com.ardesk.collections.service.DebtorService;
import com.ardesk.collections.util.TenantHeaders;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/debtors")
public class DebtorController {

    static final MediaType XLSX = MediaType
            .parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final DebtorService debtorService;
    private final DebtorExportService debtorExportService;
    private final Clock clock;

    public DebtorController(DebtorService debtorService, DebtorExportService debtorExportService, Clock clock) {
        this.debtorService = debtorService;
        this.debtorExportService = debtorExportService;
        this.clock = clock;
    }

    @GetMapping
    public DebtorReport list(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String salesPerson,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String bucket,
            @RequestParam(defaultValue = "true") boolean outstandingOnly) {
        return debtorService.listDebtors(TenantHeaders.require(tenantId),
                filter(category, salesPerson, search, bucket, outstandingOnly));
    }

    @GetMapping("/followup-stats")
    public Map<String, BucketStat> followUpStats(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String salesPerson,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "true") boolean outstandingOnly) {
        return debtorService.followUpStats(TenantHeaders.require(tenantId),
                filter(category, salesPerson, search, null, outstandingOnly));
    }

    @GetMapping("/credit-utilization")
    public List<CreditUtilization> creditUtilization(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId) {
        return debtorService.creditUtilization(TenantHeaders.require(tenantId));
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> export(@RequestHeader(TenantHeaders.TENANT_HEADER) String tenantId,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String salesPerson,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String bucket,
            @RequestParam(defaultValue = "true") boolean outstandingOnly) {
        String tenant = TenantHeaders.require(tenantId);
        DebtorReport report = debtorService.listDebtors(tenant,
                filter(category, salesPerson, search, bucket, outstandingOnly));
        byte[] workbook = debtorExportService.export(report.getDebtors());

        String fileName = "debtors-" + tenant + "-" + LocalDate.now(clock) + ".xlsx";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(XLSX)
                .body(workbook);
    }

    private static DebtorFilter filter(String category, String salesPerson, String search, String bucket,
            boolean outstandingOnly) {
        return DebtorFilter.builder()
                .category(blank(category) ? null : CustomerCategory.fromLabel(category.trim()))
                .salesPerson(blank(salesPerson) ? null : salesPerson.trim())
                .search(blank(search) ? null : search)
                .bucket(blank(bucket) ? null : FollowUpBucket.fromKey(bucket.trim()))
                .outstandingOnly(outstandingOnly)
                .build();
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
