package com.ardesk.collections.service;

import com.ardesk.collections.dto.DebtorSnapshot;
import com.ardesk.collections.engine.FollowUpBucket;
import com.ardesk.collections.model.CustomerCategory;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DebtorExportServiceTest {

    private final DebtorExportService exportService = new DebtorExportService();

    @Test
    void export_ShouldWriteOneRowPerDebtorWithCurrencyFormat() throws Exception {
        DebtorSnapshot debtor = DebtorSnapshot.builder()
                .customerId(1L)
                .customerName("Annapurna Traders")
                .category(CustomerCategory.GAMMA)
                .openingBalance(new BigDecimal("0.00"))
                .invoiceTotal(new BigDecimal("1250.50"))
                .receiptTotal(new BigDecimal("250.00"))
                .outstandingBalance(new BigDecimal("1000.50"))
                .invoiceCount(2)
                .receiptCount(1)
                .lastInvoiceDate(LocalDate.of(2025, 3, 1))
                .overdueDays(12)
                .followUpBucket(FollowUpBucket.NO_FOLLOW_UP)
                .build();

        byte[] bytes = exportService.export(List.of(debtor));

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet sheet = workbook.getSheet("Debtors");
            assertEquals(1, sheet.getLastRowNum());
            assertEquals("Customer", sheet.getRow(0).getCell(0).getStringCellValue());

            Row row = sheet.getRow(1);
            assertEquals("Annapurna Traders", row.getCell(0).getStringCellValue());
            assertEquals("Gamma", row.getCell(1).getStringCellValue());
            assertEquals(1000.50, row.getCell(6).getNumericCellValue(), 0.001);
            assertEquals("#,##0.00", row.getCell(6).getCellStyle().getDataFormatString());
            assertEquals("2025-03-01", row.getCell(9).getStringCellValue());
            assertEquals("noFollowUp", row.getCell(13).getStringCellValue());
        }
    }
}
