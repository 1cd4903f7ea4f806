package com.ardesk.collections.service;

import com.ardesk.collections.dto.DebtorSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes the debtor view as an xlsx workbook, one row per debtor.
 */
@Slf4j
@Service
public class DebtorExportService {

    static final String[] HEADERS = {
            "Customer", "Category", "Sales Person", "Opening Balance", "Invoiced", "Received", "Outstanding",
            "Invoices", "Receipts", "Last Invoice", "Last Payment", "Overdue Days", "Next Follow-up", "Follow-up"
    };

    public byte[] export(List<DebtorSnapshot> debtors) {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Debtors");

            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            CellStyle moneyStyle = workbook.createCellStyle();
            moneyStyle.setDataFormat(workbook.createDataFormat().getFormat("#,##0.00"));

            Row header = sheet.createRow(0);
            for (int i = 0; i < HEADERS.length; i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(HEADERS[i]);
                cell.setCellStyle(headerStyle);
            }

            int rowIndex = 1;
            for (DebtorSnapshot debtor : debtors) {
                Row row = sheet.createRow(rowIndex++);
                int col = 0;
                row.createCell(col++).setCellValue(debtor.getCustomerName());
                row.createCell(col++).setCellValue(debtor.getCategory().getLabel());
                row.createCell(col++).setCellValue(text(debtor.getSalesPerson()));
                money(row, col++, debtor.getOpeningBalance(), moneyStyle);
                money(row, col++, debtor.getInvoiceTotal(), moneyStyle);
                money(row, col++, debtor.getReceiptTotal(), moneyStyle);
                money(row, col++, debtor.getOutstandingBalance(), moneyStyle);
                row.createCell(col++).setCellValue(debtor.getInvoiceCount());
                row.createCell(col++).setCellValue(debtor.getReceiptCount());
                row.createCell(col++).setCellValue(date(debtor.getLastInvoiceDate()));
                row.createCell(col++).setCellValue(date(debtor.getLastPaymentDate()));
                row.createCell(col++).setCellValue(debtor.getOverdueDays());
                row.createCell(col++).setCellValue(dateTime(debtor.getNextFollowUpDate()));
                row.createCell(col).setCellValue(debtor.getFollowUpBucket().getKey());
            }

            // Widths in 1/256ths of a character
            for (int i = 0; i < HEADERS.length; i++) {
                sheet.setColumnWidth(i, (i == 0 ? 32 : 16) * 256);
            }

            workbook.write(out);
            log.debug("Exported {} debtors", debtors.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write debtor workbook", e);
        }
    }

    private static void money(Row row, int col, BigDecimal amount, CellStyle style) {
        Cell cell = row.createCell(col);
        cell.setCellValue(amount.doubleValue());
        cell.setCellStyle(style);
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }

    // ISO-8601 text, matching the JSON API
    private static String date(LocalDate value) {
        return value == null ? "" : value.toString();
    }

    private static String dateTime(LocalDateTime value) {
        return value == null ? "" : value.toString();
    }
}
