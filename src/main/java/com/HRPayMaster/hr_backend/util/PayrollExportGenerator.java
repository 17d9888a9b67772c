package com.HRPayMaster.hr_backend.util;

import com.HRPayMaster.hr_backend.dto.response.PayrollEntryResponse;
import com.HRPayMaster.hr_backend.dto.response.PayrollRunResponse;
import com.HRPayMaster.hr_backend.exception.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.http.HttpStatus;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public class PayrollExportGenerator {

    private PayrollExportGenerator() {
        // Utility class, no instantiation
    }

    public static byte[] generatePayrollRunExcel(PayrollRunResponse run, String currency) {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            Sheet sheet = workbook.createSheet("Payroll " + sanitizeSheetName(run.getPeriod()));

            CellStyle titleStyle = createTitleStyle(workbook);
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle currencyStyle = createCurrencyStyle(workbook);

            int rowNum = 0;
            Row titleRow = sheet.createRow(rowNum++);
            titleRow.createCell(0).setCellValue("Payroll Run: " + run.getPeriod());
            titleRow.getCell(0).setCellStyle(titleStyle);

            Row periodRow = sheet.createRow(rowNum++);
            periodRow.createCell(0).setCellValue("Period:");
            periodRow.createCell(1).setCellValue(DateRangeUtil.formatDate(run.getStartDate())
                    + " to " + DateRangeUtil.formatDate(run.getEndDate()));

            Row currencyRow = sheet.createRow(rowNum++);
            currencyRow.createCell(0).setCellValue("Currency:");
            currencyRow.createCell(1).setCellValue(currency);

            rowNum++;

            List<String> allowanceKeys = run.getAllowanceKeys() != null ? run.getAllowanceKeys() : List.of();
            List<String> headers = new ArrayList<>(List.of(
                    "Employee Code", "Employee Name", "Working Days", "Actual Working Days", "Vacation Days",
                    "Base Salary", "Bonus"));
            for (String key : allowanceKeys) {
                headers.add("Allowance: " + key);
            }
            headers.addAll(List.of("Loan Deduction", "Other Deductions", "Gross Pay", "Net Pay", "Notes"));

            Row headerRow = sheet.createRow(rowNum++);
            for (int i = 0; i < headers.size(); i++) {
                headerRow.createCell(i).setCellValue(headers.get(i));
                headerRow.getCell(i).setCellStyle(headerStyle);
            }

            List<PayrollEntryResponse> entries = run.getEntries() != null ? run.getEntries() : List.of();
            for (PayrollEntryResponse entry : entries) {
                Row row = sheet.createRow(rowNum++);
                int col = 0;
                row.createCell(col++).setCellValue(entry.getEmployeeCode());
                row.createCell(col++).setCellValue(entry.getEmployeeName());
                row.createCell(col++).setCellValue(entry.getWorkingDays());
                row.createCell(col++).setCellValue(entry.getActualWorkingDays());
                row.createCell(col++).setCellValue(entry.getVacationDays() != null ? entry.getVacationDays() : 0);
                col = writeMoney(row, col, entry.getBaseSalary(), currencyStyle);
                col = writeMoney(row, col, entry.getBonusAmount(), currencyStyle);
                Map<String, BigDecimal> allowances = entry.getAllowances() != null ? entry.getAllowances() : Map.of();
                for (String key : allowanceKeys) {
                    col = writeMoney(row, col, allowances.get(key), currencyStyle);
                }
                col = writeMoney(row, col, entry.getLoanDeduction(), currencyStyle);
                col = writeMoney(row, col, entry.getOtherDeductions(), currencyStyle);
                col = writeMoney(row, col, entry.getGrossPay(), currencyStyle);
                col = writeMoney(row, col, entry.getNetPay(), currencyStyle);
                row.createCell(col).setCellValue(entry.getAdjustmentReason() != null ? entry.getAdjustmentReason() : "");
            }

            rowNum++;

            Row grossRow = sheet.createRow(rowNum++);
            grossRow.createCell(0).setCellValue("Total Gross:");
            writeMoney(grossRow, 1, run.getGrossAmount(), currencyStyle);

            Row deductionsRow = sheet.createRow(rowNum++);
            deductionsRow.createCell(0).setCellValue("Total Deductions:");
            writeMoney(deductionsRow, 1, run.getTotalDeductions(), currencyStyle);

            Row netRow = sheet.createRow(rowNum);
            netRow.createCell(0).setCellValue("Total Net:");
            writeMoney(netRow, 1, run.getNetAmount(), currencyStyle);

            for (int i = 0; i < headers.size(); i++) {
                sheet.autoSizeColumn(i);
            }

            workbook.write(out);
            return out.toByteArray();

        } catch (IOException e) {
            log.error("Failed to generate payroll export for run {}", run.getId(), e);
            throw new ApiException("Failed to generate payroll export", HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    private static int writeMoney(Row row, int col, BigDecimal value, CellStyle style) {
        Cell cell = row.createCell(col);
        if (value != null) {
            cell.setCellValue(value.doubleValue());
            cell.setCellStyle(style);
        }
        return col + 1;
    }

    // Excel sheet names are limited to 31 characters and a restricted charset
    private static String sanitizeSheetName(String period) {
        String cleaned = period == null ? "" : period.replaceAll("[\\\\/?*\\[\\]:]", "-");
        return cleaned.length() > 23 ? cleaned.substring(0, 23) : cleaned;
    }

    private static CellStyle createTitleStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints((short) 14);
        style.setFont(font);
        return style;
    }

    private static CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        return style;
    }

    private static CellStyle createCurrencyStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        DataFormat format = workbook.createDataFormat();
        style.setDataFormat(format.getFormat("#,##0.00"));
        return style;
    }
}
