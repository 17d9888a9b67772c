package com.HRPayMaster.hr_backend.controller;

import com.HRPayMaster.hr_backend.dto.request.PayrollEntryUpdateRequest;
import com.HRPayMaster.hr_backend.dto.request.PayrollGenerationRequest;
import com.HRPayMaster.hr_backend.dto.response.ApiResponse;
import com.HRPayMaster.hr_backend.dto.response.PaginatedResponse;
import com.HRPayMaster.hr_backend.dto.response.PayrollEntryResponse;
import com.HRPayMaster.hr_backend.dto.response.PayrollRunResponse;
import com.HRPayMaster.hr_backend.service.PayrollService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/payroll")
@RequiredArgsConstructor
public class PayrollController {

    private static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final PayrollService payrollService;

    @PostMapping("/generate")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<PayrollRunResponse>> generatePayroll(
            @Valid @RequestBody PayrollGenerationRequest request) {

        PayrollRunResponse run = payrollService.generatePayroll(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(run, "Payroll generated successfully"));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<PaginatedResponse<PayrollRunResponse>>> getPayrollRuns(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {

        return ResponseEntity.ok(ApiResponse.success(payrollService.getPayrollRuns(page, limit)));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<PayrollRunResponse>> getPayrollRun(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(payrollService.getPayrollRun(id)));
    }

    @GetMapping("/{id}/export")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<byte[]> exportPayrollRun(@PathVariable UUID id) {
        byte[] workbook = payrollService.exportPayrollRun(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"payroll-" + id + ".xlsx\"")
                .contentType(XLSX)
                .body(workbook);
    }

    @PostMapping("/{id}/recalculate")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<PayrollRunResponse>> recalculate(@PathVariable UUID id) {
        PayrollRunResponse run = payrollService.recalculate(id);
        return ResponseEntity.ok(ApiResponse.success(run, "Payroll recalculated successfully"));
    }

    @PutMapping("/entries/{entryId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<PayrollEntryResponse>> updateEntry(
            @PathVariable UUID entryId,
            @Valid @RequestBody PayrollEntryUpdateRequest request) {

        PayrollEntryResponse entry = payrollService.updateEntry(entryId, request);
        return ResponseEntity.ok(ApiResponse.success(entry, "Payroll entry updated successfully"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deletePayrollRun(@PathVariable UUID id) {
        payrollService.deletePayrollRun(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Payroll run deleted successfully"));
    }
}
