package com.HRPayMaster.hr_backend.controller;

import com.HRPayMaster.hr_backend.dto.request.AmortizationRequest;
import com.HRPayMaster.hr_backend.dto.request.LoanPaymentRequest;
import com.HRPayMaster.hr_backend.dto.request.LoanRequest;
import com.HRPayMaster.hr_backend.dto.response.AmortizationScheduleResponse;
import com.HRPayMaster.hr_backend.dto.response.ApiResponse;
import com.HRPayMaster.hr_backend.dto.response.LoanPaymentResponse;
import com.HRPayMaster.hr_backend.dto.response.LoanResponse;
import com.HRPayMaster.hr_backend.dto.response.PaginatedResponse;
import com.HRPayMaster.hr_backend.enums.LoanStatus;
import com.HRPayMaster.hr_backend.service.LoanService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/loans")
@RequiredArgsConstructor
public class LoanController {

    private final LoanService loanService;

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LoanResponse>> createLoan(@Valid @RequestBody LoanRequest request) {
        LoanResponse loan = loanService.createLoan(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(loan, "Loan created successfully"));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<PaginatedResponse<LoanResponse>>> getLoans(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) UUID employeeId,
            @RequestParam(required = false) LoanStatus status) {

        return ResponseEntity.ok(ApiResponse.success(loanService.getLoans(page, limit, employeeId, status)));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<LoanResponse>> getLoan(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(loanService.getLoan(id)));
    }

    @PatchMapping("/{id}/approve")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LoanResponse>> approveLoan(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(loanService.approveLoan(id), "Loan approved successfully"));
    }

    @PatchMapping("/{id}/pause")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LoanResponse>> pauseLoan(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(loanService.pauseLoan(id), "Loan paused successfully"));
    }

    @PatchMapping("/{id}/resume")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LoanResponse>> resumeLoan(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(loanService.resumeLoan(id), "Loan resumed successfully"));
    }

    @GetMapping("/{id}/payments")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<List<LoanPaymentResponse>>> getPayments(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(loanService.getPayments(id)));
    }

    @PostMapping("/{id}/payments")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LoanResponse>> recordPayment(
            @PathVariable UUID id,
            @Valid @RequestBody LoanPaymentRequest request) {

        LoanResponse loan = loanService.recordManualPayment(id, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(loan, "Payment recorded successfully"));
    }

    @GetMapping("/{id}/schedule")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<AmortizationScheduleResponse>> getSchedule(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(loanService.getLoanSchedule(id)));
    }

    @PostMapping("/schedule/preview")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<AmortizationScheduleResponse>> previewSchedule(
            @Valid @RequestBody AmortizationRequest request) {
        return ResponseEntity.ok(ApiResponse.success(loanService.previewSchedule(request)));
    }
}
