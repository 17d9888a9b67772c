package com.HRPayMaster.hr_backend.controller;

import com.HRPayMaster.hr_backend.dto.request.VacationApprovalActionRequest;
import com.HRPayMaster.hr_backend.dto.request.VacationRequestCreateRequest;
import com.HRPayMaster.hr_backend.dto.request.VacationTransitionRequest;
import com.HRPayMaster.hr_backend.dto.response.ApiResponse;
import com.HRPayMaster.hr_backend.dto.response.CoverageResponse;
import com.HRPayMaster.hr_backend.dto.response.PaginatedResponse;
import com.HRPayMaster.hr_backend.dto.response.VacationResponse;
import com.HRPayMaster.hr_backend.enums.VacationStatus;
import com.HRPayMaster.hr_backend.service.CoverageService;
import com.HRPayMaster.hr_backend.service.VacationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/vacations")
@RequiredArgsConstructor
public class VacationController {

    private final VacationService vacationService;
    private final CoverageService coverageService;

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER', 'EMPLOYEE')")
    public ResponseEntity<ApiResponse<VacationResponse>> submitVacation(
            @Valid @RequestBody VacationRequestCreateRequest request) {

        VacationResponse vacation = vacationService.submitVacation(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(vacation, "Vacation request submitted successfully"));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<PaginatedResponse<VacationResponse>>> getVacations(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) UUID employeeId,
            @RequestParam(required = false) VacationStatus status) {

        return ResponseEntity.ok(ApiResponse.success(vacationService.getVacations(page, limit, employeeId, status)));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER', 'EMPLOYEE')")
    public ResponseEntity<ApiResponse<VacationResponse>> getVacation(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(vacationService.getVacation(id)));
    }

    @PostMapping("/{id}/approval")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<VacationResponse>> actOnApproval(
            @PathVariable UUID id,
            @Valid @RequestBody VacationApprovalActionRequest request) {

        VacationResponse vacation = vacationService.actOnApproval(id, request);
        return ResponseEntity.ok(ApiResponse.success(vacation, "Approval action recorded"));
    }

    @PostMapping("/{id}/complete")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<VacationResponse>> markCompleted(
            @PathVariable UUID id,
            @RequestBody(required = false) VacationTransitionRequest request) {

        VacationResponse vacation = vacationService.markCompleted(id, request);
        return ResponseEntity.ok(ApiResponse.success(vacation, "Vacation marked as completed"));
    }

    @PostMapping("/{id}/cancel")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER', 'EMPLOYEE')")
    public ResponseEntity<ApiResponse<VacationResponse>> cancel(
            @PathVariable UUID id,
            @RequestBody(required = false) VacationTransitionRequest request) {

        VacationResponse vacation = vacationService.cancel(id, request);
        return ResponseEntity.ok(ApiResponse.success(vacation, "Vacation request cancelled"));
    }

    @GetMapping("/coverage")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<CoverageResponse>> checkCoverage(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer threshold) {

        return ResponseEntity.ok(ApiResponse.success(coverageService.checkCoverage(startDate, endDate, threshold)));
    }
}
