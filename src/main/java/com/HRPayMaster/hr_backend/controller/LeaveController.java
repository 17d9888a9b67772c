package com.HRPayMaster.hr_backend.controller;

import com.HRPayMaster.hr_backend.dto.request.LeavePolicyAssignmentRequest;
import com.HRPayMaster.hr_backend.dto.request.LeavePolicyRequest;
import com.HRPayMaster.hr_backend.dto.response.ApiResponse;
import com.HRPayMaster.hr_backend.dto.response.LeaveBalanceResponse;
import com.HRPayMaster.hr_backend.dto.response.LeavePolicyAssignmentResponse;
import com.HRPayMaster.hr_backend.dto.response.LeavePolicyResponse;
import com.HRPayMaster.hr_backend.dto.response.LedgerEntryResponse;
import com.HRPayMaster.hr_backend.service.LeaveAccrualService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/leave")
@RequiredArgsConstructor
public class LeaveController {

    private final LeaveAccrualService leaveAccrualService;
    private final Clock clock;

    @GetMapping("/balances/{employeeId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER', 'EMPLOYEE')")
    public ResponseEntity<ApiResponse<List<LeaveBalanceResponse>>> getBalances(
            @PathVariable UUID employeeId,
            @RequestParam(required = false) Integer year) {

        List<LeaveBalanceResponse> balances = leaveAccrualService.getLeaveBalances(employeeId, yearOrCurrent(year));
        return ResponseEntity.ok(ApiResponse.success(balances));
    }

    @GetMapping("/balances/{employeeId}/{leaveType}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER', 'EMPLOYEE')")
    public ResponseEntity<ApiResponse<LeaveBalanceResponse>> getBalance(
            @PathVariable UUID employeeId,
            @PathVariable String leaveType,
            @RequestParam(required = false) Integer year) {

        LeaveBalanceResponse balance = leaveAccrualService.getLeaveBalance(employeeId, leaveType, yearOrCurrent(year));
        return ResponseEntity.ok(ApiResponse.success(balance));
    }

    @GetMapping("/ledger/{employeeId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER', 'EMPLOYEE')")
    public ResponseEntity<ApiResponse<List<LedgerEntryResponse>>> getLedger(@PathVariable UUID employeeId) {
        return ResponseEntity.ok(ApiResponse.success(leaveAccrualService.getLedger(employeeId)));
    }

    @PostMapping("/policies")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LeavePolicyResponse>> createPolicy(@Valid @RequestBody LeavePolicyRequest request) {
        LeavePolicyResponse policy = leaveAccrualService.createPolicy(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(policy, "Leave policy created successfully"));
    }

    @GetMapping("/policies")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<List<LeavePolicyResponse>>> getPolicies(
            @RequestParam(required = false) String leaveType) {
        return ResponseEntity.ok(ApiResponse.success(leaveAccrualService.getPolicies(leaveType)));
    }

    @PostMapping("/assignments")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LeavePolicyAssignmentResponse>> assignPolicy(
            @Valid @RequestBody LeavePolicyAssignmentRequest request) {
        LeavePolicyAssignmentResponse assignment = leaveAccrualService.assignPolicy(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(assignment, "Leave policy assigned successfully"));
    }

    @GetMapping("/assignments/{employeeId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<List<LeavePolicyAssignmentResponse>>> getAssignments(@PathVariable UUID employeeId) {
        return ResponseEntity.ok(ApiResponse.success(leaveAccrualService.getAssignments(employeeId)));
    }

    private int yearOrCurrent(Integer year) {
        return year != null ? year : LocalDate.now(clock).getYear();
    }
}
