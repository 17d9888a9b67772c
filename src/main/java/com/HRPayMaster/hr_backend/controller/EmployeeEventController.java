package com.HRPayMaster.hr_backend.controller;

import com.HRPayMaster.hr_backend.dto.request.EmployeeEventRequest;
import com.HRPayMaster.hr_backend.dto.response.ApiResponse;
import com.HRPayMaster.hr_backend.dto.response.EmployeeEventResponse;
import com.HRPayMaster.hr_backend.service.EmployeeEventService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/employee-events")
@RequiredArgsConstructor
public class EmployeeEventController {

    private final EmployeeEventService employeeEventService;

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<EmployeeEventResponse>> createEvent(
            @Valid @RequestBody EmployeeEventRequest request) {

        EmployeeEventResponse event = employeeEventService.createEvent(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(event, "Event created successfully"));
    }

    @GetMapping("/employee/{employeeId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<List<EmployeeEventResponse>>> getEmployeeEvents(
            @PathVariable UUID employeeId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        List<EmployeeEventResponse> events = startDate != null || endDate != null
                ? employeeEventService.getEventsForPeriod(employeeId, startDate, endDate)
                : employeeEventService.getEmployeeEvents(employeeId);
        return ResponseEntity.ok(ApiResponse.success(events));
    }

    @PatchMapping("/{id}/cancel")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<EmployeeEventResponse>> cancelEvent(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(employeeEventService.cancelEvent(id), "Event cancelled successfully"));
    }
}
