package com.HRPayMaster.hr_backend.controller;

import com.HRPayMaster.hr_backend.dto.request.AssetAssignmentRequest;
import com.HRPayMaster.hr_backend.dto.request.AssetRequest;
import com.HRPayMaster.hr_backend.dto.response.ApiResponse;
import com.HRPayMaster.hr_backend.dto.response.AssetAssignmentResponse;
import com.HRPayMaster.hr_backend.dto.response.AssetResponse;
import com.HRPayMaster.hr_backend.service.AssetService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetService assetService;

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<AssetResponse>> createAsset(@Valid @RequestBody AssetRequest request) {
        AssetResponse asset = assetService.createAsset(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(asset, "Asset created successfully"));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<List<AssetResponse>>> getAssets() {
        return ResponseEntity.ok(ApiResponse.success(assetService.getAssets()));
    }

    @PostMapping("/{id}/assignments")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<AssetAssignmentResponse>> assignAsset(
            @PathVariable UUID id,
            @Valid @RequestBody AssetAssignmentRequest request) {

        AssetAssignmentResponse assignment = assetService.assignAsset(id, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(assignment, "Asset assigned successfully"));
    }

    @PatchMapping("/assignments/{assignmentId}/return")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<AssetAssignmentResponse>> returnAsset(@PathVariable UUID assignmentId) {
        return ResponseEntity.ok(ApiResponse.success(assetService.returnAsset(assignmentId), "Asset returned successfully"));
    }

    @GetMapping("/assignments/employee/{employeeId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'MANAGER')")
    public ResponseEntity<ApiResponse<List<AssetAssignmentResponse>>> getEmployeeAssignments(@PathVariable UUID employeeId) {
        return ResponseEntity.ok(ApiResponse.success(assetService.getEmployeeAssignments(employeeId)));
    }
}
