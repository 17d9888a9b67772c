package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.dto.request.AssetAssignmentRequest;
import com.HRPayMaster.hr_backend.dto.request.AssetRequest;
import com.HRPayMaster.hr_backend.dto.response.AssetAssignmentResponse;
import com.HRPayMaster.hr_backend.dto.response.AssetResponse;
import com.HRPayMaster.hr_backend.enums.AssetStatus;
import com.HRPayMaster.hr_backend.enums.AssignmentStatus;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ResourceNotFoundException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Asset;
import com.HRPayMaster.hr_backend.model.AssetAssignment;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import com.HRPayMaster.hr_backend.repository.AssetAssignmentRepository;
import com.HRPayMaster.hr_backend.repository.AssetRepository;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AssetService {

    private final AssetRepository assetRepository;
    private final AssetAssignmentRepository assetAssignmentRepository;
    private final EmployeeRepository employeeRepository;
    private final CoverageService coverageService;
    private final Clock clock;

    @Transactional
    public AssetResponse createAsset(AssetRequest request) {
        Asset asset = Asset.builder()
                .name(request.getName().trim())
                .type(request.getType().trim())
                .details(request.getDetails())
                .status(AssetStatus.AVAILABLE)
                .build();

        Asset saved = assetRepository.save(asset);
        log.info("Asset created with ID: {}", saved.getId());
        return mapToAssetResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<AssetResponse> getAssets() {
        return assetRepository.findAll().stream()
                .map(this::mapToAssetResponse)
                .collect(Collectors.toList());
    }

    /**
     * Hands an asset to an employee. Refused when the asset is not available or the employee
     * is on approved leave on the assigned date.
     */
    @Transactional
    public AssetAssignmentResponse assignAsset(UUID assetId, AssetAssignmentRequest request) {
        Asset asset = assetRepository.findById(assetId)
                .orElseThrow(() -> new ResourceNotFoundException("Asset", "id", assetId));
        Employee employee = employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", request.getEmployeeId()));

        if (request.getReturnDate() != null && request.getReturnDate().isBefore(request.getAssignedDate())) {
            throw ValidationException.forField("assignment", "returnDate", "Return date must not precede the assigned date");
        }
        if (asset.getStatus() != AssetStatus.AVAILABLE
                || !assetAssignmentRepository.findByAssetIdAndStatus(assetId, AssignmentStatus.ACTIVE).isEmpty()) {
            throw new ConflictException("Asset is not available for assignment", "asset", assetId);
        }

        Optional<VacationRequest> leave = coverageService.findLeaveConflict(employee.getId(), request.getAssignedDate());
        if (leave.isPresent()) {
            VacationRequest vacation = leave.get();
            throw new ConflictException(String.format("Employee is on approved leave from %s to %s",
                    vacation.getStartDate(), vacation.getEndDate()), "vacation_request", vacation.getId());
        }

        AssetAssignment assignment = AssetAssignment.builder()
                .asset(asset)
                .employee(employee)
                .assignedDate(request.getAssignedDate())
                .returnDate(request.getReturnDate())
                .notes(request.getNotes())
                .status(AssignmentStatus.ACTIVE)
                .build();

        asset.setStatus(AssetStatus.ASSIGNED);
        assetRepository.save(asset);
        AssetAssignment saved = assetAssignmentRepository.save(assignment);

        log.info("Asset {} assigned to employee {} on {}", assetId, employee.getId(), request.getAssignedDate());
        return mapToAssignmentResponse(saved);
    }

    @Transactional
    public AssetAssignmentResponse returnAsset(UUID assignmentId) {
        AssetAssignment assignment = assetAssignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Asset assignment", "id", assignmentId));
        if (assignment.getStatus() != AssignmentStatus.ACTIVE) {
            throw new ConflictException("Asset assignment is already closed", "asset_assignment", assignmentId);
        }

        assignment.setStatus(AssignmentStatus.COMPLETED);
        assignment.setReturnDate(LocalDate.now(clock));
        Asset asset = assignment.getAsset();
        asset.setStatus(AssetStatus.AVAILABLE);
        assetRepository.save(asset);

        log.info("Asset {} returned by employee {}", asset.getId(), assignment.getEmployee().getId());
        return mapToAssignmentResponse(assetAssignmentRepository.save(assignment));
    }

    @Transactional(readOnly = true)
    public List<AssetAssignmentResponse> getEmployeeAssignments(UUID employeeId) {
        return assetAssignmentRepository.findByEmployeeIdOrderByAssignedDateDesc(employeeId).stream()
                .map(this::mapToAssignmentResponse)
                .collect(Collectors.toList());
    }

    private AssetResponse mapToAssetResponse(Asset asset) {
        return AssetResponse.builder()
                .id(asset.getId())
                .name(asset.getName())
                .type(asset.getType())
                .status(asset.getStatus())
                .details(asset.getDetails())
                .build();
    }

    private AssetAssignmentResponse mapToAssignmentResponse(AssetAssignment assignment) {
        return AssetAssignmentResponse.builder()
                .id(assignment.getId())
                .assetId(assignment.getAsset().getId())
                .assetName(assignment.getAsset().getName())
                .employeeId(assignment.getEmployee().getId())
                .employeeName(assignment.getEmployee().getFullName())
                .assignedDate(assignment.getAssignedDate())
                .returnDate(assignment.getReturnDate())
                .status(assignment.getStatus())
                .notes(assignment.getNotes())
                .build();
    }
}
