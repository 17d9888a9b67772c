package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.dto.request.AssetAssignmentRequest;
import com.HRPayMaster.hr_backend.dto.response.AssetAssignmentResponse;
import com.HRPayMaster.hr_backend.enums.AssetStatus;
import com.HRPayMaster.hr_backend.enums.AssignmentStatus;
import com.HRPayMaster.hr_backend.enums.VacationStatus;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.model.Asset;
import com.HRPayMaster.hr_backend.model.AssetAssignment;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import com.HRPayMaster.hr_backend.repository.AssetAssignmentRepository;
import com.HRPayMaster.hr_backend.repository.AssetRepository;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssetService")
class AssetServiceTest {

    @Mock
    private AssetRepository assetRepository;
    @Mock
    private AssetAssignmentRepository assetAssignmentRepository;
    @Mock
    private EmployeeRepository employeeRepository;
    @Mock
    private CoverageService coverageService;

    private AssetService assetService;
    private Asset laptop;
    private Employee employee;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-08-15T09:00:00Z"), ZoneOffset.UTC);
        assetService = new AssetService(assetRepository, assetAssignmentRepository, employeeRepository,
                coverageService, clock);
        laptop = Asset.builder().id(UUID.randomUUID()).name("Laptop 14").type("laptop")
                .status(AssetStatus.AVAILABLE).build();
        employee = Employee.builder().id(UUID.randomUUID()).firstName("Omar").build();
    }

    private AssetAssignmentRequest request(LocalDate assignedDate) {
        AssetAssignmentRequest request = new AssetAssignmentRequest();
        request.setEmployeeId(employee.getId());
        request.setAssignedDate(assignedDate);
        return request;
    }

    @Test
    @DisplayName("Assigning to an employee on approved leave is a conflict naming the leave")
    void assignDuringLeaveConflicts() {
        LocalDate date = LocalDate.of(2024, 8, 20);
        VacationRequest leave = VacationRequest.builder()
                .id(UUID.randomUUID())
                .employee(employee)
                .status(VacationStatus.APPROVED)
                .startDate(LocalDate.of(2024, 8, 18))
                .endDate(LocalDate.of(2024, 8, 22))
                .build();
        when(assetRepository.findById(laptop.getId())).thenReturn(Optional.of(laptop));
        when(employeeRepository.findById(employee.getId())).thenReturn(Optional.of(employee));
        when(assetAssignmentRepository.findByAssetIdAndStatus(laptop.getId(), AssignmentStatus.ACTIVE)).thenReturn(List.of());
        when(coverageService.findLeaveConflict(employee.getId(), date)).thenReturn(Optional.of(leave));

        assertThatThrownBy(() -> assetService.assignAsset(laptop.getId(), request(date)))
                .isInstanceOfSatisfying(ConflictException.class, ex -> {
                    assertThat(ex.getConflictingResource()).isEqualTo("vacation_request");
                    assertThat(ex.getConflictingId()).isEqualTo(leave.getId());
                });
        verify(assetAssignmentRepository, never()).save(any());
        assertThat(laptop.getStatus()).isEqualTo(AssetStatus.AVAILABLE);
    }

    @Test
    @DisplayName("An available asset is assigned and marked as assigned")
    void assignAvailableAsset() {
        LocalDate date = LocalDate.of(2024, 8, 16);
        when(assetRepository.findById(laptop.getId())).thenReturn(Optional.of(laptop));
        when(employeeRepository.findById(employee.getId())).thenReturn(Optional.of(employee));
        when(assetAssignmentRepository.findByAssetIdAndStatus(laptop.getId(), AssignmentStatus.ACTIVE)).thenReturn(List.of());
        when(coverageService.findLeaveConflict(employee.getId(), date)).thenReturn(Optional.empty());
        when(assetAssignmentRepository.save(any(AssetAssignment.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AssetAssignmentResponse response = assetService.assignAsset(laptop.getId(), request(date));

        assertThat(response.getStatus()).isEqualTo(AssignmentStatus.ACTIVE);
        assertThat(response.getEmployeeName()).isEqualTo("Omar");
        assertThat(laptop.getStatus()).isEqualTo(AssetStatus.ASSIGNED);
    }

    @Test
    @DisplayName("An asset already handed out cannot be assigned again")
    void assignedAssetConflicts() {
        laptop.setStatus(AssetStatus.ASSIGNED);
        when(assetRepository.findById(laptop.getId())).thenReturn(Optional.of(laptop));
        when(employeeRepository.findById(employee.getId())).thenReturn(Optional.of(employee));

        assertThatThrownBy(() -> assetService.assignAsset(laptop.getId(), request(LocalDate.of(2024, 8, 16))))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("Returning closes the assignment today and frees the asset")
    void returnAsset() {
        laptop.setStatus(AssetStatus.ASSIGNED);
        AssetAssignment assignment = AssetAssignment.builder()
                .id(UUID.randomUUID())
                .asset(laptop)
                .employee(employee)
                .assignedDate(LocalDate.of(2024, 8, 1))
                .status(AssignmentStatus.ACTIVE)
                .build();
        when(assetAssignmentRepository.findById(assignment.getId())).thenReturn(Optional.of(assignment));
        when(assetAssignmentRepository.save(assignment)).thenReturn(assignment);

        AssetAssignmentResponse response = assetService.returnAsset(assignment.getId());

        assertThat(response.getStatus()).isEqualTo(AssignmentStatus.COMPLETED);
        assertThat(response.getReturnDate()).isEqualTo(LocalDate.of(2024, 8, 15));
        assertThat(laptop.getStatus()).isEqualTo(AssetStatus.AVAILABLE);
    }
}
