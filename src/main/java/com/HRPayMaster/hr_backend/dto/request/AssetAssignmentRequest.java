package com.HRPayMaster.hr_backend.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.util.UUID;

@Data
public class AssetAssignmentRequest {

    @NotNull(message = "Employee ID is required")
    private UUID employeeId;

    @NotNull(message = "Assigned date is required")
    private LocalDate assignedDate;

    private LocalDate returnDate;

    private String notes;
}
