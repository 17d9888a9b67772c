package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.AssignmentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetAssignmentResponse {
    private UUID id;
    private UUID assetId;
    private String assetName;
    private UUID employeeId;
    private String employeeName;
    private LocalDate assignedDate;
    private LocalDate returnDate;
    private AssignmentStatus status;
    private String notes;
}
