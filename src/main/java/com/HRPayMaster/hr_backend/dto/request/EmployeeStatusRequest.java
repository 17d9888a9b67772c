package com.HRPayMaster.hr_backend.dto.request;

import com.HRPayMaster.hr_backend.enums.EmployeeStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class EmployeeStatusRequest {

    @NotNull(message = "Status is required")
    private EmployeeStatus status;
}
