package com.HRPayMaster.hr_backend.dto.request;

import lombok.Data;

@Data
public class ScenarioTogglesRequest {
    private Boolean allowances;
    private Boolean bonuses;
    private Boolean deductions;
    private Boolean loans;
    private Boolean vacations;
}
