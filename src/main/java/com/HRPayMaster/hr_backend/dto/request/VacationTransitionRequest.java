package com.HRPayMaster.hr_backend.dto.request;

import lombok.Data;

import java.util.UUID;

@Data
public class VacationTransitionRequest {
    private UUID actorId;
    private Boolean resumeLoans;
    private String notes;
}
