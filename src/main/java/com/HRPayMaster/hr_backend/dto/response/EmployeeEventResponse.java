package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.EventStatus;
import com.HRPayMaster.hr_backend.enums.EventType;
import com.HRPayMaster.hr_backend.enums.RecurrenceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeEventResponse {
    private UUID id;
    private UUID employeeId;
    private EventType eventType;
    private String title;
    private String description;
    private BigDecimal amount;
    private LocalDate eventDate;
    // Date of this projected occurrence; equals eventDate for one-off events
    private LocalDate occurrenceDate;
    private boolean affectsPayroll;
    private EventStatus status;
    private RecurrenceType recurrenceType;
    private LocalDate recurrenceEndDate;
}
