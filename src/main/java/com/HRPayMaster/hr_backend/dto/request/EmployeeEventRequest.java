package com.HRPayMaster.hr_backend.dto.request;

import com.HRPayMaster.hr_backend.enums.EventType;
import com.HRPayMaster.hr_backend.enums.RecurrenceType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
public class EmployeeEventRequest {

    @NotNull(message = "Employee ID is required")
    private UUID employeeId;

    @NotNull(message = "Event type is required")
    private EventType eventType;

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    private String title;

    @Size(max = 1000, message = "Description must not exceed 1000 characters")
    private String description;

    @DecimalMin(value = "0.0", message = "Amount cannot be negative")
    private BigDecimal amount;

    @NotNull(message = "Event date is required")
    private LocalDate eventDate;

    private Boolean affectsPayroll;

    private RecurrenceType recurrenceType;

    private LocalDate recurrenceEndDate;
}
