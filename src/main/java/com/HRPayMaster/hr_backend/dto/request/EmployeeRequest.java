package com.HRPayMaster.hr_backend.dto.request;

import jakarta.validation.constraints.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
public class EmployeeRequest {

    @NotBlank(message = "Employee code is required")
    private String employeeCode;

    @NotBlank(message = "First name is required")
    @Size(max = 100, message = "First name must not exceed 100 characters")
    private String firstName;

    @Size(max = 100, message = "Last name must not exceed 100 characters")
    private String lastName;

    @Email(message = "Email must be valid")
    private String email;

    private String phone;

    private String position;

    private UUID departmentId;

    private LocalDate hireDate;

    @NotNull(message = "Salary is required")
    @DecimalMin(value = "0.0", message = "Salary cannot be negative")
    private BigDecimal salary;

    @Min(value = 1, message = "Standard working days must be at least 1")
    @Max(value = 31, message = "Standard working days must not exceed 31")
    private Integer standardWorkingDays;

    private String bankName;
    private String bankIban;
}
