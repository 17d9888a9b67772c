package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.EmployeeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeResponse {
    private UUID id;
    private String employeeCode;
    private String firstName;
    private String lastName;
    private String fullName;
    private String email;
    private String phone;
    private String position;
    private UUID departmentId;
    private String departmentName;
    private LocalDate hireDate;
    private BigDecimal salary;
    private Integer standardWorkingDays;
    private EmployeeStatus status;
    private String bankName;
    private String bankIban;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
