package com.HRPayMaster.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.util.UUID;

/**
 * One row per calendar day claimed by a payroll run. The unique day column makes two runs with
 * overlapping periods impossible to commit.
 */
@Entity
@Table(name = "payroll_run_days",
        uniqueConstraints = @UniqueConstraint(name = "uk_payroll_run_day", columnNames = "run_day"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayrollRunDay {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "payroll_run_id", nullable = false)
    private UUID payrollRunId;

    @Column(name = "run_day", nullable = false)
    private LocalDate day;
}
