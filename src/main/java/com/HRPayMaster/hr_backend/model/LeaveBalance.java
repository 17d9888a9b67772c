package com.HRPayMaster.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "leave_balances",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "leave_type", "balance_year"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeaveBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @Column(name = "leave_type", nullable = false)
    private String leaveType;

    @Column(name = "balance_year", nullable = false)
    private int year;

    @Column(nullable = false, precision = 7, scale = 2)
    @Builder.Default
    private BigDecimal accruedDays = BigDecimal.ZERO;

    @Column(nullable = false, precision = 7, scale = 2)
    @Builder.Default
    private BigDecimal usedDays = BigDecimal.ZERO;

    @Column(nullable = false, precision = 7, scale = 2)
    @Builder.Default
    private BigDecimal carriedOverDays = BigDecimal.ZERO;

    @Column(nullable = false, precision = 7, scale = 2)
    @Builder.Default
    private BigDecimal balanceDays = BigDecimal.ZERO;

    // Set once the prior year's closing balance has been carried in
    @Builder.Default
    private boolean carryoverApplied = false;

    private LocalDate lastAccrualDate;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public void recomputeBalance() {
        this.balanceDays = carriedOverDays.add(accruedDays).subtract(usedDays);
    }
}
