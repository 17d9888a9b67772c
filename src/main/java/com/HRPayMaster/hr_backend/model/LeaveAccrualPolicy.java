package com.HRPayMaster.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "leave_accrual_policies")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeaveAccrualPolicy {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String leaveType;

    @Column(nullable = false, precision = 7, scale = 2)
    private BigDecimal accrualRatePerMonth;

    @Column(precision = 7, scale = 2)
    private BigDecimal maxBalanceDays;

    @Column(precision = 7, scale = 2)
    private BigDecimal carryoverLimitDays;

    @Builder.Default
    private boolean allowNegativeBalance = false;

    @Column(nullable = false)
    private LocalDate effectiveFrom;

    private LocalDate expiresOn;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
