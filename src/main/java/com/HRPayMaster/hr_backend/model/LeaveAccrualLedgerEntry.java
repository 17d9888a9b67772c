package com.HRPayMaster.hr_backend.model;

import com.HRPayMaster.hr_backend.enums.LedgerEntryType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "leave_accrual_ledger",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"employee_id", "leave_type", "entry_type", "entry_date", "source_key"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeaveAccrualLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "policy_id")
    private LeaveAccrualPolicy policy;

    @Column(name = "leave_type", nullable = false)
    private String leaveType;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false)
    private LedgerEntryType entryType;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    // Identifies what produced the line, e.g. the policy assignment or the vacation request
    @Column(name = "source_key", nullable = false)
    private String sourceKey;

    @Column(nullable = false, precision = 7, scale = 2)
    private BigDecimal amount;

    private String notes;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
