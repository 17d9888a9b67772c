package com.HRPayMaster.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "payroll_entries")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayrollEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "payroll_run_id", nullable = false)
    private PayrollRun payrollRun;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal baseSalary;

    // Null columns below mean the category was switched off for the run
    @Column(precision = 10, scale = 2)
    private BigDecimal bonusAmount;

    @ElementCollection
    @CollectionTable(name = "payroll_entry_allowances", joinColumns = @JoinColumn(name = "payroll_entry_id"))
    @MapKeyColumn(name = "allowance_key")
    @Column(name = "amount", precision = 10, scale = 2)
    @Builder.Default
    private Map<String, BigDecimal> allowances = new LinkedHashMap<>();

    @Builder.Default
    private boolean allowancesTracked = true;

    @Column(nullable = false)
    private int workingDays;

    @Column(nullable = false)
    private int actualWorkingDays;

    private Integer vacationDays;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal taxDeduction = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal socialSecurityDeduction = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal healthInsuranceDeduction = BigDecimal.ZERO;

    @Column(precision = 10, scale = 2)
    private BigDecimal loanDeduction;

    @Column(precision = 10, scale = 2)
    private BigDecimal otherDeductions;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal grossPay;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal netPay;

    @Column(length = 1000)
    private String adjustmentReason;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public BigDecimal getTotalDeductions() {
        BigDecimal total = taxDeduction.add(socialSecurityDeduction).add(healthInsuranceDeduction);
        if (loanDeduction != null) {
            total = total.add(loanDeduction);
        }
        if (otherDeductions != null) {
            total = total.add(otherDeductions);
        }
        return total;
    }
}
