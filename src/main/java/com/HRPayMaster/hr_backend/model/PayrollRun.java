package com.HRPayMaster.hr_backend.model;

import com.HRPayMaster.hr_backend.enums.PayrollStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "payroll_runs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayrollRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String period;

    @Column(nullable = false)
    private LocalDate startDate;

    @Column(nullable = false)
    private LocalDate endDate;

    @Column(nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal grossAmount = BigDecimal.ZERO;

    @Column(nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal totalDeductions = BigDecimal.ZERO;

    @Column(nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal netAmount = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private PayrollStatus status = PayrollStatus.COMPLETED;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "allowances", column = @Column(name = "toggle_allowances")),
            @AttributeOverride(name = "bonuses", column = @Column(name = "toggle_bonuses")),
            @AttributeOverride(name = "deductions", column = @Column(name = "toggle_deductions")),
            @AttributeOverride(name = "loans", column = @Column(name = "toggle_loans")),
            @AttributeOverride(name = "vacations", column = @Column(name = "toggle_vacations"))
    })
    @Builder.Default
    private ScenarioToggles scenarioToggles = ScenarioToggles.allEnabled();

    @OneToMany(mappedBy = "payrollRun", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    @Builder.Default
    private List<PayrollEntry> entries = new ArrayList<>();

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    public void addEntry(PayrollEntry entry) {
        entry.setPayrollRun(this);
        entries.add(entry);
    }
}
