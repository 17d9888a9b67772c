package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.config.PayrollProperties;
import com.HRPayMaster.hr_backend.dto.request.AmortizationRequest;
import com.HRPayMaster.hr_backend.dto.request.LoanPaymentRequest;
import com.HRPayMaster.hr_backend.dto.request.LoanRequest;
import com.HRPayMaster.hr_backend.dto.response.AmortizationScheduleResponse;
import com.HRPayMaster.hr_backend.dto.response.LoanPaymentResponse;
import com.HRPayMaster.hr_backend.dto.response.LoanResponse;
import com.HRPayMaster.hr_backend.dto.response.PaginatedResponse;
import com.HRPayMaster.hr_backend.enums.LoanStatus;
import com.HRPayMaster.hr_backend.exception.ComputationException;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ResourceNotFoundException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.Loan;
import com.HRPayMaster.hr_backend.model.LoanPayment;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import com.HRPayMaster.hr_backend.repository.LoanPaymentRepository;
import com.HRPayMaster.hr_backend.repository.LoanRepository;
import com.HRPayMaster.hr_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    // Balances below 0.01 count as settled
    private static final BigDecimal SETTLED_THRESHOLD = new BigDecimal("0.01");

    private final LoanRepository loanRepository;
    private final LoanPaymentRepository loanPaymentRepository;
    private final EmployeeRepository employeeRepository;
    private final LoanDeductionScheduler loanDeductionScheduler;
    private final PayrollProperties payrollProperties;
    private final Clock clock;

    @Transactional
    public LoanResponse createLoan(LoanRequest request) {
        Employee employee = employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", request.getEmployeeId()));

        if (request.getEndDate() != null && request.getEndDate().isBefore(request.getStartDate())) {
            throw ValidationException.forField("loan", "endDate", "End date must not precede the start date");
        }
        BigDecimal interestRate = request.getInterestRate() != null ? request.getInterestRate() : BigDecimal.ZERO;
        if (interestRate.signum() > 0
                && request.getMonthlyDeduction().compareTo(monthlyInterest(request.getAmount(), interestRate)) <= 0) {
            throw ValidationException.forField("loan", "monthlyDeduction",
                    "Monthly deduction must exceed the interest portion to reduce principal");
        }

        List<String> warnings = checkSalaryShare(employee, request.getMonthlyDeduction());

        Loan loan = Loan.builder()
                .employee(employee)
                .amount(scale(request.getAmount()))
                .monthlyDeduction(scale(request.getMonthlyDeduction()))
                .remainingAmount(scale(request.getAmount()))
                .interestRate(interestRate)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .reason(request.getReason())
                .status(LoanStatus.PENDING)
                .build();

        Loan saved = loanRepository.save(loan);
        log.info("Loan {} of {} created for employee {}", saved.getId(), saved.getAmount(), employee.getId());

        LoanResponse response = mapToLoanResponse(saved);
        response.setWarnings(warnings);
        return response;
    }

    @Transactional
    public LoanResponse approveLoan(UUID id) {
        Loan loan = findLoan(id);
        if (loan.getStatus() != LoanStatus.PENDING) {
            throw new ConflictException("Only pending loans can be approved", "loan", id);
        }
        loan.setStatus(LoanStatus.ACTIVE);
        log.info("Loan {} approved", id);
        return mapToLoanResponse(loanRepository.save(loan));
    }

    @Transactional
    public LoanResponse pauseLoan(UUID id) {
        Loan loan = findLoan(id);
        if (loan.getStatus() != LoanStatus.ACTIVE) {
            throw new ConflictException("Only active loans can be paused", "loan", id);
        }
        loan.setStatus(LoanStatus.PAUSED);
        log.info("Loan {} paused", id);
        return mapToLoanResponse(loanRepository.save(loan));
    }

    @Transactional
    public LoanResponse resumeLoan(UUID id) {
        Loan loan = findLoan(id);
        if (loan.getStatus() != LoanStatus.PAUSED) {
            throw new ConflictException("Only paused loans can be resumed", "loan", id);
        }
        loan.setStatus(LoanStatus.ACTIVE);
        log.info("Loan {} resumed", id);
        return mapToLoanResponse(loanRepository.save(loan));
    }

    @Transactional(readOnly = true)
    public LoanResponse getLoan(UUID id) {
        return mapToLoanResponse(findLoan(id));
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<LoanResponse> getLoans(int page, int limit, UUID employeeId, LoanStatus status) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("createdAt").descending());
        Page<Loan> loans = loanRepository.findLoansByCriteria(employeeId, status, pageable);

        List<LoanResponse> responses = loans.getContent()
                .stream()
                .map(this::mapToLoanResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, loans.getTotalElements());
    }

    @Transactional(readOnly = true)
    public List<LoanPaymentResponse> getPayments(UUID loanId) {
        findLoan(loanId);
        return loanPaymentRepository.findByLoanIdOrderByPaymentDateAsc(loanId).stream()
                .map(this::mapToPaymentResponse)
                .collect(Collectors.toList());
    }

    /**
     * Records a repayment made outside payroll. Goes through the same ledger path as payroll
     * deductions, so the remaining amount and completion rule are shared.
     */
    @Transactional
    public LoanResponse recordManualPayment(UUID loanId, LoanPaymentRequest request) {
        Loan loan = findLoan(loanId);
        if (loan.getStatus() == LoanStatus.COMPLETED || loan.getStatus() == LoanStatus.PENDING) {
            throw new ConflictException("Payments can only be recorded against active or paused loans", "loan", loanId);
        }
        if (request.getAmount().compareTo(loan.getRemainingAmount()) > 0) {
            throw ValidationException.forField("payment", "amount",
                    "Payment exceeds the remaining balance of " + loan.getRemainingAmount().toPlainString());
        }

        LocalDate paymentDate = request.getPaymentDate() != null ? request.getPaymentDate() : LocalDate.now(clock);
        Loan updated = loanDeductionScheduler.applyDeduction(loan, scale(request.getAmount()), null, paymentDate,
                Constants.LOAN_PAYMENT_SOURCE_MANUAL, request.getNotes());
        return mapToLoanResponse(updated);
    }

    @Transactional(readOnly = true)
    public AmortizationScheduleResponse getLoanSchedule(UUID loanId) {
        Loan loan = findLoan(loanId);
        return amortizationSchedule(loan.getRemainingAmount(), loan.getMonthlyDeduction(), loan.getInterestRate(),
                loan.getStartDate(), loan.getEndDate());
    }

    public AmortizationScheduleResponse previewSchedule(AmortizationRequest request) {
        LocalDate start = request.getStartDate() != null ? request.getStartDate() : LocalDate.now(clock);
        return amortizationSchedule(request.getPrincipal(), request.getMonthlyPayment(),
                request.getAnnualInterestRate(), start, null);
    }

    /**
     * Monthly schedule for a principal repaid at a fixed payment with optional annual interest.
     * A hard {@code endDate} closes the schedule with a balloon installment.
     *
     * @throws ComputationException when the payment does not cover the first month's interest or
     *                              the loan would need more than the installment cap
     */
    public static AmortizationScheduleResponse amortizationSchedule(BigDecimal principal, BigDecimal monthlyPayment,
                                                                    BigDecimal annualInterestRate, LocalDate startDate,
                                                                    LocalDate endDate) {
        if (principal == null || principal.signum() <= 0 || monthlyPayment == null || monthlyPayment.signum() <= 0) {
            throw new ValidationException("Principal and monthly payment must be greater than zero");
        }
        BigDecimal annualRate = annualInterestRate != null ? annualInterestRate : BigDecimal.ZERO;
        BigDecimal monthlyRate = annualRate.divide(MONTHS_PER_YEAR.multiply(HUNDRED), MathContext.DECIMAL64);

        List<AmortizationScheduleResponse.Installment> installments = new ArrayList<>();
        BigDecimal balance = principal;
        BigDecimal totalInterest = BigDecimal.ZERO;
        BigDecimal totalPaid = BigDecimal.ZERO;

        for (int number = 1; balance.compareTo(SETTLED_THRESHOLD) >= 0; number++) {
            if (number > Constants.MAX_AMORTIZATION_INSTALLMENTS) {
                throw new ComputationException("Loan cannot be repaid within "
                        + Constants.MAX_AMORTIZATION_INSTALLMENTS + " installments at this payment");
            }
            LocalDate dueDate = startDate.plusMonths(number - 1L);
            BigDecimal interest = scale(balance.multiply(monthlyRate));
            BigDecimal principalPart;

            if (endDate != null && dueDate.isAfter(endDate)) {
                principalPart = balance;
            } else {
                principalPart = monthlyPayment.subtract(interest);
                if (principalPart.signum() <= 0) {
                    throw new ComputationException(
                            "Monthly payment is insufficient to cover interest; adjust the payment amount");
                }
                principalPart = principalPart.min(balance);
            }

            BigDecimal payment = principalPart.add(interest);
            BigDecimal opening = balance;
            balance = balance.subtract(principalPart).max(BigDecimal.ZERO);
            if (balance.compareTo(SETTLED_THRESHOLD) < 0) {
                balance = BigDecimal.ZERO;
            }

            installments.add(AmortizationScheduleResponse.Installment.builder()
                    .installmentNumber(number)
                    .dueDate(dueDate)
                    .openingBalance(scale(opening))
                    .principalAmount(scale(principalPart))
                    .interestAmount(interest)
                    .paymentAmount(scale(payment))
                    .closingBalance(scale(balance))
                    .build());

            totalInterest = totalInterest.add(interest);
            totalPaid = totalPaid.add(payment);
        }

        return AmortizationScheduleResponse.builder()
                .principal(scale(principal))
                .monthlyPayment(scale(monthlyPayment))
                .annualInterestRate(annualRate)
                .totalInterest(scale(totalInterest))
                .totalPaid(scale(totalPaid))
                .installments(installments)
                .build();
    }

    /**
     * Refuses a deduction above the hard share of salary and returns a warning above the soft
     * share.
     */
    List<String> checkSalaryShare(Employee employee, BigDecimal monthlyDeduction) {
        List<String> warnings = new ArrayList<>();
        BigDecimal salary = employee.getSalary();
        if (salary == null || salary.signum() <= 0) {
            return warnings;
        }
        BigDecimal share = monthlyDeduction.divide(salary, MathContext.DECIMAL64);
        if (share.compareTo(BigDecimal.valueOf(payrollProperties.getLoanDeductionHardLimit())) > 0) {
            throw ValidationException.forField("loan", "monthlyDeduction", String.format(
                    "Monthly deduction exceeds %s%% of employee salary", percent(payrollProperties.getLoanDeductionHardLimit())));
        }
        if (share.compareTo(BigDecimal.valueOf(payrollProperties.getLoanDeductionWarningLimit())) > 0) {
            String warning = String.format("Monthly deduction exceeds %s%% of employee salary",
                    percent(payrollProperties.getLoanDeductionWarningLimit()));
            log.warn("Loan for employee {}: {}", employee.getId(), warning);
            warnings.add(warning);
        }
        return warnings;
    }

    private static String percent(double share) {
        return BigDecimal.valueOf(share).multiply(HUNDRED).stripTrailingZeros().toPlainString();
    }

    private static BigDecimal monthlyInterest(BigDecimal principal, BigDecimal annualRate) {
        return principal.multiply(annualRate).divide(MONTHS_PER_YEAR.multiply(HUNDRED), MathContext.DECIMAL64);
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private Loan findLoan(UUID id) {
        return loanRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Loan", "id", id));
    }

    private LoanResponse mapToLoanResponse(Loan loan) {
        return LoanResponse.builder()
                .id(loan.getId())
                .employeeId(loan.getEmployee().getId())
                .employeeName(loan.getEmployee().getFullName())
                .amount(loan.getAmount())
                .monthlyDeduction(loan.getMonthlyDeduction())
                .remainingAmount(loan.getRemainingAmount())
                .interestRate(loan.getInterestRate())
                .startDate(loan.getStartDate())
                .endDate(loan.getEndDate())
                .status(loan.getStatus())
                .reason(loan.getReason())
                .createdAt(loan.getCreatedAt())
                .build();
    }

    private LoanPaymentResponse mapToPaymentResponse(LoanPayment payment) {
        return LoanPaymentResponse.builder()
                .id(payment.getId())
                .loanId(payment.getLoan().getId())
                .payrollRunId(payment.getPayrollRun() != null ? payment.getPayrollRun().getId() : null)
                .amount(payment.getAmount())
                .paymentDate(payment.getPaymentDate())
                .source(payment.getSource())
                .notes(payment.getNotes())
                .build();
    }
}
