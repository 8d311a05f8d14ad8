package com.example.cafeshift.payroll;

import com.example.cafeshift.employee.Employee;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

@Entity
@Table(name = "payroll_entries", uniqueConstraints = {
        @UniqueConstraint(name = "uk_payroll_entry_employee_period", columnNames = {"employee_id", "period_id"})
})
public class PayrollEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "period_id", nullable = false)
    private PayrollPeriod period;

    /** Rate in force when the entry was first computed; later recomputes reuse it. */
    @Column(name = "hourly_rate", nullable = false, precision = 12, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "regular_hours", precision = 10, scale = 2) private BigDecimal regularHours;
    @Column(name = "overtime_hours", precision = 10, scale = 2) private BigDecimal overtimeHours;
    @Column(name = "holiday_hours", precision = 10, scale = 2) private BigDecimal holidayHours;
    @Column(name = "rest_day_hours", precision = 10, scale = 2) private BigDecimal restDayHours;
    @Column(name = "night_diff_hours", precision = 10, scale = 2) private BigDecimal nightDiffHours;
    @Column(name = "total_hours", precision = 10, scale = 2) private BigDecimal totalHours;

    @Column(name = "basic_pay", precision = 14, scale = 2) private BigDecimal basicPay;
    @Column(name = "overtime_pay", precision = 14, scale = 2) private BigDecimal overtimePay;
    @Column(name = "holiday_pay", precision = 14, scale = 2) private BigDecimal holidayPay;
    @Column(name = "rest_day_pay", precision = 14, scale = 2) private BigDecimal restDayPay;
    @Column(name = "night_diff_pay", precision = 14, scale = 2) private BigDecimal nightDiffPay;
    @Column(name = "gross_pay", precision = 14, scale = 2) private BigDecimal grossPay;

    @Column(name = "sss_contribution", precision = 12, scale = 2) private BigDecimal sssContribution;
    @Column(name = "philhealth_contribution", precision = 12, scale = 2) private BigDecimal philHealthContribution;
    @Column(name = "pagibig_contribution", precision = 12, scale = 2) private BigDecimal pagibigContribution;
    @Column(name = "withholding_tax", precision = 12, scale = 2) private BigDecimal withholdingTax;
    @Column(name = "sss_loan", precision = 12, scale = 2) private BigDecimal sssLoan;
    @Column(name = "pagibig_loan", precision = 12, scale = 2) private BigDecimal pagibigLoan;
    @Column(name = "advances", precision = 12, scale = 2) private BigDecimal advances;
    @Column(name = "other_deductions", precision = 12, scale = 2) private BigDecimal otherDeductions;
    @Column(name = "total_deductions", precision = 14, scale = 2) private BigDecimal totalDeductions;
    @Column(name = "net_pay", precision = 14, scale = 2) private BigDecimal netPay;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EntryStatus status = EntryStatus.DRAFT;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected PayrollEntry() {
    }

    public PayrollEntry(Employee employee, PayrollPeriod period, BigDecimal hourlyRate) {
        this.employee = employee;
        this.period = period;
        this.hourlyRate = hourlyRate.setScale(2, RoundingMode.HALF_UP);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /** Overwrites every computed amount with {@code computation}. */
    public void apply(PayrollComputation computation) {
        this.regularHours = computation.regularHours();
        this.overtimeHours = computation.overtimeHours();
        this.holidayHours = computation.holidayHours();
        this.restDayHours = computation.restDayHours();
        this.nightDiffHours = computation.nightDiffHours();
        this.totalHours = computation.totalHours();
        this.basicPay = computation.basicPay();
        this.overtimePay = computation.overtimePay();
        this.holidayPay = computation.holidayPay();
        this.restDayPay = computation.restDayPay();
        this.nightDiffPay = computation.nightDiffPay();
        this.grossPay = computation.grossPay();
        this.sssContribution = computation.sssContribution();
        this.philHealthContribution = computation.philHealthContribution();
        this.pagibigContribution = computation.pagibigContribution();
        this.withholdingTax = computation.withholdingTax();
        this.sssLoan = computation.sssLoan();
        this.pagibigLoan = computation.pagibigLoan();
        this.advances = computation.advances();
        this.otherDeductions = computation.otherDeductions();
        this.totalDeductions = computation.totalDeductions();
        this.netPay = computation.netPay();
    }

    /** Computed amounts as a value, for comparisons between runs. */
    public PayrollComputation toComputation() {
        return new PayrollComputation(hourlyRate, regularHours, overtimeHours, holidayHours, restDayHours,
                nightDiffHours, totalHours, basicPay, overtimePay, holidayPay, restDayPay, nightDiffPay, grossPay,
                sssContribution, philHealthContribution, pagibigContribution, withholdingTax, sssLoan, pagibigLoan,
                advances, otherDeductions, totalDeductions, netPay);
    }

    public Long getId() { return id; }
    public Employee getEmployee() { return employee; }
    public PayrollPeriod getPeriod() { return period; }
    public BigDecimal getHourlyRate() { return hourlyRate; }
    public BigDecimal getRegularHours() { return regularHours; }
    public BigDecimal getOvertimeHours() { return overtimeHours; }
    public BigDecimal getHolidayHours() { return holidayHours; }
    public BigDecimal getRestDayHours() { return restDayHours; }
    public BigDecimal getNightDiffHours() { return nightDiffHours; }
    public BigDecimal getTotalHours() { return totalHours; }
    public BigDecimal getBasicPay() { return basicPay; }
    public BigDecimal getOvertimePay() { return overtimePay; }
    public BigDecimal getHolidayPay() { return holidayPay; }
    public BigDecimal getRestDayPay() { return restDayPay; }
    public BigDecimal getNightDiffPay() { return nightDiffPay; }
    public BigDecimal getGrossPay() { return grossPay; }
    public BigDecimal getSssContribution() { return sssContribution; }
    public BigDecimal getPhilHealthContribution() { return philHealthContribution; }
    public BigDecimal getPagibigContribution() { return pagibigContribution; }
    public BigDecimal getWithholdingTax() { return withholdingTax; }
    public BigDecimal getSssLoan() { return sssLoan; }
    public BigDecimal getPagibigLoan() { return pagibigLoan; }
    public BigDecimal getAdvances() { return advances; }
    public BigDecimal getOtherDeductions() { return otherDeductions; }
    public BigDecimal getTotalDeductions() { return totalDeductions; }
    public BigDecimal getNetPay() { return netPay; }
    public EntryStatus getStatus() { return status; }
    public void setStatus(EntryStatus status) { this.status = status; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    public enum EntryStatus {
        DRAFT,
        APPROVED,
        PAID
    }
}
