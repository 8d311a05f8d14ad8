package com.example.cafeshift.employee;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDateTime;

@Entity
@Table(name = "employees")
public class Employee {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    @NotBlank(message = "Employee name is required")
    @Size(max = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EmployeeRole role = EmployeeRole.EMPLOYEE;

    @Column(length = 50)
    private String position;

    @NotNull
    @DecimalMin("0.00")
    @Column(name = "hourly_rate", nullable = false, precision = 12, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "branch_id", nullable = false)
    private Long branchId;

    // null falls back to the branch rest day
    @Enumerated(EnumType.STRING)
    @Column(name = "rest_day")
    private DayOfWeek restDay;

    @Column(name = "is_active")
    private Boolean active = true;

    // Recurring deductions taken every pay period
    @Column(name = "sss_loan_deduction", precision = 12, scale = 2)
    private BigDecimal sssLoanDeduction = BigDecimal.ZERO;

    @Column(name = "pagibig_loan_deduction", precision = 12, scale = 2)
    private BigDecimal pagibigLoanDeduction = BigDecimal.ZERO;

    @Column(name = "cash_advance_deduction", precision = 12, scale = 2)
    private BigDecimal cashAdvanceDeduction = BigDecimal.ZERO;

    @Column(name = "other_deductions", precision = 12, scale = 2)
    private BigDecimal otherDeductions = BigDecimal.ZERO;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Employee() {
    }

    public Employee(String name, EmployeeRole role, BigDecimal hourlyRate, Long branchId) {
        this.name = name;
        this.role = role;
        this.hourlyRate = hourlyRate;
        this.branchId = branchId;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public EmployeeRole getRole() { return role; }
    public void setRole(EmployeeRole role) { this.role = role; }
    public String getPosition() { return position; }
    public void setPosition(String position) { this.position = position; }
    public BigDecimal getHourlyRate() { return hourlyRate; }
    public void setHourlyRate(BigDecimal hourlyRate) { this.hourlyRate = hourlyRate; }
    public Long getBranchId() { return branchId; }
    public void setBranchId(Long branchId) { this.branchId = branchId; }
    public DayOfWeek getRestDay() { return restDay; }
    public void setRestDay(DayOfWeek restDay) { this.restDay = restDay; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public BigDecimal getSssLoanDeduction() { return sssLoanDeduction; }
    public void setSssLoanDeduction(BigDecimal sssLoanDeduction) { this.sssLoanDeduction = sssLoanDeduction; }
    public BigDecimal getPagibigLoanDeduction() { return pagibigLoanDeduction; }
    public void setPagibigLoanDeduction(BigDecimal pagibigLoanDeduction) { this.pagibigLoanDeduction = pagibigLoanDeduction; }
    public BigDecimal getCashAdvanceDeduction() { return cashAdvanceDeduction; }
    public void setCashAdvanceDeduction(BigDecimal cashAdvanceDeduction) { this.cashAdvanceDeduction = cashAdvanceDeduction; }
    public BigDecimal getOtherDeductions() { return otherDeductions; }
    public void setOtherDeductions(BigDecimal otherDeductions) { this.otherDeductions = otherDeductions; }
    public LocalDateTime getCreatedAt() { return createdAt; }

    @Override
    public String toString() {
        return "Employee{id=" + id + ", name='" + name + "', role=" + role + ", branchId=" + branchId + '}';
    }
}
