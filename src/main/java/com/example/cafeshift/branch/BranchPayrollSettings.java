package com.example.cafeshift.branch;

import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

/**
 * Per-branch payroll configuration: the default rest day and which statutory deductions apply.
 */
@Entity
@Table(name = "branch_payroll_settings")
public class BranchPayrollSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "branch_id", nullable = false, unique = true)
    private Long branchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rest_day", nullable = false)
    private DayOfWeek restDay = DayOfWeek.SUNDAY;

    @Column(name = "deduct_sss")
    private Boolean deductSss = true;

    @Column(name = "deduct_philhealth")
    private Boolean deductPhilHealth = true;

    @Column(name = "deduct_pagibig")
    private Boolean deductPagibig = true;

    @Column(name = "deduct_withholding_tax")
    private Boolean deductWithholdingTax = true;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected BranchPayrollSettings() {
    }

    public BranchPayrollSettings(Long branchId) {
        this.branchId = branchId;
    }

    /** Defaults used for branches that never stored settings. */
    public static BranchPayrollSettings defaults(Long branchId) {
        return new BranchPayrollSettings(branchId);
    }

    @PrePersist
    @PreUpdate
    protected void touch() { this.updatedAt = LocalDateTime.now(); }

    public Long getId() { return id; }
    public Long getBranchId() { return branchId; }
    public DayOfWeek getRestDay() { return restDay; }
    public void setRestDay(DayOfWeek restDay) { this.restDay = restDay; }
    public Boolean getDeductSss() { return deductSss; }
    public void setDeductSss(Boolean deductSss) { this.deductSss = deductSss; }
    public Boolean getDeductPhilHealth() { return deductPhilHealth; }
    public void setDeductPhilHealth(Boolean deductPhilHealth) { this.deductPhilHealth = deductPhilHealth; }
    public Boolean getDeductPagibig() { return deductPagibig; }
    public void setDeductPagibig(Boolean deductPagibig) { this.deductPagibig = deductPagibig; }
    public Boolean getDeductWithholdingTax() { return deductWithholdingTax; }
    public void setDeductWithholdingTax(Boolean deductWithholdingTax) { this.deductWithholdingTax = deductWithholdingTax; }
}
