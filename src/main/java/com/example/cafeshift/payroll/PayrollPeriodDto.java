package com.example.cafeshift.payroll;

import com.example.cafeshift.payroll.PayrollPeriod.PeriodStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PayrollPeriodDto(Long id, Long branchId, LocalDate startDate, LocalDate endDate,
                               PeriodStatus status, BigDecimal totalHours, BigDecimal totalPay) {

    public static PayrollPeriodDto from(PayrollPeriod period) {
        return new PayrollPeriodDto(period.getId(), period.getBranchId(), period.getStartDate(), period.getEndDate(),
                period.getStatus(), period.getTotalHours(), period.getTotalPay());
    }
}
