package com.example.cafeshift.payroll;

import com.example.cafeshift.payroll.PayrollEntry.EntryStatus;

public record PayrollEntryDto(Long id,
                              Long employeeId,
                              Long periodId,
                              EntryStatus status,
                              PayrollComputation amounts) {

    public static PayrollEntryDto from(PayrollEntry entry) {
        return new PayrollEntryDto(entry.getId(), entry.getEmployee().getId(), entry.getPeriod().getId(),
                entry.getStatus(), entry.toComputation());
    }
}
