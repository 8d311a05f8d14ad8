package com.example.cafeshift.payroll;

import java.util.List;

/**
 * Outcome of one payroll run. Employees that failed are listed in {@code errors}; the others
 * have an entry in {@code entries}.
 */
public record PayrollRunResult(Long periodId,
                               List<PayrollEntryDto> entries,
                               List<EmployeeError> errors,
                               boolean cancelled) {

    public PayrollRunResult {
        entries = List.copyOf(entries);
        errors = List.copyOf(errors);
    }

    public record EmployeeError(Long employeeId, String errorCode, String message) {}
}
