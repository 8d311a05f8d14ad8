package com.example.cafeshift.payroll;

import java.math.BigDecimal;

/**
 * Every computed amount of one employee's payroll entry. Hours and money are scale 2.
 */
public record PayrollComputation(BigDecimal hourlyRate,
                                 BigDecimal regularHours,
                                 BigDecimal overtimeHours,
                                 BigDecimal holidayHours,
                                 BigDecimal restDayHours,
                                 BigDecimal nightDiffHours,
                                 BigDecimal totalHours,
                                 BigDecimal basicPay,
                                 BigDecimal overtimePay,
                                 BigDecimal holidayPay,
                                 BigDecimal restDayPay,
                                 BigDecimal nightDiffPay,
                                 BigDecimal grossPay,
                                 BigDecimal sssContribution,
                                 BigDecimal philHealthContribution,
                                 BigDecimal pagibigContribution,
                                 BigDecimal withholdingTax,
                                 BigDecimal sssLoan,
                                 BigDecimal pagibigLoan,
                                 BigDecimal advances,
                                 BigDecimal otherDeductions,
                                 BigDecimal totalDeductions,
                                 BigDecimal netPay) {
}
