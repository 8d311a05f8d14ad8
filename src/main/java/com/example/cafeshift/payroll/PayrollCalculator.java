package com.example.cafeshift.payroll;

import com.example.cafeshift.branch.BranchPayrollSettings;
import com.example.cafeshift.config.CafeProperties;
import com.example.cafeshift.deduction.DeductionBracketResolver;
import com.example.cafeshift.deduction.DeductionType;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.exception.ValidationException;
import com.example.cafeshift.holiday.HolidayType;
import com.example.cafeshift.hours.HourBuckets;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Turns hour buckets into pay components, statutory and recurring deductions and net pay.
 */
@Component
public class PayrollCalculator {

    private static final BigDecimal WEEKS_PER_MONTH = new BigDecimal("4.33");
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private final CafeProperties properties;
    private final DeductionBracketResolver bracketResolver;

    public PayrollCalculator(CafeProperties properties, DeductionBracketResolver bracketResolver) {
        this.properties = properties;
        this.bracketResolver = bracketResolver;
    }

    /**
     * @throws ValidationException when deductions exceed gross pay
     * @throws com.example.cafeshift.exception.ComputationException when a bracket table cannot be applied
     */
    public PayrollComputation compute(HourBuckets buckets, BigDecimal hourlyRate, Employee employee,
                                      BranchPayrollSettings settings, LocalDate periodStart, LocalDate periodEnd) {
        CafeProperties.Rates rates = properties.getPayroll().getRates();
        BigDecimal rate = hourlyRate.setScale(2, RoundingMode.HALF_UP);

        BigDecimal basicPay = money(buckets.regularHours().multiply(rate));
        BigDecimal overtimePay = money(buckets.overtimeHours().multiply(rate).multiply(rates.getOvertime()));
        BigDecimal holidayPay = holidayPay(buckets, rate, rates);
        BigDecimal restDayPay = money(buckets.restDayHours().multiply(rate).multiply(rates.getRestDay()));
        BigDecimal nightDiffPay = money(buckets.nightDifferentialHours().multiply(rate).multiply(rates.getNightDifferential()));
        BigDecimal grossPay = basicPay.add(overtimePay).add(holidayPay).add(restDayPay).add(nightDiffPay);

        BigDecimal basis = deductionBasis(grossPay, periodStart, periodEnd);
        BigDecimal sss = statutory(settings.getDeductSss(), DeductionType.SSS, basis, periodEnd);
        BigDecimal philHealth = statutory(settings.getDeductPhilHealth(), DeductionType.PHILHEALTH, basis, periodEnd);
        BigDecimal pagibig = statutory(settings.getDeductPagibig(), DeductionType.PAGIBIG, basis, periodEnd);
        BigDecimal tax = statutory(settings.getDeductWithholdingTax(), DeductionType.TAX, basis, periodEnd);

        BigDecimal sssLoan = recurring(employee.getSssLoanDeduction());
        BigDecimal pagibigLoan = recurring(employee.getPagibigLoanDeduction());
        BigDecimal advances = recurring(employee.getCashAdvanceDeduction());
        BigDecimal other = recurring(employee.getOtherDeductions());

        BigDecimal totalDeductions = sss.add(philHealth).add(pagibig).add(tax)
                .add(sssLoan).add(pagibigLoan).add(advances).add(other);
        BigDecimal netPay = grossPay.subtract(totalDeductions);
        if (netPay.signum() < 0) {
            throw new ValidationException("NEGATIVE_NET_PAY",
                    "Deductions " + totalDeductions + " exceed gross pay " + grossPay + " for employee " + employee.getId(),
                    employee.getId(), grossPay, totalDeductions);
        }

        return new PayrollComputation(rate,
                buckets.regularHours(), buckets.overtimeHours(), buckets.holidayHours(), buckets.restDayHours(),
                buckets.nightDifferentialHours(), buckets.payableHours(),
                basicPay, overtimePay, holidayPay, restDayPay, nightDiffPay, grossPay,
                sss, philHealth, pagibig, tax, sssLoan, pagibigLoan, advances, other,
                totalDeductions, netPay);
    }

    /**
     * Salary figure the bracket tables are looked up with.
     */
    BigDecimal deductionBasis(BigDecimal grossPay, LocalDate periodStart, LocalDate periodEnd) {
        if (properties.getPayroll().getDeductionBasis() == CafeProperties.DeductionBasis.PERIOD_GROSS) {
            return grossPay;
        }
        long days = ChronoUnit.DAYS.between(periodStart, periodEnd);
        long weeks = Math.max(1, (days + 6) / 7);
        return grossPay.divide(BigDecimal.valueOf(weeks), 4, RoundingMode.HALF_UP)
                .multiply(WEEKS_PER_MONTH)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private BigDecimal holidayPay(HourBuckets buckets, BigDecimal rate, CafeProperties.Rates rates) {
        BigDecimal total = ZERO;
        for (HolidayType type : HolidayType.values()) {
            long minutes = buckets.holidayMinutes(type);
            if (minutes == 0) {
                continue;
            }
            BigDecimal multiplier = switch (type) {
                case REGULAR -> rates.getRegularHoliday();
                case SPECIAL_NON_WORKING -> rates.getSpecialNonWorkingHoliday();
                case SPECIAL_WORKING -> rates.getSpecialWorkingHoliday();
            };
            total = total.add(money(HourBuckets.toHours(minutes).multiply(rate).multiply(multiplier)));
        }
        return total;
    }

    private BigDecimal statutory(Boolean enabled, DeductionType type, BigDecimal basis, LocalDate asOf) {
        if (!Boolean.TRUE.equals(enabled) || basis.signum() == 0) {
            return ZERO;
        }
        return bracketResolver.resolve(type, basis, asOf);
    }

    private static BigDecimal recurring(BigDecimal amount) {
        return amount == null ? ZERO : money(amount);
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
