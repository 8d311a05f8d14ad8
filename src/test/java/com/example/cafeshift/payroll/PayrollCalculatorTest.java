package com.example.cafeshift.payroll;

import com.example.cafeshift.branch.BranchPayrollSettings;
import com.example.cafeshift.config.CafeProperties;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.employee.EmployeeRole;
import com.example.cafeshift.exception.ValidationException;
import com.example.cafeshift.holiday.HolidayCalendar;
import com.example.cafeshift.hours.HourBuckets;
import com.example.cafeshift.hours.HoursAggregator;
import com.example.cafeshift.hours.TimeInterval;
import com.example.cafeshift.hours.WorkedShift;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Statutory deductions are switched off here, so no bracket lookups happen.
 */
class PayrollCalculatorTest {

    private static final LocalDate START = LocalDate.of(2025, 6, 2);
    private static final LocalDate END = LocalDate.of(2025, 6, 15);

    private CafeProperties properties;
    private PayrollCalculator calculator;
    private BranchPayrollSettings noStatutory;
    private Employee employee;

    @BeforeEach
    void setUp() {
        properties = new CafeProperties();
        calculator = new PayrollCalculator(properties, null);
        noStatutory = BranchPayrollSettings.defaults(1L);
        noStatutory.setDeductSss(false);
        noStatutory.setDeductPhilHealth(false);
        noStatutory.setDeductPagibig(false);
        noStatutory.setDeductWithholdingTax(false);
        employee = new Employee("Night owl", EmployeeRole.EMPLOYEE, new BigDecimal("100.00"), 1L);
    }

    @Test
    void compute_nightShiftEarnsDifferential() {
        HourBuckets buckets = buckets(LocalDateTime.of(2025, 6, 3, 22, 0), LocalDateTime.of(2025, 6, 4, 6, 0));
        employee.setOtherDeductions(new BigDecimal("50"));

        PayrollComputation result = calculator.compute(buckets, new BigDecimal("100"), employee, noStatutory, START, END);

        assertThat(result.basicPay()).isEqualByComparingTo("800.00");
        assertThat(result.nightDiffHours()).isEqualByComparingTo("8.00");
        assertThat(result.nightDiffPay()).isEqualByComparingTo("80.00");
        assertThat(result.grossPay()).isEqualByComparingTo("880.00");
        assertThat(result.sssContribution()).isEqualByComparingTo("0.00");
        assertThat(result.otherDeductions()).isEqualByComparingTo("50.00");
        assertThat(result.netPay()).isEqualByComparingTo("830.00");
    }

    @Test
    void compute_restDayUsesConfiguredMultiplier() {
        // 8 June 2025 is a Sunday
        HourBuckets buckets = buckets(LocalDateTime.of(2025, 6, 8, 9, 0), LocalDateTime.of(2025, 6, 8, 13, 0));

        PayrollComputation result = calculator.compute(buckets, new BigDecimal("100"), employee, noStatutory, START, END);

        assertThat(result.restDayHours()).isEqualByComparingTo("4.00");
        assertThat(result.restDayPay()).isEqualByComparingTo("520.00");
        assertThat(result.basicPay()).isEqualByComparingTo("0.00");
    }

    @Test
    void compute_deductionsAboveGrossFail() {
        HourBuckets buckets = buckets(LocalDateTime.of(2025, 6, 3, 9, 0), LocalDateTime.of(2025, 6, 3, 10, 0));
        employee.setSssLoanDeduction(new BigDecimal("150"));

        assertThatThrownBy(() -> calculator.compute(buckets, new BigDecimal("100"), employee, noStatutory, START, END))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "NEGATIVE_NET_PAY");
    }

    @Test
    void deductionBasis_monthlyEquivalentScalesByWeeks() {
        properties.getPayroll().setDeductionBasis(CafeProperties.DeductionBasis.MONTHLY_EQUIVALENT);

        assertThat(calculator.deductionBasis(new BigDecimal("10000"), START, END)).isEqualByComparingTo("21650.00");
        assertThat(calculator.deductionBasis(new BigDecimal("5000"), START, START.plusDays(6))).isEqualByComparingTo("21650.00");
    }

    @Test
    void deductionBasis_periodGrossIsUnchanged() {
        assertThat(calculator.deductionBasis(new BigDecimal("10000"), START, END)).isEqualByComparingTo("10000");
    }

    private HourBuckets buckets(LocalDateTime start, LocalDateTime end) {
        HoursAggregator aggregator = new HoursAggregator(properties);
        return aggregator.aggregate(List.of(new WorkedShift(new TimeInterval(start, end), List.of())),
                HolidayCalendar.empty(), DayOfWeek.SUNDAY);
    }
}
