package com.example.cafeshift.payroll;

import com.example.cafeshift.breaks.BreakType;
import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.common.error.ErrorLogBuffer;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.employee.EmployeeRepository;
import com.example.cafeshift.employee.EmployeeRole;
import com.example.cafeshift.exception.ConflictException;
import com.example.cafeshift.exception.ValidationException;
import com.example.cafeshift.holiday.Holiday;
import com.example.cafeshift.holiday.HolidayRepository;
import com.example.cafeshift.holiday.HolidayType;
import com.example.cafeshift.payroll.PayrollEntry.EntryStatus;
import com.example.cafeshift.payroll.PayrollPeriod.PeriodStatus;
import com.example.cafeshift.shift.Shift;
import com.example.cafeshift.shift.ShiftRepository;
import com.example.cafeshift.shift.TimeLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class PayrollServiceTest {

    private static final long BRANCH = 501L;
    // Monday 2 June 2025 through Sunday 15 June 2025
    private static final LocalDate PERIOD_START = LocalDate.of(2025, 6, 2);
    private static final LocalDate PERIOD_END = LocalDate.of(2025, 6, 15);

    @Autowired
    private PayrollService payrollService;

    @Autowired
    private TimeLedgerService timeLedgerService;

    @Autowired
    private EmployeeRepository employeeRepository;

    @Autowired
    private HolidayRepository holidayRepository;

    @Autowired
    private PayrollJobStatusService jobStatusService;

    @Autowired
    private ErrorLogBuffer errorLogBuffer;

    @Autowired
    private ShiftRepository shiftRepository;

    private RequestContext manager;

    @BeforeEach
    void setUp() {
        manager = RequestContext.manager(
                employeeRepository.save(new Employee("Lead", EmployeeRole.MANAGER, new BigDecimal("150.00"), BRANCH)).getId());
    }

    @Test
    void runPayroll_tenDayFortnightAppliesStatutoryBrackets() {
        Employee hana = employee("Hana", "125.00");
        workWeekdays(hana, 10);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);

        PayrollRunResult result = payrollService.runPayroll(manager, period.getId());

        assertThat(result.errors()).isEmpty();
        assertThat(result.entries()).hasSize(1);
        PayrollComputation amounts = result.entries().get(0).amounts();
        assertThat(amounts.regularHours()).isEqualByComparingTo("80.00");
        assertThat(amounts.grossPay()).isEqualByComparingTo("10000.00");
        assertThat(amounts.sssContribution()).isEqualByComparingTo("450.00");
        assertThat(amounts.philHealthContribution()).isEqualByComparingTo("250.00");
        assertThat(amounts.pagibigContribution()).isEqualByComparingTo("100.00");
        assertThat(amounts.withholdingTax()).isEqualByComparingTo("0.00");
        assertThat(amounts.totalDeductions()).isEqualByComparingTo("800.00");
        assertThat(amounts.netPay()).isEqualByComparingTo(amounts.grossPay().subtract(amounts.totalDeductions()));

        PayrollPeriodDto totals = payrollService.getPeriod(period.getId());
        assertThat(totals.totalHours()).isEqualByComparingTo("80.00");
        assertThat(totals.totalPay()).isEqualByComparingTo("10000.00");
    }

    @Test
    void runPayroll_rerunOverwritesTheSameDraft() {
        Employee hana = employee("Hana", "125.00");
        workWeekdays(hana, 3);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);

        PayrollEntryDto first = payrollService.runPayroll(manager, period.getId()).entries().get(0);
        PayrollEntryDto second = payrollService.runPayroll(manager, period.getId()).entries().get(0);

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(second.amounts())
                .usingRecursiveComparison()
                .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .isEqualTo(first.amounts());
        assertThat(payrollService.listEntries(period.getId())).hasSize(1);
    }

    @Test
    void runPayroll_keepsHourlyRateOfExistingDraft() {
        Employee hana = employee("Hana", "125.00");
        workWeekdays(hana, 1);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);
        payrollService.runPayroll(manager, period.getId());

        Employee reloaded = employeeRepository.getRequired(hana.getId());
        reloaded.setHourlyRate(new BigDecimal("200.00"));
        employeeRepository.save(reloaded);

        PayrollEntryDto rerun = payrollService.runPayroll(manager, period.getId()).entries().get(0);
        assertThat(rerun.amounts().hourlyRate()).isEqualByComparingTo("125.00");
        assertThat(rerun.amounts().basicPay()).isEqualByComparingTo("1000.00");
    }

    @Test
    void runPayroll_negativeNetPayIsReportedPerEmployee() {
        Employee ivan = employee("Ivan", "100.00");
        ivan.setCashAdvanceDeduction(new BigDecimal("5000.00"));
        employeeRepository.save(ivan);
        workWeekdays(ivan, 1);
        Employee hana = employee("Hana", "125.00");
        workWeekdays(hana, 2);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);

        PayrollRunResult result = payrollService.runPayroll(manager, period.getId());

        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.employeeId()).isEqualTo(ivan.getId());
            assertThat(error.errorCode()).isEqualTo("NEGATIVE_NET_PAY");
        });
        assertThat(result.entries()).extracting(PayrollEntryDto::employeeId).containsExactly(hana.getId());
        assertThat(payrollService.getPayrollEntry(ivan.getId(), period.getId())).isEmpty();
    }

    @Test
    void runPayroll_regularHolidayPaysDouble() {
        holidayRepository.save(new Holiday(LocalDate.of(2025, 6, 4), "Founders Day", HolidayType.REGULAR));
        Employee jun = employee("Jun", "100.00");
        completedShift(jun, LocalDate.of(2025, 6, 4).atTime(9, 0), 8);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);

        PayrollComputation amounts = payrollService.runPayroll(manager, period.getId()).entries().get(0).amounts();

        assertThat(amounts.holidayHours()).isEqualByComparingTo("8.00");
        assertThat(amounts.regularHours()).isEqualByComparingTo("0.00");
        assertThat(amounts.holidayPay()).isEqualByComparingTo("1600.00");
        assertThat(amounts.grossPay()).isEqualByComparingTo("1600.00");
    }

    @Test
    void runPayroll_unpaidBreakAndOvertime() {
        Employee kim = employee("Kim", "100.00");
        LocalDateTime start = PERIOD_START.atTime(8, 0);
        Shift shift = timeLedgerService.createShift(manager, kim.getId(), start, start.plusHours(10), "Barista");
        timeLedgerService.addBreak(manager, shift.getId(), BreakType.LUNCH, start.plusHours(4), start.plusHours(5), false, true);
        timeLedgerService.clockIn(manager, shift.getId(), start);
        timeLedgerService.clockOut(manager, shift.getId(), start.plusHours(10));
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);

        PayrollComputation amounts = payrollService.runPayroll(manager, period.getId()).entries().get(0).amounts();

        assertThat(amounts.regularHours()).isEqualByComparingTo("8.00");
        assertThat(amounts.overtimeHours()).isEqualByComparingTo("1.00");
        assertThat(amounts.overtimePay()).isEqualByComparingTo("125.00");
        assertThat(amounts.totalHours()).isEqualByComparingTo("9.00");
    }

    @Test
    void runPayroll_cancelledBeforeFirstEmployeeWritesNothing() {
        workWeekdays(employee("Hana", "125.00"), 2);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);

        PayrollRunResult result = payrollService.runPayroll(manager, period.getId(), () -> true);

        assertThat(result.cancelled()).isTrue();
        assertThat(result.entries()).isEmpty();
        assertThat(payrollService.listEntries(period.getId())).isEmpty();
    }

    @Test
    void approvedEntryIsNotRecomputed() {
        Employee hana = employee("Hana", "125.00");
        workWeekdays(hana, 2);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);
        PayrollEntryDto entry = payrollService.runPayroll(manager, period.getId()).entries().get(0);

        assertThat(payrollService.approveEntry(manager, entry.id()).status()).isEqualTo(EntryStatus.APPROVED);

        PayrollRunResult rerun = payrollService.runPayroll(manager, period.getId());
        assertThat(rerun.entries()).isEmpty();
        assertThat(rerun.errors()).singleElement()
                .extracting(PayrollRunResult.EmployeeError::errorCode)
                .isEqualTo("ENTRY_LOCKED");
    }

    @Test
    void periodLifecycle_closeThenPay() {
        Employee hana = employee("Hana", "125.00");
        workWeekdays(hana, 2);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);
        PayrollEntryDto entry = payrollService.runPayroll(manager, period.getId()).entries().get(0);

        payrollService.closePeriod(manager, period.getId());
        assertThatThrownBy(() -> payrollService.markPeriodPaid(manager, period.getId()))
                .hasFieldOrPropertyWithValue("errorCode", "DRAFT_ENTRIES");

        payrollService.approveEntry(manager, entry.id());
        assertThat(payrollService.markPeriodPaid(manager, period.getId()).getStatus()).isEqualTo(PeriodStatus.PAID);
        assertThat(payrollService.getPayrollEntry(hana.getId(), period.getId()))
                .hasValueSatisfying(paid -> assertThat(paid.status()).isEqualTo(EntryStatus.PAID));
    }

    @Test
    void entryLifecycle_payRequiresApproval() {
        Employee hana = employee("Hana", "125.00");
        workWeekdays(hana, 1);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);
        PayrollEntryDto entry = payrollService.runPayroll(manager, period.getId()).entries().get(0);

        assertThatThrownBy(() -> payrollService.markEntryPaid(manager, entry.id()))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> payrollService.approveEntry(RequestContext.employee(hana.getId()), entry.id()))
                .hasFieldOrPropertyWithValue("errorCode", "FORBIDDEN_ROLE");

        payrollService.approveEntry(manager, entry.id());
        assertThat(payrollService.markEntryPaid(manager, entry.id()).status()).isEqualTo(EntryStatus.PAID);
    }

    @Test
    void runPayroll_missingBracketTableIsRecordedWithContext() {
        errorLogBuffer.clear();
        Employee hana = employee("Hana", "125.00");
        completedShift(hana, LocalDateTime.of(2023, 6, 5, 9, 0), 8);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH,
                LocalDate.of(2023, 6, 1), LocalDate.of(2023, 6, 15));

        PayrollRunResult result = payrollService.runPayroll(manager, period.getId());

        assertThat(result.entries()).isEmpty();
        assertThat(result.errors()).singleElement()
                .extracting(PayrollRunResult.EmployeeError::errorCode)
                .isEqualTo("COMPUTATION_ERROR");
        assertThat(errorLogBuffer.recent()).singleElement().satisfies(logged -> {
            assertThat(logged.errorCode()).isEqualTo("COMPUTATION_ERROR");
            assertThat(logged.context())
                    .containsEntry("employeeId", hana.getId())
                    .containsEntry("periodId", period.getId());
        });
    }

    @Test
    void runPayroll_unexpectedFailureSkipsOnlyThatEmployee() {
        errorLogBuffer.clear();
        Employee ivan = employee("Ivan", "100.00");
        LocalDateTime start = PERIOD_START.atTime(9, 0);
        Shift corrupted = completedShift(ivan, start, 8);
        corrupted.setActualEnd(start.minusHours(1));
        shiftRepository.saveAndFlush(corrupted);
        Employee hana = employee("Hana", "125.00");
        workWeekdays(hana, 2);
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);

        PayrollRunResult result = payrollService.runPayroll(manager, period.getId());

        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.employeeId()).isEqualTo(ivan.getId());
            assertThat(error.errorCode()).isEqualTo("INTERNAL_ERROR");
        });
        assertThat(result.entries()).extracting(PayrollEntryDto::employeeId).containsExactly(hana.getId());
        assertThat(payrollService.getPeriod(period.getId()).totalPay()).isEqualByComparingTo("2000.00");
        assertThat(errorLogBuffer.recent()).singleElement()
                .satisfies(logged -> assertThat(logged.context()).containsEntry("employeeId", ivan.getId()));
    }

    @Test
    void cancelPayrollRun_onlyForRunningJobs() {
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);
        String jobId = jobStatusService.register(period.getId());
        jobStatusService.start(jobId);

        assertThatThrownBy(() -> payrollService.cancelPayrollRun(RequestContext.employee(99L), jobId))
                .hasFieldOrPropertyWithValue("errorCode", "FORBIDDEN_ROLE");
        assertThat(payrollService.cancelPayrollRun(manager, jobId)).isTrue();
        assertThat(jobStatusService.isCancelRequested(jobId)).isTrue();

        jobStatusService.finish(jobId, new PayrollRunResult(period.getId(), List.of(), List.of(), true));
        assertThat(payrollService.cancelPayrollRun(manager, jobId)).isFalse();
        assertThat(payrollService.cancelPayrollRun(manager, "unknown-job")).isFalse();
    }

    @Test
    void runPayroll_guardsRoleAndPeriodState() {
        PayrollPeriod period = payrollService.createPeriod(manager, BRANCH, PERIOD_START, PERIOD_END);
        Long staffId = employee("Staff", "90.00").getId();

        assertThatThrownBy(() -> payrollService.runPayroll(RequestContext.employee(staffId), period.getId()))
                .hasFieldOrPropertyWithValue("errorCode", "FORBIDDEN_ROLE");
        assertThatThrownBy(() -> payrollService.createPeriod(manager, BRANCH, PERIOD_END.plusDays(1), PERIOD_END.plusDays(14)))
                .hasFieldOrPropertyWithValue("errorCode", "OPEN_PERIOD_EXISTS");

        payrollService.closePeriod(manager, period.getId());
        assertThatThrownBy(() -> payrollService.runPayroll(manager, period.getId()))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "PERIOD_NOT_OPEN");
    }

    private Employee employee(String name, String rate) {
        return employeeRepository.save(new Employee(name, EmployeeRole.EMPLOYEE, new BigDecimal(rate), BRANCH));
    }

    /** Eight-hour day shifts on the first {@code days} weekdays of the period. */
    private void workWeekdays(Employee employee, int days) {
        LocalDate date = PERIOD_START;
        int worked = 0;
        while (worked < days) {
            if (date.getDayOfWeek().getValue() <= 5) {
                completedShift(employee, date.atTime(9, 0), 8);
                worked++;
            }
            date = date.plusDays(1);
        }
    }

    private Shift completedShift(Employee employee, LocalDateTime start, int hours) {
        LocalDateTime end = start.plusHours(hours);
        Shift shift = timeLedgerService.createShift(manager, employee.getId(), start, end, "Barista");
        timeLedgerService.clockIn(manager, shift.getId(), start);
        return timeLedgerService.clockOut(manager, shift.getId(), end);
    }
}
