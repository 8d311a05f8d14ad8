package com.example.cafeshift.shift;

import com.example.cafeshift.breaks.BreakType;
import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.employee.EmployeeRepository;
import com.example.cafeshift.employee.EmployeeRole;
import com.example.cafeshift.exception.NotFoundException;
import com.example.cafeshift.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class TimeLedgerServiceTest {

    private static final long BRANCH = 101L;
    private static final LocalDateTime START = LocalDateTime.of(2025, 6, 2, 9, 0);

    @Autowired
    private TimeLedgerService timeLedgerService;

    @Autowired
    private EmployeeRepository employeeRepository;

    private Employee barista;
    private RequestContext manager;

    @BeforeEach
    void setUp() {
        barista = employeeRepository.save(new Employee("Barista", EmployeeRole.EMPLOYEE, new BigDecimal("100.00"), BRANCH));
        Employee lead = employeeRepository.save(new Employee("Lead", EmployeeRole.MANAGER, new BigDecimal("150.00"), BRANCH));
        manager = RequestContext.manager(lead.getId());
    }

    @Test
    void createShift_requiresManager() {
        assertThatThrownBy(() -> timeLedgerService.createShift(RequestContext.employee(barista.getId()),
                barista.getId(), START, START.plusHours(8), "Barista"))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "FORBIDDEN_ROLE");
    }

    @Test
    void createShift_rejectsInvertedAndOverlongIntervals() {
        assertThatThrownBy(() -> timeLedgerService.createShift(manager, barista.getId(), START, START, "Barista"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("after start");
        assertThatThrownBy(() -> timeLedgerService.createShift(manager, barista.getId(), START, START.plusHours(25), "Barista"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("24 hours");
    }

    @Test
    void createShift_unknownEmployeeIsNotFound() {
        assertThatThrownBy(() -> timeLedgerService.createShift(manager, -1L, START, START.plusHours(8), "Barista"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void planBreaks_appliesPolicyForShiftLength() {
        Shift shift = timeLedgerService.createShift(manager, barista.getId(), START, START.plusHours(8), "Barista");

        Shift planned = timeLedgerService.planBreaks(manager, shift.getId());

        assertThat(planned.getBreaks()).extracting(ShiftBreak::getType)
                .containsExactly(BreakType.LUNCH, BreakType.MEAL, BreakType.COFFEE);
        assertThat(planned.getBreaks()).filteredOn(ShiftBreak::isRequired).hasSize(2);

        // planning twice replaces rather than appends
        assertThat(timeLedgerService.planBreaks(manager, shift.getId()).getBreaks()).hasSize(3);
    }

    @Test
    void clockCycle_recordsEntriesAndCompletesShift() {
        Shift shift = timeLedgerService.createShift(manager, barista.getId(), START, START.plusHours(6), "Barista");
        Long breakId = timeLedgerService.addBreak(manager, shift.getId(), BreakType.LUNCH,
                START.plusHours(3), START.plusHours(3).plusMinutes(30), false, true).getBreaks().get(0).getId();

        timeLedgerService.clockIn(manager, shift.getId(), START.plusMinutes(5));
        timeLedgerService.startBreak(manager, shift.getId(), breakId, START.plusHours(3));
        timeLedgerService.endBreak(manager, shift.getId(), breakId, START.plusHours(3).plusMinutes(40));
        Shift done = timeLedgerService.clockOut(manager, shift.getId(), START.plusHours(6));

        assertThat(done.getStatus()).isEqualTo(ShiftStatus.COMPLETED);
        assertThat(done.getActualStart()).isEqualTo(START.plusMinutes(5));
        assertThat(done.getBreaks().get(0).effectiveEnd()).isEqualTo(START.plusHours(3).plusMinutes(40));

        List<TimeEntry> entries = timeLedgerService.getTimeEntries(shift.getId());
        assertThat(entries).extracting(TimeEntry::getType).containsExactly(
                TimeEntryType.CLOCK_IN, TimeEntryType.BREAK_START, TimeEntryType.BREAK_END, TimeEntryType.CLOCK_OUT);
    }

    @Test
    void clockIn_explicitTimeRequiresManager() {
        Shift shift = timeLedgerService.createShift(manager, barista.getId(), START, START.plusHours(6), "Barista");

        assertThatThrownBy(() -> timeLedgerService.clockIn(RequestContext.employee(barista.getId()), shift.getId(), START))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "FORBIDDEN_ROLE");
    }

    @Test
    void clockIn_otherEmployeeIsRejected() {
        Shift shift = timeLedgerService.createShift(manager, barista.getId(), START, START.plusHours(6), "Barista");
        Employee other = employeeRepository.save(new Employee("Other", EmployeeRole.EMPLOYEE, new BigDecimal("90.00"), BRANCH));

        assertThatThrownBy(() -> timeLedgerService.clockIn(RequestContext.employee(other.getId()), shift.getId(), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void clockOut_withoutClockInIsInvalidState() {
        Shift shift = timeLedgerService.createShift(manager, barista.getId(), START, START.plusHours(6), "Barista");

        assertThatThrownBy(() -> timeLedgerService.clockOut(manager, shift.getId(), START.plusHours(6)))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "INVALID_STATE");
    }

    @Test
    void cancelShift_blocksClockIn() {
        Shift shift = timeLedgerService.createShift(manager, barista.getId(), START, START.plusHours(6), "Barista");
        timeLedgerService.cancelShift(manager, shift.getId());

        assertThat(timeLedgerService.getShift(shift.getId()).getStatus()).isEqualTo(ShiftStatus.CANCELLED);
        assertThatThrownBy(() -> timeLedgerService.clockIn(manager, shift.getId(), START))
                .isInstanceOf(ValidationException.class);
    }
}
