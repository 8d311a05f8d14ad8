package com.example.cafeshift.shift;

import com.example.cafeshift.breaks.BreakPolicyResolver;
import com.example.cafeshift.breaks.BreakType;
import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.employee.EmployeeRepository;
import com.example.cafeshift.exception.NotFoundException;
import com.example.cafeshift.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Durable record of shifts, their breaks and the clock events against them.
 */
@Service
@Transactional
public class TimeLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(TimeLedgerService.class);

    static final Duration MAX_SHIFT_LENGTH = Duration.ofHours(24);

    private final ShiftRepository shiftRepository;
    private final TimeEntryRepository timeEntryRepository;
    private final EmployeeRepository employeeRepository;
    private final BreakPolicyResolver breakPolicyResolver;
    private final Clock clock;

    public TimeLedgerService(ShiftRepository shiftRepository,
                             TimeEntryRepository timeEntryRepository,
                             EmployeeRepository employeeRepository,
                             BreakPolicyResolver breakPolicyResolver,
                             Clock clock) {
        this.shiftRepository = shiftRepository;
        this.timeEntryRepository = timeEntryRepository;
        this.employeeRepository = employeeRepository;
        this.breakPolicyResolver = breakPolicyResolver;
        this.clock = clock;
    }

    public Shift createShift(RequestContext context, Long employeeId, LocalDateTime start, LocalDateTime end, String position) {
        context.requireManager("schedule shifts");
        validateInterval(start, end);
        if (position == null || position.isBlank()) {
            throw new ValidationException("position is required");
        }
        Employee employee = employeeRepository.getRequired(employeeId);
        Shift saved = shiftRepository.save(new Shift(employee, employee.getBranchId(), start, end, position.trim()));
        logger.info("Shift created: id={}, employee={}, {} - {}", saved.getId(), employeeId, start, end);
        return saved;
    }

    /**
     * Replaces the not yet started breaks of a scheduled shift with the ones the break policy
     * asks for.
     */
    public Shift planBreaks(RequestContext context, Long shiftId) {
        context.requireManager("plan breaks");
        Shift shift = shiftRepository.getRequired(shiftId);
        requireStatus(shift, ShiftStatus.SCHEDULED, "plan breaks");
        shift.getBreaks().removeIf(b -> b.getActualStart() == null);
        for (BreakPolicyResolver.PlannedBreak planned : breakPolicyResolver.plan(shift.getScheduledStart(), shift.getScheduledEnd())) {
            shift.addBreak(new ShiftBreak(planned.spec().type(), planned.start(), planned.end(),
                    planned.spec().paid(), planned.spec().required()));
        }
        shiftRepository.flush();
        logger.info("Planned {} breaks for shift {}", shift.getBreaks().size(), shiftId);
        return shift;
    }

    public Shift addBreak(RequestContext context, Long shiftId, BreakType type, LocalDateTime start, LocalDateTime end,
                          boolean paid, boolean required) {
        context.requireManager("add breaks");
        Shift shift = shiftRepository.getRequired(shiftId);
        if (shift.getStatus() == ShiftStatus.CANCELLED) {
            throw new ValidationException("INVALID_STATE", "Cannot add a break to a cancelled shift", shiftId);
        }
        if (type == null) {
            throw new ValidationException("break type is required");
        }
        validateInterval(start, end);
        shift.addBreak(new ShiftBreak(type, start, end, paid, required));
        shiftRepository.flush();
        return shift;
    }

    /**
     * @param at explicit clock time for manager corrections; {@code null} means now
     */
    public Shift clockIn(RequestContext context, Long shiftId, LocalDateTime at) {
        Shift shift = shiftRepository.getRequired(shiftId);
        requireOwnerOrManager(context, shift);
        requireStatus(shift, ShiftStatus.SCHEDULED, "clock in");
        if (shift.getActualStart() != null) {
            throw new ValidationException("INVALID_STATE", "Shift " + shiftId + " is already clocked in", shiftId);
        }
        LocalDateTime time = resolveTime(context, at);
        shift.setActualStart(time);
        append(shift, TimeEntryType.CLOCK_IN, time);
        logger.info("Clock in: shift={}, employee={}, at={}", shiftId, shift.getEmployee().getId(), time);
        return shift;
    }

    public Shift clockOut(RequestContext context, Long shiftId, LocalDateTime at) {
        Shift shift = shiftRepository.getRequired(shiftId);
        requireOwnerOrManager(context, shift);
        requireStatus(shift, ShiftStatus.SCHEDULED, "clock out");
        if (shift.getActualStart() == null) {
            throw new ValidationException("INVALID_STATE", "Shift " + shiftId + " was never clocked in", shiftId);
        }
        LocalDateTime time = resolveTime(context, at);
        validateInterval(shift.getActualStart(), time);
        shift.setActualEnd(time);
        shift.setStatus(ShiftStatus.COMPLETED);
        append(shift, TimeEntryType.CLOCK_OUT, time);
        logger.info("Clock out: shift={}, employee={}, at={}", shiftId, shift.getEmployee().getId(), time);
        return shift;
    }

    public Shift startBreak(RequestContext context, Long shiftId, Long breakId, LocalDateTime at) {
        Shift shift = shiftRepository.getRequired(shiftId);
        requireOwnerOrManager(context, shift);
        if (shift.getActualStart() == null || shift.getStatus() != ShiftStatus.SCHEDULED) {
            throw new ValidationException("INVALID_STATE", "Breaks can only start on a clocked-in shift", shiftId);
        }
        ShiftBreak shiftBreak = findBreak(shift, breakId);
        if (shiftBreak.getActualStart() != null) {
            throw new ValidationException("INVALID_STATE", "Break " + breakId + " already started", breakId);
        }
        LocalDateTime time = resolveTime(context, at);
        shiftBreak.setActualStart(time);
        append(shift, TimeEntryType.BREAK_START, time);
        return shift;
    }

    public Shift endBreak(RequestContext context, Long shiftId, Long breakId, LocalDateTime at) {
        Shift shift = shiftRepository.getRequired(shiftId);
        requireOwnerOrManager(context, shift);
        ShiftBreak shiftBreak = findBreak(shift, breakId);
        if (shiftBreak.getActualStart() == null || shiftBreak.getActualEnd() != null) {
            throw new ValidationException("INVALID_STATE", "Break " + breakId + " is not running", breakId);
        }
        LocalDateTime time = resolveTime(context, at);
        if (!time.isAfter(shiftBreak.getActualStart())) {
            throw new ValidationException("Break must end after it started");
        }
        shiftBreak.setActualEnd(time);
        append(shift, TimeEntryType.BREAK_END, time);
        return shift;
    }

    public Shift cancelShift(RequestContext context, Long shiftId) {
        context.requireManager("cancel shifts");
        Shift shift = shiftRepository.getRequired(shiftId);
        requireStatus(shift, ShiftStatus.SCHEDULED, "cancel");
        shift.setStatus(ShiftStatus.CANCELLED);
        logger.info("Shift cancelled: id={}", shiftId);
        return shift;
    }

    @Transactional(readOnly = true)
    public Shift getShift(Long shiftId) {
        Shift shift = shiftRepository.getRequired(shiftId);
        shift.getBreaks().size();
        return shift;
    }

    @Transactional(readOnly = true)
    public List<TimeEntry> getTimeEntries(Long shiftId) {
        if (!shiftRepository.existsById(shiftId)) {
            throw new NotFoundException("Shift", shiftId);
        }
        return timeEntryRepository.findByShiftIdOrderByOccurredAtAsc(shiftId);
    }

    static void validateInterval(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new ValidationException("start and end are required");
        }
        if (!end.isAfter(start)) {
            throw new ValidationException("INVALID_INTERVAL", "End time must be after start time", start, end);
        }
        if (Duration.between(start, end).compareTo(MAX_SHIFT_LENGTH) > 0) {
            throw new ValidationException("INVALID_INTERVAL", "Shift cannot exceed 24 hours", start, end);
        }
    }

    private LocalDateTime resolveTime(RequestContext context, LocalDateTime at) {
        if (at == null) {
            return LocalDateTime.now(clock);
        }
        context.requireManager("record clock corrections");
        return at;
    }

    private void append(Shift shift, TimeEntryType type, LocalDateTime time) {
        timeEntryRepository.save(new TimeEntry(shift.getEmployee().getId(), shift.getId(), type, time));
    }

    private ShiftBreak findBreak(Shift shift, Long breakId) {
        return shift.getBreaks().stream()
                .filter(b -> b.getId().equals(breakId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Break", breakId));
    }

    private static void requireOwnerOrManager(RequestContext context, Shift shift) {
        if (!context.isManager() && !shift.isOwnedBy(context.actorId())) {
            throw new ValidationException("NOT_OWNER", "Only the assigned employee or a manager may do this", shift.getId());
        }
    }

    private static void requireStatus(Shift shift, ShiftStatus expected, String action) {
        if (shift.getStatus() != expected) {
            throw new ValidationException("INVALID_STATE",
                    "Cannot " + action + " a shift in status " + shift.getStatus(), shift.getId());
        }
    }
}
