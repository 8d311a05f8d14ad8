package com.example.cafeshift.payroll;

import com.example.cafeshift.branch.BranchPayrollSettings;
import com.example.cafeshift.branch.BranchPayrollSettingsRepository;
import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.common.concurrent.ConditionalUpdates;
import com.example.cafeshift.common.concurrent.KeyedLockRegistry;
import com.example.cafeshift.common.error.ErrorLogBuffer;
import com.example.cafeshift.config.CafeProperties;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.employee.EmployeeRepository;
import com.example.cafeshift.event.WorkflowEvent;
import com.example.cafeshift.exception.BusinessException;
import com.example.cafeshift.exception.ComputationException;
import com.example.cafeshift.exception.ValidationException;
import com.example.cafeshift.holiday.HolidayCalendar;
import com.example.cafeshift.holiday.HolidayService;
import com.example.cafeshift.hours.HourBuckets;
import com.example.cafeshift.hours.HoursAggregator;
import com.example.cafeshift.hours.WorkedShift;
import com.example.cafeshift.payroll.PayrollEntry.EntryStatus;
import com.example.cafeshift.payroll.PayrollPeriod.PeriodStatus;
import com.example.cafeshift.shift.ShiftRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Pay periods and the payroll run that fills them with one entry per employee.
 *
 * <p>A run computes every employee in a separate transaction, so one employee's failure is
 * reported in the result without undoing the others. Runs for the same branch and period are
 * serialised on a logical lock.
 */
@Service
public class PayrollService {

    private static final Logger logger = LoggerFactory.getLogger(PayrollService.class);

    private final PayrollPeriodRepository periodRepository;
    private final PayrollEntryRepository entryRepository;
    private final EmployeeRepository employeeRepository;
    private final ShiftRepository shiftRepository;
    private final HolidayService holidayService;
    private final BranchPayrollSettingsRepository settingsRepository;
    private final HoursAggregator hoursAggregator;
    private final PayrollCalculator calculator;
    private final KeyedLockRegistry lockRegistry;
    private final PayrollJobStatusService jobStatusService;
    private final CafeProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final ErrorLogBuffer errorLogBuffer;

    public PayrollService(PayrollPeriodRepository periodRepository,
                          PayrollEntryRepository entryRepository,
                          EmployeeRepository employeeRepository,
                          ShiftRepository shiftRepository,
                          HolidayService holidayService,
                          BranchPayrollSettingsRepository settingsRepository,
                          HoursAggregator hoursAggregator,
                          PayrollCalculator calculator,
                          KeyedLockRegistry lockRegistry,
                          PayrollJobStatusService jobStatusService,
                          CafeProperties properties,
                          ApplicationEventPublisher eventPublisher,
                          PlatformTransactionManager transactionManager,
                          ErrorLogBuffer errorLogBuffer) {
        this.periodRepository = periodRepository;
        this.entryRepository = entryRepository;
        this.employeeRepository = employeeRepository;
        this.shiftRepository = shiftRepository;
        this.holidayService = holidayService;
        this.settingsRepository = settingsRepository;
        this.hoursAggregator = hoursAggregator;
        this.calculator = calculator;
        this.lockRegistry = lockRegistry;
        this.jobStatusService = jobStatusService;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.errorLogBuffer = errorLogBuffer;
    }

    // ---- periods ----

    /**
     * Opens a period for the branch. The open-period check and the insert run in one transaction
     * under the branch's period lock, so concurrent creates cannot both succeed.
     */
    @Transactional(propagation = Propagation.SUPPORTS)
    public PayrollPeriod createPeriod(RequestContext context, Long branchId, LocalDate startDate, LocalDate endDate) {
        context.requireManager("create payroll periods");
        if (branchId == null || startDate == null || endDate == null) {
            throw new ValidationException("branchId, startDate and endDate are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new ValidationException("INVALID_RANGE", "Period end must not be before its start", startDate, endDate);
        }
        return lockRegistry.withLock("payroll-period:" + branchId, properties.getPayroll().getLockTimeout(),
                () -> transactionTemplate.execute(status -> openPeriod(branchId, startDate, endDate)));
    }

    private PayrollPeriod openPeriod(Long branchId, LocalDate startDate, LocalDate endDate) {
        if (periodRepository.existsByBranchIdAndStatus(branchId, PeriodStatus.OPEN)) {
            throw new ValidationException("OPEN_PERIOD_EXISTS", "Branch " + branchId + " already has an open payroll period", branchId);
        }
        PayrollPeriod period = periodRepository.save(new PayrollPeriod(branchId, startDate, endDate));
        logger.info("Payroll period created: id={}, branch={}, {} - {}", period.getId(), branchId, startDate, endDate);
        return period;
    }

    @Transactional
    public PayrollPeriod closePeriod(RequestContext context, Long periodId) {
        context.requireManager("close payroll periods");
        PayrollPeriod period = periodRepository.getRequired(periodId);
        requirePeriodStatus(period, PeriodStatus.OPEN, "close");
        period.setStatus(PeriodStatus.CLOSED);
        logger.info("Payroll period closed: id={}", periodId);
        return period;
    }

    /**
     * Marks a closed period and all of its approved entries paid. Draft entries must be approved
     * first.
     */
    @Transactional
    public PayrollPeriod markPeriodPaid(RequestContext context, Long periodId) {
        context.requireManager("mark payroll periods paid");
        PayrollPeriod period = periodRepository.getRequired(periodId);
        requirePeriodStatus(period, PeriodStatus.CLOSED, "mark paid");
        long drafts = entryRepository.countByPeriod_IdAndStatus(periodId, EntryStatus.DRAFT);
        if (drafts > 0) {
            throw new ValidationException("DRAFT_ENTRIES", drafts + " payroll entries are still drafts", periodId);
        }
        int paid = entryRepository.transitionAll(periodId, EntryStatus.APPROVED, EntryStatus.PAID);
        PayrollPeriod reloaded = periodRepository.getRequired(periodId);
        reloaded.setStatus(PeriodStatus.PAID);
        logger.info("Payroll period paid: id={}, entries={}", periodId, paid);
        return reloaded;
    }

    @Transactional(readOnly = true)
    public List<PayrollPeriodDto> listPeriods(Long branchId) {
        return periodRepository.findByBranchIdOrderByStartDateDesc(branchId).stream().map(PayrollPeriodDto::from).toList();
    }

    @Transactional(readOnly = true)
    public PayrollPeriodDto getPeriod(Long periodId) {
        return PayrollPeriodDto.from(periodRepository.getRequired(periodId));
    }

    // ---- entries ----

    @Transactional(readOnly = true)
    public Optional<PayrollEntryDto> getPayrollEntry(Long employeeId, Long periodId) {
        return entryRepository.findByEmployee_IdAndPeriod_Id(employeeId, periodId).map(PayrollEntryDto::from);
    }

    @Transactional(readOnly = true)
    public List<PayrollEntryDto> listEntries(Long periodId) {
        return entryRepository.findByPeriod_IdOrderByEmployee_IdAsc(periodId).stream().map(PayrollEntryDto::from).toList();
    }

    @Transactional
    public PayrollEntryDto approveEntry(RequestContext context, Long entryId) {
        context.requireManager("approve payroll entries");
        entryRepository.getRequired(entryId);
        ConditionalUpdates.require(() -> entryRepository.transition(entryId, EntryStatus.DRAFT, EntryStatus.APPROVED),
                "Payroll entry " + entryId + " is not a draft");
        logger.info("Payroll entry approved: id={}, manager={}", entryId, context.actorId());
        return PayrollEntryDto.from(entryRepository.getRequired(entryId));
    }

    @Transactional
    public PayrollEntryDto markEntryPaid(RequestContext context, Long entryId) {
        context.requireManager("mark payroll entries paid");
        entryRepository.getRequired(entryId);
        ConditionalUpdates.require(() -> entryRepository.transition(entryId, EntryStatus.APPROVED, EntryStatus.PAID),
                "Payroll entry " + entryId + " is not approved");
        logger.info("Payroll entry paid: id={}", entryId);
        return PayrollEntryDto.from(entryRepository.getRequired(entryId));
    }

    // ---- runs ----

    public PayrollRunResult runPayroll(RequestContext context, Long periodId) {
        return runPayroll(context, periodId, () -> false);
    }

    /**
     * Computes or recomputes the draft entry of every active employee of the period's branch who
     * worked in the period. {@code cancelled} is polled between employees; entries already written
     * stay.
     */
    public PayrollRunResult runPayroll(RequestContext context, Long periodId, BooleanSupplier cancelled) {
        context.requireManager("run payroll");
        PayrollPeriodDto period = transactionTemplate.execute(status -> PayrollPeriodDto.from(periodRepository.getRequired(periodId)));
        if (period.status() != PeriodStatus.OPEN) {
            throw new ValidationException("PERIOD_NOT_OPEN", "Payroll can only run on an open period", periodId, period.status());
        }
        String lockKey = "payroll:" + period.branchId() + ":" + periodId;
        return lockRegistry.withLock(lockKey, properties.getPayroll().getLockTimeout(), () -> runLocked(period, cancelled));
    }

    @Async("payrollExecutor")
    public void runPayrollAsync(RequestContext context, Long periodId, String jobId) {
        jobStatusService.start(jobId);
        try {
            PayrollRunResult result = runPayroll(context, periodId, () -> jobStatusService.isCancelRequested(jobId));
            jobStatusService.finish(jobId, result);
        } catch (BusinessException ex) {
            logger.warn("Payroll job {} for period {} failed: {}", jobId, periodId, ex.getMessage());
            jobStatusService.fail(jobId, ex.getMessage());
        } catch (RuntimeException ex) {
            logger.error("Payroll job {} for period {} failed", jobId, periodId, ex);
            jobStatusService.fail(jobId, ex.getMessage());
        }
    }

    /**
     * @return false when the job is unknown or already finished
     */
    public boolean cancelPayrollRun(RequestContext context, String jobId) {
        context.requireManager("cancel payroll runs");
        boolean requested = jobStatusService.requestCancel(jobId);
        if (requested) {
            logger.info("Cancellation requested for payroll job {}", jobId);
        }
        return requested;
    }

    private PayrollRunResult runLocked(PayrollPeriodDto period, BooleanSupplier cancelled) {
        long started = System.currentTimeMillis();
        RunInputs inputs = transactionTemplate.execute(status -> loadInputs(period));
        List<PayrollEntryDto> entries = new ArrayList<>();
        List<PayrollRunResult.EmployeeError> errors = new ArrayList<>();
        boolean wasCancelled = false;

        for (Long employeeId : inputs.employeeIds()) {
            if (cancelled.getAsBoolean()) {
                wasCancelled = true;
                logger.info("Payroll run for period {} cancelled after {} employee(s)", period.id(), entries.size() + errors.size());
                break;
            }
            try {
                PayrollEntryDto entry = transactionTemplate.execute(status -> computeEmployee(employeeId, period, inputs));
                if (entry != null) {
                    entries.add(entry);
                }
            } catch (ComputationException ex) {
                logger.error("Payroll computation failed: employee={}, period={}, reason={}", employeeId, period.id(), ex.getMessage());
                errors.add(new PayrollRunResult.EmployeeError(employeeId, ex.getErrorCode(), ex.getMessage()));
                errorLogBuffer.record(ex.getErrorCode(), ex.getMessage(),
                        Map.of("employeeId", employeeId, "periodId", period.id()));
            } catch (BusinessException ex) {
                logger.warn("Payroll skipped employee {} in period {}: {}", employeeId, period.id(), ex.getMessage());
                errors.add(new PayrollRunResult.EmployeeError(employeeId, ex.getErrorCode(), ex.getMessage()));
            } catch (DataAccessException ex) {
                logger.error("Payroll could not store employee {} in period {}", employeeId, period.id(), ex);
                errors.add(new PayrollRunResult.EmployeeError(employeeId, "PERSISTENCE_ERROR", ex.getMostSpecificCause().getMessage()));
                errorLogBuffer.record("PERSISTENCE_ERROR", ex.getMostSpecificCause().getMessage(),
                        Map.of("employeeId", employeeId, "periodId", period.id()));
            } catch (RuntimeException ex) {
                logger.error("Unexpected payroll failure: employee={}, period={}", employeeId, period.id(), ex);
                errors.add(new PayrollRunResult.EmployeeError(employeeId, "INTERNAL_ERROR", String.valueOf(ex.getMessage())));
                errorLogBuffer.record("INTERNAL_ERROR", ex.getClass().getSimpleName() + ": " + ex.getMessage(),
                        Map.of("employeeId", employeeId, "periodId", period.id()));
            }
        }

        transactionTemplate.executeWithoutResult(status -> refreshTotals(period.id()));
        logger.info("Payroll run for period {} finished in {} ms: {} entries, {} errors",
                period.id(), System.currentTimeMillis() - started, entries.size(), errors.size());
        return new PayrollRunResult(period.id(), entries, errors, wasCancelled);
    }

    private RunInputs loadInputs(PayrollPeriodDto period) {
        List<Long> employeeIds = employeeRepository.findByBranchIdAndActiveTrueOrderByIdAsc(period.branchId()).stream()
                .map(Employee::getId)
                .toList();
        HolidayCalendar holidays = holidayService.calendarFor(period.startDate(), period.endDate());
        BranchPayrollSettings settings = settingsRepository.findOrDefault(period.branchId());
        return new RunInputs(employeeIds, holidays, settings);
    }

    private PayrollEntryDto computeEmployee(Long employeeId, PayrollPeriodDto period, RunInputs inputs) {
        Employee employee = employeeRepository.getRequired(employeeId);
        List<WorkedShift> shifts = shiftRepository.findCompletedForEmployee(employeeId,
                        period.startDate().atStartOfDay(), period.endDate().plusDays(1).atStartOfDay())
                .stream()
                .map(WorkedShift::from)
                .toList();
        DayOfWeek restDay = employee.getRestDay() != null ? employee.getRestDay() : inputs.settings().getRestDay();
        HourBuckets buckets = hoursAggregator.aggregate(shifts, inputs.holidays(), restDay);
        if (buckets.payableMinutes() <= 0) {
            return null;
        }

        Optional<PayrollEntry> existing = entryRepository.findByEmployee_IdAndPeriod_Id(employeeId, period.id());
        if (existing.isPresent() && existing.get().getStatus() != EntryStatus.DRAFT) {
            throw new ValidationException("ENTRY_LOCKED",
                    "Payroll entry for employee " + employeeId + " is already " + existing.get().getStatus(),
                    employeeId, period.id());
        }
        BigDecimal hourlyRate = existing.map(PayrollEntry::getHourlyRate).orElse(employee.getHourlyRate());
        if (hourlyRate == null || hourlyRate.signum() <= 0) {
            throw new ValidationException("MISSING_RATE", "Employee " + employeeId + " has no hourly rate", employeeId);
        }

        PayrollComputation computation = calculator.compute(buckets, hourlyRate, employee, inputs.settings(),
                period.startDate(), period.endDate());
        PayrollEntry entry = existing.orElseGet(() ->
                new PayrollEntry(employee, periodRepository.getReferenceById(period.id()), hourlyRate));
        entry.apply(computation);
        PayrollEntry saved = entryRepository.save(entry);

        logger.debug("Payroll entry for employee {} in period {}: gross={}, net={}",
                employeeId, period.id(), computation.grossPay(), computation.netPay());
        eventPublisher.publishEvent(new WorkflowEvent.PayslipAvailable(saved.getId(), period.id(), employeeId,
                period.startDate(), period.endDate(), computation.netPay()));
        return new PayrollEntryDto(saved.getId(), employeeId, period.id(), saved.getStatus(), saved.toComputation());
    }

    private void refreshTotals(Long periodId) {
        BigDecimal hours = BigDecimal.ZERO.setScale(2);
        BigDecimal pay = BigDecimal.ZERO.setScale(2);
        for (PayrollEntry entry : entryRepository.findByPeriod_IdOrderByEmployee_IdAsc(periodId)) {
            hours = hours.add(entry.getTotalHours());
            pay = pay.add(entry.getGrossPay());
        }
        PayrollPeriod period = periodRepository.getRequired(periodId);
        period.setTotalHours(hours);
        period.setTotalPay(pay);
    }

    private static void requirePeriodStatus(PayrollPeriod period, PeriodStatus expected, String action) {
        if (period.getStatus() != expected) {
            throw new ValidationException("INVALID_STATE",
                    "Cannot " + action + " a period in status " + period.getStatus(), period.getId());
        }
    }

    private record RunInputs(List<Long> employeeIds, HolidayCalendar holidays, BranchPayrollSettings settings) {}
}
