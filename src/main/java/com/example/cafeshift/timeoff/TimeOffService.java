package com.example.cafeshift.timeoff;

import com.example.cafeshift.common.NoticePolicy;
import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.common.concurrent.ConditionalUpdates;
import com.example.cafeshift.common.concurrent.KeyedLockRegistry;
import com.example.cafeshift.config.CafeProperties;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.employee.EmployeeRepository;
import com.example.cafeshift.event.WorkflowEvent;
import com.example.cafeshift.exception.ValidationException;
import com.example.cafeshift.timeoff.TimeOffRequest.TimeOffStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Service
@Transactional
public class TimeOffService {

    private static final Logger logger = LoggerFactory.getLogger(TimeOffService.class);

    private final TimeOffRequestRepository repository;
    private final EmployeeRepository employeeRepository;
    private final NoticePolicy noticePolicy;
    private final KeyedLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;
    private final CafeProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public TimeOffService(TimeOffRequestRepository repository,
                          EmployeeRepository employeeRepository,
                          NoticePolicy noticePolicy,
                          KeyedLockRegistry lockRegistry,
                          PlatformTransactionManager transactionManager,
                          CafeProperties properties,
                          ApplicationEventPublisher eventPublisher,
                          Clock clock) {
        this.repository = repository;
        this.employeeRepository = employeeRepository;
        this.noticePolicy = noticePolicy;
        this.lockRegistry = lockRegistry;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public TimeOffRequest requestTimeOff(RequestContext context, Long employeeId, LocalDate startDate, LocalDate endDate,
                                         TimeOffType type, String reason) {
        if (!context.isManager() && !context.actorId().equals(employeeId)) {
            throw new ValidationException("NOT_OWNER", "Employees can only request time off for themselves", employeeId);
        }
        if (startDate == null || endDate == null || type == null) {
            throw new ValidationException("startDate, endDate and type are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new ValidationException("INVALID_RANGE", "End date must not be before start date", startDate, endDate);
        }
        noticePolicy.requireNotice(startDate, "Time off");
        Employee employee = employeeRepository.getRequired(employeeId);

        TimeOffRequest request = repository.save(new TimeOffRequest(employee, startDate, endDate, type, reason,
                LocalDateTime.now(clock)));
        logger.info("Time off requested: id={}, employee={}, {} - {}, type={}",
                request.getId(), employeeId, startDate, endDate, type);
        eventPublisher.publishEvent(new WorkflowEvent.TimeOffRequested(
                request.getId(), employeeId, startDate, endDate, type.name()));
        return request;
    }

    /**
     * Approves a pending request unless it overlaps one of the employee's approved requests.
     * Approvals for the same employee run one at a time, each in its own transaction.
     */
    @Transactional(propagation = Propagation.SUPPORTS)
    public TimeOffRequest approveTimeOff(RequestContext context, Long requestId) {
        context.requireManager("approve time off");
        Long employeeId = transactionTemplate.execute(status -> repository.getRequired(requestId).getEmployee().getId());
        return lockRegistry.withLock("time-off:" + employeeId, properties.getWorkflow().getApprovalLockTimeout(),
                () -> transactionTemplate.execute(status -> approveLocked(context, requestId)));
    }

    public TimeOffRequest rejectTimeOff(RequestContext context, Long requestId) {
        context.requireManager("reject time off");
        TimeOffRequest request = repository.getRequired(requestId);
        Long employeeId = request.getEmployee().getId();
        ConditionalUpdates.require(
                () -> repository.transition(requestId, TimeOffStatus.PENDING, TimeOffStatus.REJECTED,
                        context.actorId(), LocalDateTime.now(clock)),
                "Time-off request " + requestId + " is no longer pending");
        logger.info("Time off rejected: id={}, manager={}", requestId, context.actorId());
        eventPublisher.publishEvent(new WorkflowEvent.TimeOffResolved(requestId, employeeId, false, context.actorId()));
        return repository.getRequired(requestId);
    }

    @Transactional(readOnly = true)
    public List<TimeOffDto> listForEmployee(Long employeeId) {
        return repository.findByEmployee_IdOrderByStartDateAsc(employeeId).stream().map(TimeOffDto::from).toList();
    }

    @Transactional(readOnly = true)
    public List<TimeOffDto> listPending() {
        return repository.findByStatusOrderByRequestedAtAsc(TimeOffStatus.PENDING).stream().map(TimeOffDto::from).toList();
    }

    private TimeOffRequest approveLocked(RequestContext context, Long requestId) {
        TimeOffRequest request = repository.getRequired(requestId);
        if (request.getStatus() != TimeOffStatus.PENDING) {
            throw new ValidationException("INVALID_STATE", "Time-off request is no longer pending", requestId, request.getStatus());
        }
        Long employeeId = request.getEmployee().getId();
        List<TimeOffRequest> overlapping = repository.findOverlapping(employeeId, TimeOffStatus.APPROVED,
                request.getStartDate(), request.getEndDate(), requestId);
        if (!overlapping.isEmpty()) {
            TimeOffRequest first = overlapping.get(0);
            throw new ValidationException("OVERLAP",
                    "Overlaps approved time off " + first.getStartDate() + " - " + first.getEndDate(),
                    requestId, first.getId());
        }
        ConditionalUpdates.require(
                () -> repository.transition(requestId, TimeOffStatus.PENDING, TimeOffStatus.APPROVED,
                        context.actorId(), LocalDateTime.now(clock)),
                "Time-off request " + requestId + " is no longer pending");
        logger.info("Time off approved: id={}, employee={}, manager={}", requestId, employeeId, context.actorId());
        eventPublisher.publishEvent(new WorkflowEvent.TimeOffResolved(requestId, employeeId, true, context.actorId()));
        return repository.getRequired(requestId);
    }
}
