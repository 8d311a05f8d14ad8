package com.example.cafeshift.shiftdrop;

import com.example.cafeshift.common.NoticePolicy;
import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.common.Urgency;
import com.example.cafeshift.common.concurrent.ConditionalUpdates;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.employee.EmployeeRepository;
import com.example.cafeshift.event.WorkflowEvent;
import com.example.cafeshift.exception.ConflictException;
import com.example.cafeshift.exception.ValidationException;
import com.example.cafeshift.shift.Shift;
import com.example.cafeshift.shift.ShiftRepository;
import com.example.cafeshift.shift.ShiftStatus;
import com.example.cafeshift.shiftdrop.ShiftDropRequest.DropStatus;
import com.example.cafeshift.shifttrade.ShiftTradeRequest.TradeStatus;
import com.example.cafeshift.shifttrade.ShiftTradeRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Shift drops: an employee gives up a shift, a manager approves or rejects, and once approved any
 * other employee (or a manager on their behalf) picks it up.
 */
@Service
@Transactional
public class ShiftDropService {

    private static final Logger logger = LoggerFactory.getLogger(ShiftDropService.class);

    private static final Set<DropStatus> ACTIVE = EnumSet.of(DropStatus.PENDING, DropStatus.APPROVED);

    private final ShiftDropRequestRepository dropRepository;
    private final ShiftRepository shiftRepository;
    private final EmployeeRepository employeeRepository;
    private final ShiftTradeRequestRepository tradeRepository;
    private final NoticePolicy noticePolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ShiftDropService(ShiftDropRequestRepository dropRepository,
                            ShiftRepository shiftRepository,
                            EmployeeRepository employeeRepository,
                            ShiftTradeRequestRepository tradeRepository,
                            NoticePolicy noticePolicy,
                            ApplicationEventPublisher eventPublisher,
                            Clock clock) {
        this.dropRepository = dropRepository;
        this.shiftRepository = shiftRepository;
        this.employeeRepository = employeeRepository;
        this.tradeRepository = tradeRepository;
        this.noticePolicy = noticePolicy;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public ShiftDropRequest createDrop(RequestContext context, Long shiftId, String reason, Urgency urgency) {
        Shift shift = shiftRepository.getRequiredForUpdate(shiftId);
        if (!shift.isOwnedBy(context.actorId())) {
            throw new ValidationException("NOT_OWNER", "You can only drop your own shifts", shiftId);
        }
        if (shift.getStatus() != ShiftStatus.SCHEDULED) {
            throw new ValidationException("INVALID_STATE", "Only scheduled shifts can be dropped", shiftId);
        }
        noticePolicy.requireNotice(shift.getScheduledStart().toLocalDate(), "Shift drops");
        if (dropRepository.existsByShift_IdAndStatusIn(shiftId, ACTIVE)) {
            throw new ValidationException("DUPLICATE_REQUEST", "A drop request already exists for this shift", shiftId);
        }
        if (tradeRepository.existsByShift_IdAndStatus(shiftId, TradeStatus.PENDING)) {
            throw new ValidationException("DUPLICATE_REQUEST", "This shift is already offered as a trade", shiftId);
        }

        ShiftDropRequest drop = dropRepository.save(new ShiftDropRequest(
                shift, shift.getEmployee(), reason, urgency, LocalDateTime.now(clock)));
        logger.info("Drop requested: id={}, shift={}, employee={}", drop.getId(), shiftId, context.actorId());
        eventPublisher.publishEvent(new WorkflowEvent.DropRequested(
                drop.getId(), shiftId, context.actorId(), shift.getScheduledStart()));
        return drop;
    }

    /**
     * Manager decision on a pending drop. Rejection leaves the shift with its owner.
     */
    public ShiftDropRequest resolveDrop(RequestContext context, Long dropId, DropDecision decision, String managerNotes) {
        context.requireManager("resolve drop requests");
        if (decision == null) {
            throw new ValidationException("decision is required");
        }
        ShiftDropRequest drop = dropRepository.getRequired(dropId);
        Long shiftId = drop.getShift().getId();
        Long employeeId = drop.getEmployee().getId();
        DropStatus target = decision == DropDecision.APPROVE ? DropStatus.APPROVED : DropStatus.REJECTED;

        ConditionalUpdates.require(
                () -> dropRepository.resolve(dropId, DropStatus.PENDING, target, context.actorId(),
                        managerNotes, LocalDateTime.now(clock)),
                "Drop " + dropId + " is no longer pending");

        logger.info("Drop {}: id={}, manager={}", target.getDisplayName().toLowerCase(), dropId, context.actorId());
        eventPublisher.publishEvent(new WorkflowEvent.DropResolved(dropId, shiftId, employeeId,
                target == DropStatus.APPROVED, context.actorId(), managerNotes));
        return dropRepository.getRequired(dropId);
    }

    /**
     * Picks up an approved drop for the caller.
     */
    public Shift pickupDrop(RequestContext context, Long dropId) {
        return transferDrop(dropId, context.actorId(), false);
    }

    /**
     * Manager override: picks up an approved drop on behalf of {@code employeeId}.
     */
    public Shift assignDrop(RequestContext context, Long dropId, Long employeeId) {
        context.requireManager("assign dropped shifts");
        return transferDrop(dropId, employeeId, true);
    }

    public ShiftDropRequest cancelDrop(RequestContext context, Long dropId) {
        ShiftDropRequest drop = dropRepository.getRequired(dropId);
        if (!context.isManager() && !drop.getEmployee().getId().equals(context.actorId())) {
            throw new ValidationException("NOT_OWNER", "Only the requester or a manager can cancel a drop", dropId);
        }
        ConditionalUpdates.require(
                () -> dropRepository.cancel(dropId, ACTIVE, DropStatus.CANCELLED, context.actorId(), LocalDateTime.now(clock)),
                "Drop " + dropId + " can no longer be cancelled");
        logger.info("Drop cancelled: id={}, by={}", dropId, context.actorId());
        return dropRepository.getRequired(dropId);
    }

    @Transactional(readOnly = true)
    public List<ShiftDropDto> listByStatus(DropStatus status) {
        return dropRepository.findByStatusOrderByRequestedAtAsc(status).stream()
                .map(ShiftDropDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ShiftDropDto> listOwn(RequestContext context) {
        return dropRepository.findByEmployee_IdOrderByRequestedAtDesc(context.actorId()).stream()
                .map(ShiftDropDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public ShiftDropDto getDrop(Long dropId) {
        return ShiftDropDto.from(dropRepository.getRequired(dropId));
    }

    private Shift transferDrop(Long dropId, Long newEmployeeId, boolean assignedByManager) {
        ShiftDropRequest drop = dropRepository.getRequired(dropId);
        if (drop.getStatus() == DropStatus.PICKED_UP) {
            throw new ConflictException("Drop " + dropId + " was already picked up");
        }
        if (drop.getStatus() != DropStatus.APPROVED) {
            throw new ValidationException("INVALID_STATE", "Drop is not available for pickup", dropId, drop.getStatus());
        }
        Long shiftId = drop.getShift().getId();
        Long originalEmployeeId = drop.getEmployee().getId();
        if (originalEmployeeId.equals(newEmployeeId)) {
            throw new ValidationException("SELF_PICKUP", "Cannot pick up your own dropped shift", dropId);
        }
        Employee newOwner = employeeRepository.getRequired(newEmployeeId);
        if (!Boolean.TRUE.equals(newOwner.getActive())) {
            throw new ValidationException("INACTIVE_EMPLOYEE", "Employee " + newEmployeeId + " is not active", newEmployeeId);
        }
        LocalDateTime now = LocalDateTime.now(clock);

        ConditionalUpdates.require(
                () -> dropRepository.pickUp(dropId, DropStatus.APPROVED, DropStatus.PICKED_UP, newEmployeeId, now),
                "Drop " + dropId + " was already picked up");
        ConditionalUpdates.require(
                () -> shiftRepository.reassign(shiftId, originalEmployeeId, newOwner, now),
                "Shift " + shiftId + " changed while the drop was being picked up");

        logger.info("Drop picked up: id={}, shift={}, from={}, to={}, assigned={}",
                dropId, shiftId, originalEmployeeId, newEmployeeId, assignedByManager);
        eventPublisher.publishEvent(new WorkflowEvent.ShiftPickedUp(
                dropId, shiftId, originalEmployeeId, newEmployeeId, assignedByManager));
        return shiftRepository.getRequired(shiftId);
    }
}
