package com.example.cafeshift.shifttrade;

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
import com.example.cafeshift.shiftdrop.ShiftDropRequestRepository;
import com.example.cafeshift.shifttrade.ShiftTradeRequest.TradeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Shift trades: an employee offers a scheduled shift, either to one colleague or to anyone, and the
 * first eligible claimant takes it over.
 */
@Service
@Transactional
public class ShiftTradeService {

    private static final Logger logger = LoggerFactory.getLogger(ShiftTradeService.class);

    private final ShiftTradeRequestRepository tradeRepository;
    private final ShiftRepository shiftRepository;
    private final EmployeeRepository employeeRepository;
    private final ShiftDropRequestRepository dropRepository;
    private final NoticePolicy noticePolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ShiftTradeService(ShiftTradeRequestRepository tradeRepository,
                             ShiftRepository shiftRepository,
                             EmployeeRepository employeeRepository,
                             ShiftDropRequestRepository dropRepository,
                             NoticePolicy noticePolicy,
                             ApplicationEventPublisher eventPublisher,
                             Clock clock) {
        this.tradeRepository = tradeRepository;
        this.shiftRepository = shiftRepository;
        this.employeeRepository = employeeRepository;
        this.dropRepository = dropRepository;
        this.noticePolicy = noticePolicy;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * @param toEmployeeId target colleague, or {@code null} for an open trade
     */
    public ShiftTradeRequest createTrade(RequestContext context, Long shiftId, Long toEmployeeId,
                                         String reason, Urgency urgency) {
        Shift shift = shiftRepository.getRequiredForUpdate(shiftId);
        if (!shift.isOwnedBy(context.actorId())) {
            throw new ValidationException("NOT_OWNER", "You can only trade your own shifts", shiftId);
        }
        if (shift.getStatus() != ShiftStatus.SCHEDULED) {
            throw new ValidationException("INVALID_STATE", "Only scheduled shifts can be traded", shiftId);
        }
        noticePolicy.requireNotice(shift.getScheduledStart().toLocalDate(), "Shift trades");
        if (toEmployeeId != null && toEmployeeId.equals(context.actorId())) {
            throw new ValidationException("SELF_TRADE", "Cannot trade a shift with yourself", shiftId);
        }
        if (tradeRepository.existsByShift_IdAndStatus(shiftId, TradeStatus.PENDING)) {
            throw new ValidationException("DUPLICATE_REQUEST", "A trade request already exists for this shift", shiftId);
        }
        if (dropRepository.existsByShift_IdAndStatusIn(shiftId, EnumSet.of(DropStatus.PENDING, DropStatus.APPROVED))) {
            throw new ValidationException("DUPLICATE_REQUEST", "This shift is already offered as a drop", shiftId);
        }
        Employee target = toEmployeeId == null ? null : employeeRepository.getRequired(toEmployeeId);

        ShiftTradeRequest trade = tradeRepository.save(new ShiftTradeRequest(
                shift, shift.getEmployee(), target, reason, urgency, LocalDateTime.now(clock)));
        logger.info("Trade requested: id={}, shift={}, from={}, to={}",
                trade.getId(), shiftId, context.actorId(), toEmployeeId == null ? "anyone" : toEmployeeId);
        eventPublisher.publishEvent(new WorkflowEvent.TradeAvailable(
                trade.getId(), shiftId, context.actorId(), toEmployeeId, shift.getScheduledStart()));
        return trade;
    }

    /**
     * Takes over the shift offered by a pending trade. The trade moves to approved and the shift
     * changes hands in the same transaction; a caller who loses the race gets a conflict.
     */
    public Shift claimTrade(RequestContext context, Long tradeId) {
        Long claimantId = context.actorId();
        ShiftTradeRequest trade = tradeRepository.getRequired(tradeId);
        if (trade.getStatus() != TradeStatus.PENDING) {
            throw new ConflictException("Trade " + tradeId + " is no longer available (" + trade.getStatus() + ")");
        }
        Long shiftId = trade.getShift().getId();
        Long ownerId = trade.getFromEmployee().getId();
        if (ownerId.equals(claimantId)) {
            throw new ValidationException("SELF_TRADE", "Cannot claim your own trade", tradeId);
        }
        if (!trade.isOpen() && !trade.getToEmployee().getId().equals(claimantId)) {
            throw new ValidationException("NOT_TARGET", "This trade was offered to someone else", tradeId);
        }
        Employee claimant = employeeRepository.getRequired(claimantId);
        LocalDateTime now = LocalDateTime.now(clock);

        ConditionalUpdates.require(
                () -> tradeRepository.transition(tradeId, TradeStatus.PENDING, TradeStatus.APPROVED, claimantId, now),
                "Trade " + tradeId + " was already claimed");
        ConditionalUpdates.require(
                () -> shiftRepository.reassign(shiftId, ownerId, claimant, now),
                "Shift " + shiftId + " changed while the trade was being claimed");

        logger.info("Trade claimed: id={}, shift={}, from={}, to={}", tradeId, shiftId, ownerId, claimantId);
        eventPublisher.publishEvent(new WorkflowEvent.TradeClaimed(tradeId, shiftId, ownerId, claimantId));
        return shiftRepository.getRequired(shiftId);
    }

    public ShiftTradeRequest rejectTrade(RequestContext context, Long tradeId) {
        context.requireManager("reject trades");
        tradeRepository.getRequired(tradeId);
        ConditionalUpdates.require(
                () -> tradeRepository.transition(tradeId, TradeStatus.PENDING, TradeStatus.REJECTED,
                        context.actorId(), LocalDateTime.now(clock)),
                "Trade " + tradeId + " is no longer pending");
        logger.info("Trade rejected: id={}, manager={}", tradeId, context.actorId());
        return tradeRepository.getRequired(tradeId);
    }

    public ShiftTradeRequest withdrawTrade(RequestContext context, Long tradeId) {
        ShiftTradeRequest trade = tradeRepository.getRequired(tradeId);
        if (!trade.getFromEmployee().getId().equals(context.actorId())) {
            throw new ValidationException("NOT_OWNER", "Only the requester can withdraw a trade", tradeId);
        }
        ConditionalUpdates.require(
                () -> tradeRepository.transition(tradeId, TradeStatus.PENDING, TradeStatus.WITHDRAWN,
                        context.actorId(), LocalDateTime.now(clock)),
                "Trade " + tradeId + " is no longer pending");
        logger.info("Trade withdrawn: id={}", tradeId);
        return tradeRepository.getRequired(tradeId);
    }

    @Transactional(readOnly = true)
    public List<ShiftTradeDto> listClaimable(RequestContext context) {
        return tradeRepository.findClaimableBy(context.actorId(), TradeStatus.PENDING).stream()
                .map(ShiftTradeDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ShiftTradeDto> listOwn(RequestContext context) {
        return tradeRepository.findByFromEmployee_IdOrderByRequestedAtDesc(context.actorId()).stream()
                .map(ShiftTradeDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public ShiftTradeDto getTrade(Long tradeId) {
        return ShiftTradeDto.from(tradeRepository.getRequired(tradeId));
    }
}
