package com.example.cafeshift.event;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Events raised by the shift workflows and payroll. Each kind carries its own fixed payload;
 * delivery to people (push, e-mail) happens outside this service.
 */
public interface WorkflowEvent {

    Kind kind();

    /** Employees who should hear about the event. */
    List<Long> recipients();

    enum Kind {
        TRADE_AVAILABLE,
        TRADE_CLAIMED,
        DROP_REQUESTED,
        DROP_RESOLVED,
        SHIFT_PICKED_UP,
        TIME_OFF_REQUESTED,
        TIME_OFF_RESOLVED,
        PAYSLIP_AVAILABLE
    }

    record TradeAvailable(Long tradeId, Long shiftId, Long fromEmployeeId, Long toEmployeeId,
                          LocalDateTime shiftStart) implements WorkflowEvent {
        public Kind kind() { return Kind.TRADE_AVAILABLE; }
        public List<Long> recipients() {
            return toEmployeeId == null ? List.of() : List.of(toEmployeeId);
        }
    }

    record TradeClaimed(Long tradeId, Long shiftId, Long fromEmployeeId, Long claimantId) implements WorkflowEvent {
        public Kind kind() { return Kind.TRADE_CLAIMED; }
        public List<Long> recipients() { return List.of(fromEmployeeId, claimantId); }
    }

    record DropRequested(Long dropId, Long shiftId, Long employeeId, LocalDateTime shiftStart) implements WorkflowEvent {
        public Kind kind() { return Kind.DROP_REQUESTED; }
        public List<Long> recipients() { return List.of(); }
    }

    record DropResolved(Long dropId, Long shiftId, Long employeeId, boolean approved, Long managerId,
                        String managerNotes) implements WorkflowEvent {
        public Kind kind() { return Kind.DROP_RESOLVED; }
        public List<Long> recipients() { return List.of(employeeId); }
    }

    record ShiftPickedUp(Long dropId, Long shiftId, Long originalEmployeeId, Long newEmployeeId,
                         boolean assignedByManager) implements WorkflowEvent {
        public Kind kind() { return Kind.SHIFT_PICKED_UP; }
        public List<Long> recipients() { return List.of(originalEmployeeId, newEmployeeId); }
    }

    record TimeOffRequested(Long requestId, Long employeeId, LocalDate startDate, LocalDate endDate,
                            String type) implements WorkflowEvent {
        public Kind kind() { return Kind.TIME_OFF_REQUESTED; }
        public List<Long> recipients() { return List.of(); }
    }

    record TimeOffResolved(Long requestId, Long employeeId, boolean approved, Long managerId) implements WorkflowEvent {
        public Kind kind() { return Kind.TIME_OFF_RESOLVED; }
        public List<Long> recipients() { return List.of(employeeId); }
    }

    record PayslipAvailable(Long entryId, Long periodId, Long employeeId, LocalDate periodStart,
                            LocalDate periodEnd, BigDecimal netPay) implements WorkflowEvent {
        public Kind kind() { return Kind.PAYSLIP_AVAILABLE; }
        public List<Long> recipients() { return List.of(employeeId); }
    }
}
