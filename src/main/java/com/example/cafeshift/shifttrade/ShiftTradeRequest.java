package com.example.cafeshift.shifttrade;

import com.example.cafeshift.common.Urgency;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.shift.Shift;
import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "shift_trade_requests")
public class ShiftTradeRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shift_id", nullable = false)
    private Shift shift;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "from_employee_id", nullable = false)
    private Employee fromEmployee;

    /** Null means the trade is open to anyone. */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "to_employee_id")
    private Employee toEmployee;

    @Column(length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Urgency urgency = Urgency.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TradeStatus status = TradeStatus.PENDING;

    @Column(name = "requested_at", nullable = false)
    private LocalDateTime requestedAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "resolved_by")
    private Long resolvedBy;

    protected ShiftTradeRequest() {
    }

    public ShiftTradeRequest(Shift shift, Employee fromEmployee, Employee toEmployee, String reason,
                             Urgency urgency, LocalDateTime requestedAt) {
        this.shift = shift;
        this.fromEmployee = fromEmployee;
        this.toEmployee = toEmployee;
        this.reason = reason;
        this.urgency = urgency == null ? Urgency.NORMAL : urgency;
        this.requestedAt = requestedAt;
    }

    public boolean isOpen() {
        return toEmployee == null;
    }

    public Long getId() { return id; }
    public Shift getShift() { return shift; }
    public Employee getFromEmployee() { return fromEmployee; }
    public Employee getToEmployee() { return toEmployee; }
    public String getReason() { return reason; }
    public Urgency getUrgency() { return urgency; }
    public TradeStatus getStatus() { return status; }
    public LocalDateTime getRequestedAt() { return requestedAt; }
    public LocalDateTime getResolvedAt() { return resolvedAt; }
    public Long getResolvedBy() { return resolvedBy; }

    public enum TradeStatus {
        PENDING("Pending"),
        APPROVED("Approved"),
        REJECTED("Rejected"),
        WITHDRAWN("Withdrawn");

        private final String displayName;

        TradeStatus(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }
}
