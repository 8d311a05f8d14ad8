package com.example.cafeshift.shiftdrop;

import com.example.cafeshift.common.Urgency;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.shift.Shift;
import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "shift_drop_requests")
public class ShiftDropRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shift_id", nullable = false)
    private Shift shift;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @Column(length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Urgency urgency = Urgency.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DropStatus status = DropStatus.PENDING;

    @Column(name = "requested_at", nullable = false)
    private LocalDateTime requestedAt;

    @Column(name = "resolved_by")
    private Long resolvedBy;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "manager_notes", length = 500)
    private String managerNotes;

    @Column(name = "picked_up_by")
    private Long pickedUpBy;

    @Column(name = "picked_up_at")
    private LocalDateTime pickedUpAt;

    protected ShiftDropRequest() {
    }

    public ShiftDropRequest(Shift shift, Employee employee, String reason, Urgency urgency, LocalDateTime requestedAt) {
        this.shift = shift;
        this.employee = employee;
        this.reason = reason;
        this.urgency = urgency == null ? Urgency.NORMAL : urgency;
        this.requestedAt = requestedAt;
    }

    public Long getId() { return id; }
    public Shift getShift() { return shift; }
    public Employee getEmployee() { return employee; }
    public String getReason() { return reason; }
    public Urgency getUrgency() { return urgency; }
    public DropStatus getStatus() { return status; }
    public LocalDateTime getRequestedAt() { return requestedAt; }
    public Long getResolvedBy() { return resolvedBy; }
    public LocalDateTime getResolvedAt() { return resolvedAt; }
    public String getManagerNotes() { return managerNotes; }
    public Long getPickedUpBy() { return pickedUpBy; }
    public LocalDateTime getPickedUpAt() { return pickedUpAt; }

    public enum DropStatus {
        PENDING("Pending"),
        APPROVED("Approved"),
        REJECTED("Rejected"),
        PICKED_UP("Picked up"),
        CANCELLED("Cancelled");

        private final String displayName;

        DropStatus(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }

        /** Pending or approved and still waiting for someone to pick it up. */
        public boolean isActive() {
            return this == PENDING || this == APPROVED;
        }
    }
}
