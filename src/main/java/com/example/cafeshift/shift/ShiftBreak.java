package com.example.cafeshift.shift;

import com.example.cafeshift.breaks.BreakType;
import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "shift_breaks")
public class ShiftBreak {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shift_id", nullable = false)
    private Shift shift;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false)
    private BreakType type;

    @Column(name = "scheduled_start", nullable = false)
    private LocalDateTime scheduledStart;

    @Column(name = "scheduled_end", nullable = false)
    private LocalDateTime scheduledEnd;

    @Column(name = "actual_start")
    private LocalDateTime actualStart;

    @Column(name = "actual_end")
    private LocalDateTime actualEnd;

    @Column(name = "is_paid", nullable = false)
    private boolean paid;

    @Column(name = "is_required", nullable = false)
    private boolean required;

    protected ShiftBreak() {}

    public ShiftBreak(BreakType type, LocalDateTime scheduledStart, LocalDateTime scheduledEnd, boolean paid, boolean required) {
        this.type = type;
        this.scheduledStart = scheduledStart;
        this.scheduledEnd = scheduledEnd;
        this.paid = paid;
        this.required = required;
    }

    /** Actual interval once both ends were clocked, otherwise the scheduled one. */
    public LocalDateTime effectiveStart() {
        return actualStart != null && actualEnd != null ? actualStart : scheduledStart;
    }

    public LocalDateTime effectiveEnd() {
        return actualStart != null && actualEnd != null ? actualEnd : scheduledEnd;
    }

    public Long getId() { return id; }
    public Shift getShift() { return shift; }
    void setShift(Shift shift) { this.shift = shift; }
    public BreakType getType() { return type; }
    public LocalDateTime getScheduledStart() { return scheduledStart; }
    public LocalDateTime getScheduledEnd() { return scheduledEnd; }
    public LocalDateTime getActualStart() { return actualStart; }
    public void setActualStart(LocalDateTime actualStart) { this.actualStart = actualStart; }
    public LocalDateTime getActualEnd() { return actualEnd; }
    public void setActualEnd(LocalDateTime actualEnd) { this.actualEnd = actualEnd; }
    public boolean isPaid() { return paid; }
    public boolean isRequired() { return required; }
}
