package com.example.cafeshift.shift;

import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * One clock event. Rows are only ever inserted.
 */
@Entity
@Table(name = "time_entries")
public class TimeEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private Long employeeId;

    @Column(name = "shift_id", updatable = false)
    private Long shiftId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TimeEntryType type;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime occurredAt;

    protected TimeEntry() {}

    public TimeEntry(Long employeeId, Long shiftId, TimeEntryType type, LocalDateTime occurredAt) {
        this.employeeId = employeeId;
        this.shiftId = shiftId;
        this.type = type;
        this.occurredAt = occurredAt;
    }

    public Long getId() { return id; }
    public Long getEmployeeId() { return employeeId; }
    public Long getShiftId() { return shiftId; }
    public TimeEntryType getType() { return type; }
    public LocalDateTime getOccurredAt() { return occurredAt; }
}
