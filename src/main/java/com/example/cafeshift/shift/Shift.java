package com.example.cafeshift.shift;

import com.example.cafeshift.employee.Employee;
import jakarta.persistence.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "shifts", indexes = {
        @Index(name = "idx_shifts_employee_start", columnList = "employee_id, scheduled_start")
})
public class Shift {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @Column(name = "branch_id", nullable = false)
    private Long branchId;

    @Column(name = "scheduled_start", nullable = false)
    private LocalDateTime scheduledStart;

    @Column(name = "scheduled_end", nullable = false)
    private LocalDateTime scheduledEnd;

    @Column(name = "actual_start")
    private LocalDateTime actualStart;

    @Column(name = "actual_end")
    private LocalDateTime actualEnd;

    @Column(nullable = false, length = 50)
    private String position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ShiftStatus status = ShiftStatus.SCHEDULED;

    @OneToMany(mappedBy = "shift", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("scheduledStart ASC")
    private List<ShiftBreak> breaks = new ArrayList<>();

    @Version
    private Long version;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected Shift() {
    }

    public Shift(Employee employee, Long branchId, LocalDateTime scheduledStart, LocalDateTime scheduledEnd, String position) {
        this.employee = employee;
        this.branchId = branchId;
        this.scheduledStart = scheduledStart;
        this.scheduledEnd = scheduledEnd;
        this.position = position;
    }

    @PrePersist
    protected void onCreate() { this.createdAt = LocalDateTime.now(); this.updatedAt = this.createdAt; }
    @PreUpdate
    protected void onUpdate() { this.updatedAt = LocalDateTime.now(); }

    public long scheduledMinutes() {
        return Duration.between(scheduledStart, scheduledEnd).toMinutes();
    }

    public boolean isOwnedBy(Long employeeId) {
        return employee != null && employee.getId().equals(employeeId);
    }

    public void addBreak(ShiftBreak shiftBreak) {
        shiftBreak.setShift(this);
        breaks.add(shiftBreak);
    }

    public Long getId() { return id; }
    public Employee getEmployee() { return employee; }
    public void setEmployee(Employee employee) { this.employee = employee; }
    public Long getBranchId() { return branchId; }
    public LocalDateTime getScheduledStart() { return scheduledStart; }
    public void setScheduledStart(LocalDateTime scheduledStart) { this.scheduledStart = scheduledStart; }
    public LocalDateTime getScheduledEnd() { return scheduledEnd; }
    public void setScheduledEnd(LocalDateTime scheduledEnd) { this.scheduledEnd = scheduledEnd; }
    public LocalDateTime getActualStart() { return actualStart; }
    public void setActualStart(LocalDateTime actualStart) { this.actualStart = actualStart; }
    public LocalDateTime getActualEnd() { return actualEnd; }
    public void setActualEnd(LocalDateTime actualEnd) { this.actualEnd = actualEnd; }
    public String getPosition() { return position; }
    public void setPosition(String position) { this.position = position; }
    public ShiftStatus getStatus() { return status; }
    public void setStatus(ShiftStatus status) { this.status = status; }
    public List<ShiftBreak> getBreaks() { return breaks; }
    public Long getVersion() { return version; }
}
