package com.example.cafeshift.shiftdrop;

import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.common.Urgency;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.employee.EmployeeRepository;
import com.example.cafeshift.employee.EmployeeRole;
import com.example.cafeshift.exception.ConflictException;
import com.example.cafeshift.exception.ValidationException;
import com.example.cafeshift.shift.Shift;
import com.example.cafeshift.shift.ShiftRepository;
import com.example.cafeshift.shift.TimeLedgerService;
import com.example.cafeshift.shiftdrop.ShiftDropRequest.DropStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class ShiftDropServiceTest {

    private static final long BRANCH = 301L;

    @Autowired
    private ShiftDropService shiftDropService;

    @Autowired
    private TimeLedgerService timeLedgerService;

    @Autowired
    private EmployeeRepository employeeRepository;

    @Autowired
    private ShiftRepository shiftRepository;

    private Long ownerId;
    private Long pickerId;
    private RequestContext manager;

    @BeforeEach
    void setUp() {
        ownerId = employeeRepository.save(new Employee("Dana", EmployeeRole.EMPLOYEE, new BigDecimal("95.00"), BRANCH)).getId();
        pickerId = employeeRepository.save(new Employee("Eli", EmployeeRole.EMPLOYEE, new BigDecimal("95.00"), BRANCH)).getId();
        manager = RequestContext.manager(
                employeeRepository.save(new Employee("Lead", EmployeeRole.MANAGER, new BigDecimal("150.00"), BRANCH)).getId());
    }

    @Test
    void approvedDrop_pickedUpReassignsShift() {
        Shift shift = scheduledShift();
        ShiftDropRequest drop = shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), "Class", Urgency.NORMAL);
        assertThat(drop.getStatus()).isEqualTo(DropStatus.PENDING);

        ShiftDropRequest approved = shiftDropService.resolveDrop(manager, drop.getId(), DropDecision.APPROVE, "ok");
        assertThat(approved.getStatus()).isEqualTo(DropStatus.APPROVED);
        assertThat(approved.getManagerNotes()).isEqualTo("ok");

        Shift picked = shiftDropService.pickupDrop(RequestContext.employee(pickerId), drop.getId());

        assertThat(picked.getEmployee().getId()).isEqualTo(pickerId);
        ShiftDropDto after = shiftDropService.getDrop(drop.getId());
        assertThat(after.status()).isEqualTo(DropStatus.PICKED_UP);
        assertThat(after.pickedUpBy()).isEqualTo(pickerId);
    }

    @Test
    void rejectedDrop_leavesShiftWithOwner() {
        Shift shift = scheduledShift();
        ShiftDropRequest drop = shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), null, Urgency.LOW);

        shiftDropService.resolveDrop(manager, drop.getId(), DropDecision.REJECT, "short staffed");

        assertThat(shiftDropService.getDrop(drop.getId()).status()).isEqualTo(DropStatus.REJECTED);
        assertThat(shiftRepository.getRequired(shift.getId()).getEmployee().getId()).isEqualTo(ownerId);
        assertThatThrownBy(() -> shiftDropService.pickupDrop(RequestContext.employee(pickerId), drop.getId()))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "INVALID_STATE");
    }

    @Test
    void resolveDrop_requiresManager() {
        Shift shift = scheduledShift();
        ShiftDropRequest drop = shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), null, Urgency.NORMAL);

        assertThatThrownBy(() -> shiftDropService.resolveDrop(RequestContext.employee(pickerId), drop.getId(),
                DropDecision.APPROVE, null))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "FORBIDDEN_ROLE");
    }

    @Test
    void resolveDrop_twiceConflicts() {
        Shift shift = scheduledShift();
        ShiftDropRequest drop = shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), null, Urgency.NORMAL);
        shiftDropService.resolveDrop(manager, drop.getId(), DropDecision.APPROVE, null);

        assertThatThrownBy(() -> shiftDropService.resolveDrop(manager, drop.getId(), DropDecision.REJECT, null))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void pickupDrop_secondPickupConflictsAndSelfPickupIsRejected() {
        Shift shift = scheduledShift();
        ShiftDropRequest drop = shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), null, Urgency.URGENT);
        shiftDropService.resolveDrop(manager, drop.getId(), DropDecision.APPROVE, null);

        assertThatThrownBy(() -> shiftDropService.pickupDrop(RequestContext.employee(ownerId), drop.getId()))
                .hasFieldOrPropertyWithValue("errorCode", "SELF_PICKUP");

        shiftDropService.pickupDrop(RequestContext.employee(pickerId), drop.getId());
        Long lateId = employeeRepository.save(new Employee("Late", EmployeeRole.EMPLOYEE, new BigDecimal("95.00"), BRANCH)).getId();
        assertThatThrownBy(() -> shiftDropService.pickupDrop(RequestContext.employee(lateId), drop.getId()))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void assignDrop_managerPicksUpForEmployee() {
        Shift shift = scheduledShift();
        ShiftDropRequest drop = shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), null, Urgency.NORMAL);
        shiftDropService.resolveDrop(manager, drop.getId(), DropDecision.APPROVE, null);

        assertThatThrownBy(() -> shiftDropService.assignDrop(RequestContext.employee(pickerId), drop.getId(), pickerId))
                .hasFieldOrPropertyWithValue("errorCode", "FORBIDDEN_ROLE");

        Shift assigned = shiftDropService.assignDrop(manager, drop.getId(), pickerId);
        assertThat(assigned.getEmployee().getId()).isEqualTo(pickerId);
    }

    @Test
    void assignDrop_inactiveEmployeeIsRejected() {
        Employee inactive = new Employee("Gone", EmployeeRole.EMPLOYEE, new BigDecimal("95.00"), BRANCH);
        inactive.setActive(false);
        Long inactiveId = employeeRepository.save(inactive).getId();
        Shift shift = scheduledShift();
        ShiftDropRequest drop = shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), null, Urgency.NORMAL);
        shiftDropService.resolveDrop(manager, drop.getId(), DropDecision.APPROVE, null);

        assertThatThrownBy(() -> shiftDropService.assignDrop(manager, drop.getId(), inactiveId))
                .hasFieldOrPropertyWithValue("errorCode", "INACTIVE_EMPLOYEE");
    }

    @Test
    void cancelDrop_byOwnerAllowsNewRequest() {
        Shift shift = scheduledShift();
        ShiftDropRequest drop = shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), null, Urgency.NORMAL);

        assertThatThrownBy(() -> shiftDropService.cancelDrop(RequestContext.employee(pickerId), drop.getId()))
                .hasFieldOrPropertyWithValue("errorCode", "NOT_OWNER");
        assertThatThrownBy(() -> shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), null, Urgency.NORMAL))
                .hasFieldOrPropertyWithValue("errorCode", "DUPLICATE_REQUEST");

        assertThat(shiftDropService.cancelDrop(RequestContext.employee(ownerId), drop.getId()).getStatus())
                .isEqualTo(DropStatus.CANCELLED);
        assertThat(shiftDropService.createDrop(RequestContext.employee(ownerId), shift.getId(), null, Urgency.NORMAL).getStatus())
                .isEqualTo(DropStatus.PENDING);
        assertThat(shiftDropService.listOwn(RequestContext.employee(ownerId))).hasSize(2);
    }

    private Shift scheduledShift() {
        LocalDateTime start = LocalDate.now().plusDays(7).atTime(LocalTime.of(14, 0));
        return timeLedgerService.createShift(manager, ownerId, start, start.plusHours(6), "Cashier");
    }
}
