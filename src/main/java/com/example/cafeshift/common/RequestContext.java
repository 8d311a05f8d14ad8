package com.example.cafeshift.common;

import com.example.cafeshift.employee.EmployeeRole;
import com.example.cafeshift.exception.ValidationException;

import java.util.Objects;

/**
 * Identity of the caller of a single request. Passed explicitly into every workflow and payroll
 * operation instead of being read from shared state.
 */
public record RequestContext(Long actorId, EmployeeRole role) {

    public RequestContext {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(role, "role");
    }

    public static RequestContext employee(Long actorId) {
        return new RequestContext(actorId, EmployeeRole.EMPLOYEE);
    }

    public static RequestContext manager(Long actorId) {
        return new RequestContext(actorId, EmployeeRole.MANAGER);
    }

    public boolean isManager() {
        return role.canApprove();
    }

    public void requireManager(String action) {
        if (!isManager()) {
            throw new ValidationException("FORBIDDEN_ROLE", "Manager role required to " + action, actorId, role);
        }
    }
}
