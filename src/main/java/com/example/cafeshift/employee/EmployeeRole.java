package com.example.cafeshift.employee;

public enum EmployeeRole {
    EMPLOYEE,
    MANAGER,
    ADMIN;

    public boolean canApprove() {
        return this == MANAGER || this == ADMIN;
    }
}
