package com.example.cafeshift.shift;

public enum ShiftStatus {
    SCHEDULED,
    COMPLETED,
    CANCELLED
}
