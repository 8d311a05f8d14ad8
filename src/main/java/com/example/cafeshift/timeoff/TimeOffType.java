package com.example.cafeshift.timeoff;

public enum TimeOffType {
    VACATION,
    SICK,
    PERSONAL
}
