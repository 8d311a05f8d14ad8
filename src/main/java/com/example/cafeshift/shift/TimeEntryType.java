package com.example.cafeshift.shift;

public enum TimeEntryType {
    CLOCK_IN,
    CLOCK_OUT,
    BREAK_START,
    BREAK_END
}
