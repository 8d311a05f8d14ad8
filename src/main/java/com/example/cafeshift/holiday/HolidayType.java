package com.example.cafeshift.holiday;

/**
 * Holiday classes with distinct premium multipliers under {@code cafe.payroll.multipliers}.
 */
public enum HolidayType {
    REGULAR("Regular holiday"),
    SPECIAL_NON_WORKING("Special non-working day"),
    SPECIAL_WORKING("Special working day");

    private final String defaultName;

    HolidayType(String defaultName) {
        this.defaultName = defaultName;
    }

    public String getDefaultName() {
        return defaultName;
    }
}
