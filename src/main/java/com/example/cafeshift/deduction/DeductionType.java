package com.example.cafeshift.deduction;

public enum DeductionType {
    SSS("SSS"),
    PHILHEALTH("PhilHealth"),
    PAGIBIG("Pag-IBIG"),
    TAX("Withholding tax");

    private final String displayName;

    DeductionType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
