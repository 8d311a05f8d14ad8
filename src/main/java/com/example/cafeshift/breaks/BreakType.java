package com.example.cafeshift.breaks;

public enum BreakType {
    COFFEE,
    LUNCH,
    MEAL,
    REST,
    OTHER
}
