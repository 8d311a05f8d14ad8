package com.example.cafeshift.common;

public enum Urgency {
    URGENT,
    NORMAL,
    LOW
}
