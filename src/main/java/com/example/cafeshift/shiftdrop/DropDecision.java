package com.example.cafeshift.shiftdrop;

public enum DropDecision {
    APPROVE,
    REJECT
}
