package com.example.cafeshift.breaks;

import java.util.List;

public record BreakPolicy(int minShiftLength, List<BreakSpec> breaks) {

    public BreakPolicy {
        breaks = List.copyOf(breaks);
    }
}
