package com.example.cafeshift.hours;

import com.example.cafeshift.shift.Shift;
import com.example.cafeshift.shift.ShiftBreak;

import java.util.ArrayList;
import java.util.List;

/**
 * Clocked interval of a completed shift plus the unpaid breaks taken inside it.
 */
public record WorkedShift(TimeInterval worked, List<TimeInterval> unpaidBreaks) {

    public WorkedShift {
        unpaidBreaks = List.copyOf(unpaidBreaks);
    }

    public static WorkedShift from(Shift shift) {
        if (shift.getActualStart() == null || shift.getActualEnd() == null) {
            throw new IllegalArgumentException("Shift " + shift.getId() + " has no actual start/end");
        }
        List<TimeInterval> unpaid = new ArrayList<>();
        for (ShiftBreak b : shift.getBreaks()) {
            if (b.isPaid() || b.effectiveStart() == null || b.effectiveEnd() == null) {
                continue;
            }
            if (b.effectiveEnd().isAfter(b.effectiveStart())) {
                unpaid.add(new TimeInterval(b.effectiveStart(), b.effectiveEnd()));
            }
        }
        return new WorkedShift(new TimeInterval(shift.getActualStart(), shift.getActualEnd()), unpaid);
    }
}
