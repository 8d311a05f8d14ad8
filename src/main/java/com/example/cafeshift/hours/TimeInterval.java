package com.example.cafeshift.hours;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Half-open interval [start, end), truncated to whole minutes so that the minutes of the pieces
 * of a split interval always add up to the minutes of the whole.
 */
public record TimeInterval(LocalDateTime start, LocalDateTime end) {

    public TimeInterval {
        if (start == null || end == null || end.isBefore(start)) {
            throw new IllegalArgumentException("Invalid interval " + start + " - " + end);
        }
        start = start.truncatedTo(ChronoUnit.MINUTES);
        end = end.truncatedTo(ChronoUnit.MINUTES);
    }

    public long minutes() {
        return Duration.between(start, end).toMinutes();
    }

    public boolean isEmpty() {
        return !end.isAfter(start);
    }

    /** Overlap with {@code other}, or {@code null} when they do not intersect. */
    public TimeInterval intersect(TimeInterval other) {
        LocalDateTime s = start.isAfter(other.start) ? start : other.start;
        LocalDateTime e = end.isBefore(other.end) ? end : other.end;
        return e.isAfter(s) ? new TimeInterval(s, e) : null;
    }
}
