package com.example.cafeshift.hours;

import com.example.cafeshift.config.CafeProperties;
import com.example.cafeshift.holiday.HolidayCalendar;
import com.example.cafeshift.holiday.HolidayType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies worked minutes into pay buckets.
 *
 * <p>Unpaid breaks are cut out first, then the remaining time is split at midnight. Per calendar
 * day the first {@code regularDailyMinutes} go to the day's base bucket (holiday, else rest day,
 * else regular) and the rest is overtime. Night differential is counted on top.
 */
@Component
public class HoursAggregator {

    private final long regularDailyMinutes;
    private final LocalTime nightStart;
    private final LocalTime nightEnd;

    @Autowired
    public HoursAggregator(CafeProperties properties) {
        this(properties.getPayroll().getRegularDailyMinutes(),
                properties.getPayroll().getNightStart(),
                properties.getPayroll().getNightEnd());
    }

    public HoursAggregator(long regularDailyMinutes, LocalTime nightStart, LocalTime nightEnd) {
        this.regularDailyMinutes = regularDailyMinutes;
        this.nightStart = nightStart;
        this.nightEnd = nightEnd;
    }

    /**
     * @param restDay the employee's rest day, or {@code null} when none applies
     */
    public HourBuckets aggregate(List<WorkedShift> shifts, HolidayCalendar holidays, DayOfWeek restDay) {
        long worked = 0;
        long unpaidBreak = 0;
        List<TimeInterval> pieces = new ArrayList<>();
        for (WorkedShift shift : shifts) {
            worked += shift.worked().minutes();
            List<TimeInterval> segments = subtract(shift.worked(), shift.unpaidBreaks());
            long kept = 0;
            for (TimeInterval segment : segments) {
                kept += segment.minutes();
                pieces.addAll(splitAtMidnight(segment));
            }
            unpaidBreak += shift.worked().minutes() - kept;
        }
        pieces.sort(Comparator.comparing(TimeInterval::start));

        long regular = 0;
        long overtime = 0;
        long holiday = 0;
        long restDayMinutes = 0;
        long night = 0;
        Map<HolidayType, Long> byType = new EnumMap<>(HolidayType.class);
        Map<LocalDate, Long> baseUsed = new HashMap<>();

        for (TimeInterval piece : pieces) {
            LocalDate day = piece.start().toLocalDate();
            long minutes = piece.minutes();
            long used = baseUsed.getOrDefault(day, 0L);
            long base = Math.max(0, Math.min(minutes, regularDailyMinutes - used));
            baseUsed.put(day, used + base);
            overtime += minutes - base;

            HolidayType holidayType = holidays.typeOf(day).orElse(null);
            if (holidayType != null) {
                holiday += base;
                byType.merge(holidayType, base, Long::sum);
            } else if (restDay != null && day.getDayOfWeek() == restDay) {
                restDayMinutes += base;
            } else {
                regular += base;
            }
            night += nightMinutes(piece);
        }
        return new HourBuckets(regular, overtime, holiday, restDayMinutes, night, worked, unpaidBreak, byType);
    }

    static List<TimeInterval> subtract(TimeInterval worked, List<TimeInterval> breaks) {
        List<TimeInterval> clipped = new ArrayList<>();
        for (TimeInterval b : breaks) {
            TimeInterval overlap = worked.intersect(b);
            if (overlap != null) {
                clipped.add(overlap);
            }
        }
        clipped.sort(Comparator.comparing(TimeInterval::start));

        List<TimeInterval> result = new ArrayList<>();
        LocalDateTime cursor = worked.start();
        for (TimeInterval b : clipped) {
            if (b.start().isAfter(cursor)) {
                result.add(new TimeInterval(cursor, b.start()));
            }
            if (b.end().isAfter(cursor)) {
                cursor = b.end();
            }
        }
        if (worked.end().isAfter(cursor)) {
            result.add(new TimeInterval(cursor, worked.end()));
        }
        return result;
    }

    static List<TimeInterval> splitAtMidnight(TimeInterval interval) {
        List<TimeInterval> result = new ArrayList<>();
        LocalDateTime cursor = interval.start();
        while (cursor.isBefore(interval.end())) {
            LocalDateTime midnight = cursor.toLocalDate().plusDays(1).atStartOfDay();
            LocalDateTime end = midnight.isBefore(interval.end()) ? midnight : interval.end();
            result.add(new TimeInterval(cursor, end));
            cursor = end;
        }
        return result;
    }

    /** Night minutes of a piece that lies within one calendar day. */
    private long nightMinutes(TimeInterval piece) {
        LocalDate day = piece.start().toLocalDate();
        List<TimeInterval> windows = new ArrayList<>();
        if (nightStart.isAfter(nightEnd)) {
            windows.add(new TimeInterval(day.atStartOfDay(), day.atTime(nightEnd)));
            windows.add(new TimeInterval(day.atTime(nightStart), day.plusDays(1).atStartOfDay()));
        } else {
            windows.add(new TimeInterval(day.atTime(nightStart), day.atTime(nightEnd)));
        }
        long minutes = 0;
        for (TimeInterval window : windows) {
            TimeInterval overlap = piece.intersect(window);
            if (overlap != null) {
                minutes += overlap.minutes();
            }
        }
        return minutes;
    }
}
