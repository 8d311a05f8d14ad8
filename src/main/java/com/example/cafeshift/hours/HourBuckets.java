package com.example.cafeshift.hours;

import com.example.cafeshift.holiday.HolidayType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Minutes worked in a pay period, split into pay buckets. Regular, overtime, holiday and rest day
 * minutes partition the payable time; night differential minutes overlap them.
 */
public record HourBuckets(long regularMinutes,
                          long overtimeMinutes,
                          long holidayMinutes,
                          long restDayMinutes,
                          long nightDifferentialMinutes,
                          long workedMinutes,
                          long unpaidBreakMinutes,
                          Map<HolidayType, Long> holidayMinutesByType) {

    private static final BigDecimal SIXTY = BigDecimal.valueOf(60);

    public HourBuckets {
        EnumMap<HolidayType, Long> copy = new EnumMap<>(HolidayType.class);
        copy.putAll(holidayMinutesByType);
        holidayMinutesByType = Collections.unmodifiableMap(copy);
    }

    public static HourBuckets empty() {
        return new HourBuckets(0, 0, 0, 0, 0, 0, 0, Map.of());
    }

    public long payableMinutes() {
        return workedMinutes - unpaidBreakMinutes;
    }

    public long holidayMinutes(HolidayType type) {
        return holidayMinutesByType.getOrDefault(type, 0L);
    }

    public static BigDecimal toHours(long minutes) {
        return BigDecimal.valueOf(minutes).divide(SIXTY, 2, RoundingMode.HALF_UP);
    }

    public BigDecimal regularHours() { return toHours(regularMinutes); }
    public BigDecimal overtimeHours() { return toHours(overtimeMinutes); }
    public BigDecimal holidayHours() { return toHours(holidayMinutes); }
    public BigDecimal restDayHours() { return toHours(restDayMinutes); }
    public BigDecimal nightDifferentialHours() { return toHours(nightDifferentialMinutes); }
    public BigDecimal payableHours() { return toHours(payableMinutes()); }
}
