package com.example.cafeshift.holiday;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the holidays relevant to one computation pass.
 */
public final class HolidayCalendar {

    private static final HolidayCalendar EMPTY = new HolidayCalendar(Collections.emptyMap());

    private final Map<LocalDate, HolidayType> byDate;

    private HolidayCalendar(Map<LocalDate, HolidayType> byDate) {
        this.byDate = byDate;
    }

    public static HolidayCalendar empty() {
        return EMPTY;
    }

    public static HolidayCalendar of(Collection<Holiday> holidays) {
        Map<LocalDate, HolidayType> map = new HashMap<>();
        for (Holiday holiday : holidays) {
            map.put(holiday.getDate(), holiday.getType());
        }
        return new HolidayCalendar(Collections.unmodifiableMap(map));
    }

    public static HolidayCalendar of(Map<LocalDate, HolidayType> holidays) {
        return new HolidayCalendar(Map.copyOf(holidays));
    }

    public Optional<HolidayType> typeOf(LocalDate date) {
        return Optional.ofNullable(byDate.get(date));
    }

    public boolean isHoliday(LocalDate date) {
        return byDate.containsKey(date);
    }
}
