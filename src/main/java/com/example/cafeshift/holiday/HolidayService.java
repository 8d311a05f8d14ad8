package com.example.cafeshift.holiday;

import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.exception.NotFoundException;
import com.example.cafeshift.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Service
@Transactional
public class HolidayService {

    private static final Logger logger = LoggerFactory.getLogger(HolidayService.class);

    private final HolidayRepository holidayRepository;

    public HolidayService(HolidayRepository holidayRepository) {
        this.holidayRepository = holidayRepository;
    }

    @Transactional(readOnly = true)
    public List<Holiday> listBetween(LocalDate start, LocalDate end) {
        requireRange(start, end);
        return holidayRepository.findByDateBetweenOrderByDateAsc(start, end);
    }

    /**
     * Snapshot used by one payroll computation over the inclusive date range.
     */
    @Transactional(readOnly = true)
    public HolidayCalendar calendarFor(LocalDate start, LocalDate end) {
        return HolidayCalendar.of(listBetween(start, end));
    }

    /**
     * Creates the holiday for {@code date}, or reclassifies the one already stored there.
     */
    public Holiday upsert(RequestContext context, LocalDate date, String name, HolidayType type) {
        context.requireManager("maintain holidays");
        if (date == null) {
            throw new ValidationException("date is required");
        }
        if (type == null) {
            throw new ValidationException("type is required");
        }
        if (name != null && name.trim().length() > Holiday.MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most " + Holiday.MAX_NAME_LENGTH + " characters");
        }
        Holiday holiday = holidayRepository.findByDate(date).orElse(null);
        if (holiday == null) {
            holiday = holidayRepository.save(new Holiday(date, name, type));
            logger.info("Holiday added: {} {} ({})", date, holiday.getName(), type);
        } else {
            HolidayType previous = holiday.getType();
            holiday.reclassify(name, type);
            logger.info("Holiday {} updated: {} -> {}", date, previous, type);
        }
        return holiday;
    }

    public void delete(RequestContext context, Long id) {
        context.requireManager("maintain holidays");
        Holiday holiday = holidayRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Holiday", id));
        holidayRepository.delete(holiday);
        logger.info("Holiday removed: {} {}", holiday.getDate(), holiday.getName());
    }

    private static void requireRange(LocalDate start, LocalDate end) {
        if (start == null || end == null || end.isBefore(start)) {
            throw new ValidationException("INVALID_RANGE", "end must not be before start", start, end);
        }
    }
}
