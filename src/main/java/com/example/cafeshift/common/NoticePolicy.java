package com.example.cafeshift.common;

import com.example.cafeshift.config.CafeProperties;
import com.example.cafeshift.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Minimum advance notice for trades, drops and time off.
 */
@Component
public class NoticePolicy {

    private final CafeProperties properties;
    private final Clock clock;

    public NoticePolicy(CafeProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public void requireNotice(LocalDate date, String what) {
        int days = properties.getWorkflow().getMinNoticeDays();
        LocalDate earliest = LocalDate.now(clock).plusDays(days);
        if (date.isBefore(earliest)) {
            throw new ValidationException("INSUFFICIENT_NOTICE",
                    what + " must be requested at least " + days + " days in advance", date, earliest);
        }
    }
}
