package com.example.cafeshift.common.error;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Most recent unexpected errors and payroll computation failures, newest first, for the admin
 * error endpoint.
 */
@Component
public class ErrorLogBuffer {

    static final int CAPACITY = 200;

    private final Deque<Entry> entries = new ConcurrentLinkedDeque<>();

    public void addError(String errorCode, Throwable error) {
        String message = error == null ? null : error.getMessage();
        String exceptionType = error == null ? null : error.getClass().getSimpleName();
        push(new Entry(LocalDateTime.now(), errorCode, message, exceptionType, Map.of()));
    }

    /**
     * Records a failure that was handled without an exception reaching the web layer, with the
     * identifiers needed to diagnose it.
     */
    public void record(String errorCode, String message, Map<String, Object> context) {
        push(new Entry(LocalDateTime.now(), errorCode, message, null, context == null ? Map.of() : Map.copyOf(context)));
    }

    public List<Entry> recent() {
        return new ArrayList<>(entries);
    }

    public void clear() {
        entries.clear();
    }

    private void push(Entry entry) {
        entries.addFirst(entry);
        while (entries.size() > CAPACITY) {
            entries.pollLast();
        }
    }

    public record Entry(LocalDateTime time, String errorCode, String message, String exceptionType,
                        Map<String, Object> context) {}
}
