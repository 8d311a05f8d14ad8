package com.example.cafeshift.payroll;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Progress of background payroll runs, keyed by job id.
 */
@Component
public class PayrollJobStatusService {

    public static class Status {
        public volatile Long periodId;
        public volatile boolean running;
        public volatile boolean done;
        public volatile boolean cancelRequested;
        public volatile boolean cancelled;
        public volatile int entryCount;
        public volatile int errorCount;
        public volatile String failure;
        public volatile LocalDateTime startedAt;
        public volatile LocalDateTime finishedAt;
    }

    private final Map<String, Status> jobs = new ConcurrentHashMap<>();

    public String register(Long periodId) {
        String jobId = UUID.randomUUID().toString();
        Status s = new Status();
        s.periodId = periodId;
        jobs.put(jobId, s);
        return jobId;
    }

    public void start(String jobId) {
        Status s = jobs.computeIfAbsent(jobId, k -> new Status());
        s.running = true;
        s.done = false;
        s.startedAt = LocalDateTime.now();
        s.finishedAt = null;
    }

    public void finish(String jobId, PayrollRunResult result) {
        Status s = jobs.computeIfAbsent(jobId, k -> new Status());
        s.entryCount = result.entries().size();
        s.errorCount = result.errors().size();
        s.cancelled = result.cancelled();
        s.running = false;
        s.done = true;
        s.finishedAt = LocalDateTime.now();
    }

    public void fail(String jobId, String failure) {
        Status s = jobs.computeIfAbsent(jobId, k -> new Status());
        s.failure = failure;
        s.running = false;
        s.done = true;
        s.finishedAt = LocalDateTime.now();
    }

    /**
     * @return false when the job is unknown or already finished
     */
    public boolean requestCancel(String jobId) {
        Status s = jobs.get(jobId);
        if (s == null || s.done) {
            return false;
        }
        s.cancelRequested = true;
        return true;
    }

    public boolean isCancelRequested(String jobId) {
        Status s = jobs.get(jobId);
        return s != null && s.cancelRequested;
    }

    public Status get(String jobId) {
        return jobs.get(jobId);
    }
}
