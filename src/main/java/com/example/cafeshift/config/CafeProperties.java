package com.example.cafeshift.config;

import com.example.cafeshift.breaks.BreakType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "cafe")
public class CafeProperties {

    private final Breaks breaks = new Breaks();
    private final Workflow workflow = new Workflow();
    private final Payroll payroll = new Payroll();

    public Breaks getBreaks() { return breaks; }
    public Workflow getWorkflow() { return workflow; }
    public Payroll getPayroll() { return payroll; }

    public static class Breaks {
        /** Policy table, in the order it is declared. */
        private List<Policy> policies = new ArrayList<>();

        public List<Policy> getPolicies() { return policies; }
        public void setPolicies(List<Policy> policies) { this.policies = policies; }
    }

    public static class Policy {
        private int minShiftLength;
        private List<BreakSpec> breaks = new ArrayList<>();

        public int getMinShiftLength() { return minShiftLength; }
        public void setMinShiftLength(int minShiftLength) { this.minShiftLength = minShiftLength; }
        public List<BreakSpec> getBreaks() { return breaks; }
        public void setBreaks(List<BreakSpec> breaks) { this.breaks = breaks; }
    }

    public static class BreakSpec {
        private BreakType type;
        private int duration;
        private boolean paid;
        private boolean required;

        public BreakType getType() { return type; }
        public void setType(BreakType type) { this.type = type; }
        public int getDuration() { return duration; }
        public void setDuration(int duration) { this.duration = duration; }
        public boolean isPaid() { return paid; }
        public void setPaid(boolean paid) { this.paid = paid; }
        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }
    }

    public static class Workflow {
        /** Trades, drops and time off must be filed at least this many days ahead. */
        private int minNoticeDays = 3;
        private Duration approvalLockTimeout = Duration.ofSeconds(5);

        public int getMinNoticeDays() { return minNoticeDays; }
        public void setMinNoticeDays(int minNoticeDays) { this.minNoticeDays = minNoticeDays; }
        public Duration getApprovalLockTimeout() { return approvalLockTimeout; }
        public void setApprovalLockTimeout(Duration approvalLockTimeout) { this.approvalLockTimeout = approvalLockTimeout; }
    }

    public static class Payroll {
        private Duration lockTimeout = Duration.ofSeconds(30);
        /** Background runs beyond {@code maxWorkers + queueCapacity} are rejected. */
        private int workers = 1;
        private int maxWorkers = 2;
        private int queueCapacity = 10;
        private DeductionBasis deductionBasis = DeductionBasis.PERIOD_GROSS;
        private int regularDailyMinutes = 480;
        private LocalTime nightStart = LocalTime.of(22, 0);
        private LocalTime nightEnd = LocalTime.of(6, 0);
        private final Rates rates = new Rates();

        public Duration getLockTimeout() { return lockTimeout; }
        public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public DeductionBasis getDeductionBasis() { return deductionBasis; }
        public void setDeductionBasis(DeductionBasis deductionBasis) { this.deductionBasis = deductionBasis; }
        public int getRegularDailyMinutes() { return regularDailyMinutes; }
        public void setRegularDailyMinutes(int regularDailyMinutes) { this.regularDailyMinutes = regularDailyMinutes; }
        public LocalTime getNightStart() { return nightStart; }
        public void setNightStart(LocalTime nightStart) { this.nightStart = nightStart; }
        public LocalTime getNightEnd() { return nightEnd; }
        public void setNightEnd(LocalTime nightEnd) { this.nightEnd = nightEnd; }
        public Rates getRates() { return rates; }
    }

    public enum DeductionBasis {
        PERIOD_GROSS,
        MONTHLY_EQUIVALENT
    }

    /** Multipliers applied to the hourly rate. */
    public static class Rates {
        private BigDecimal overtime = new BigDecimal("1.25");
        private BigDecimal restDay = new BigDecimal("1.30");
        private BigDecimal nightDifferential = new BigDecimal("0.10");
        private BigDecimal regularHoliday = new BigDecimal("2.00");
        private BigDecimal specialNonWorkingHoliday = new BigDecimal("1.30");
        private BigDecimal specialWorkingHoliday = new BigDecimal("1.00");

        public BigDecimal getOvertime() { return overtime; }
        public void setOvertime(BigDecimal overtime) { this.overtime = overtime; }
        public BigDecimal getRestDay() { return restDay; }
        public void setRestDay(BigDecimal restDay) { this.restDay = restDay; }
        public BigDecimal getNightDifferential() { return nightDifferential; }
        public void setNightDifferential(BigDecimal nightDifferential) { this.nightDifferential = nightDifferential; }
        public BigDecimal getRegularHoliday() { return regularHoliday; }
        public void setRegularHoliday(BigDecimal regularHoliday) { this.regularHoliday = regularHoliday; }
        public BigDecimal getSpecialNonWorkingHoliday() { return specialNonWorkingHoliday; }
        public void setSpecialNonWorkingHoliday(BigDecimal specialNonWorkingHoliday) { this.specialNonWorkingHoliday = specialNonWorkingHoliday; }
        public BigDecimal getSpecialWorkingHoliday() { return specialWorkingHoliday; }
        public void setSpecialWorkingHoliday(BigDecimal specialWorkingHoliday) { this.specialWorkingHoliday = specialWorkingHoliday; }
    }
}
