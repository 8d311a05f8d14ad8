package com.example.cafeshift.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class PerformanceConfig {

    /** Background payroll runs, sized by {@code cafe.payroll.*-workers} and {@code queue-capacity}. */
    @Bean(name = "payrollExecutor")
    public Executor payrollExecutor(CafeProperties properties) {
        CafeProperties.Payroll payroll = properties.getPayroll();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(payroll.getWorkers());
        executor.setMaxPoolSize(Math.max(payroll.getWorkers(), payroll.getMaxWorkers()));
        executor.setQueueCapacity(payroll.getQueueCapacity());
        executor.setThreadNamePrefix("payroll-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /** Source of "now" for notice periods and clock events. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
