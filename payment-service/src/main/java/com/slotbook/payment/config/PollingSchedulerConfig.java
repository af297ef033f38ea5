package com.slotbook.payment.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler running payment watches. Each poll is a short task; no thread waits between attempts.
 */
@Configuration
public class PollingSchedulerConfig {

    @Bean(name = "paymentPollingScheduler")
    public ThreadPoolTaskScheduler paymentPollingScheduler(
            @Value("${payment.polling.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("payment-poll-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
