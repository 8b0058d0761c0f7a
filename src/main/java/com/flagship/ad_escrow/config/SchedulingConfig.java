package com.flagship.ad_escrow.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Background execution for posting attempts, confirmation checks and sweeps.
 *
 * One scheduler serves both {@code @Scheduled} jobs and the per-campaign tasks
 * registered in {@code CampaignTaskRegistry}; nothing in the engine sleeps on a
 * request thread.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {

    @Value("${engine.scheduler.pool-size:4}")
    private int poolSize;

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // run times are computed from the same clock the services use
        scheduler.setClock(clock);
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("engine-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
