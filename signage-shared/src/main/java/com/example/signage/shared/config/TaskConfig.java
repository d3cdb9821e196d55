package com.example.signage.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class TaskConfig {

    /**
     * Thread pool shared by @Scheduled methods and schedule job firings.
     * Job firings never run on request threads.
     */
    @Bean
    public TaskScheduler taskScheduler(AppProperties appProperties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(appProperties.getScheduling().getPoolSize());
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Drives the SSE keepalive ticker. Tests swap it for a virtual-time scheduler.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler sseHeartbeatScheduler() {
        return Schedulers.newSingle("sse-heartbeat-");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
