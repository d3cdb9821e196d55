package com.example.signage.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the in-memory job registry from the persisted schedules once the application is ready.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Profile("!checkpoint-build")
public class ScheduleJobBootstrap {

    private final ScheduleJobDispatcher scheduleJobDispatcher;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeActiveSchedules() {
        log.info("Arming jobs for active schedules...");
        int armed = scheduleJobDispatcher.armAll();
        log.info("Armed jobs for {} active schedule(s).", armed);
    }
}
