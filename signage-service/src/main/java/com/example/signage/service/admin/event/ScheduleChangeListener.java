package com.example.signage.service.admin.event;

import com.example.signage.service.scheduling.ScheduleJobDispatcher;
import com.example.signage.shared.aspect.Monitored;
import com.example.signage.shared.event.EventBus;
import com.example.signage.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Map;

/**
 * Applies schedule and group changes to the job table and the event bus once the
 * originating transaction has committed. A rolled-back change arms, cancels and
 * announces nothing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@Monitored("schedule-change-listener")
public class ScheduleChangeListener {

    private final ScheduleJobDispatcher jobDispatcher;
    private final EventBus eventBus;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onScheduleCreated(ScheduleCreatedEvent event) {
        int displays = jobDispatcher.arm(event.schedule());
        log.info("Schedule {} committed; jobs armed for {} display(s)", event.schedule().getId(), displays);
        eventBus.publish(Constants.Topics.SCHEDULE_CREATED, Map.of("schedule", event.response()));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onScheduleUpdated(ScheduleUpdatedEvent event) {
        jobDispatcher.rearm(event.previous(), event.current());
        eventBus.publish(Constants.Topics.SCHEDULE_UPDATED, Map.of("schedule", event.response()));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onScheduleDeleted(ScheduleDeletedEvent event) {
        int cancelled = jobDispatcher.cancel(event.schedule());
        log.info("Schedule {} deletion committed; {} job(s) cancelled", event.schedule().getId(), cancelled);
        eventBus.publish(Constants.Topics.SCHEDULE_DELETED, Map.of("scheduleId", event.schedule().getId()));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onMembershipChanged(DisplayGroupMembershipChangedEvent event) {
        jobDispatcher.reconcileGroup(event.groupId());
    }
}
