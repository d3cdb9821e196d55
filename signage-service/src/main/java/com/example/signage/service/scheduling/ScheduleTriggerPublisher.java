package com.example.signage.service.scheduling;

import com.example.signage.shared.event.EventBus;
import com.example.signage.shared.util.Constants.Topics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Announces a schedule job firing on the event bus: {@code schedule.triggered}, then the
 * display-specific and generic content-changed events, in that order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleTriggerPublisher {

    static final String SOURCE_SCHEDULE = "schedule";

    private final EventBus eventBus;
    private final Clock clock;

    public void publish(ScheduleJobPayload payload) {
        OffsetDateTime triggeredAt = OffsetDateTime.now(clock);
        log.info("Schedule {} triggered for display {}", payload.scheduleId(), payload.displayId());

        Map<String, Object> triggered = new LinkedHashMap<>();
        triggered.put("scheduleId", payload.scheduleId());
        triggered.put("displayId", payload.displayId());
        triggered.put("contentId", payload.leadContentId());
        if (payload.contentIds() != null) {
            triggered.put("contentIds", payload.contentIds());
        }
        if (payload.playlistId() != null) {
            triggered.put("playlistId", payload.playlistId());
        }
        triggered.put("triggeredAt", triggeredAt.toString());
        eventBus.publish(Topics.SCHEDULE_TRIGGERED, triggered);

        Map<String, Object> contentChanged = new LinkedHashMap<>();
        contentChanged.put("displayId", payload.displayId());
        contentChanged.put("contentId", payload.leadContentId());
        if (payload.playlistId() != null) {
            contentChanged.put("playlistId", payload.playlistId());
        }
        contentChanged.put("source", SOURCE_SCHEDULE);
        contentChanged.put("scheduleId", payload.scheduleId());
        eventBus.publish(Topics.displayContentChanged(payload.displayId()), contentChanged);
        eventBus.publish(Topics.DISPLAY_CONTENT_CHANGED, contentChanged);
    }
}
