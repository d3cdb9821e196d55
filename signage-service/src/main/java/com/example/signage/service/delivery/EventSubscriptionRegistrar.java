package com.example.signage.service.delivery;

import com.example.signage.shared.event.EventBus;
import com.example.signage.shared.util.Constants.SseEventType;
import com.example.signage.shared.util.Constants.Topics;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * The complete event bus consumer graph for live delivery: which bus topics reach
 * connected clients, under which wire event name, and whether they go to everyone
 * or only to the connections of the display named in the payload.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventSubscriptionRegistrar {

    private final EventBus eventBus;
    private final LiveDeliveryHub liveDeliveryHub;

    @PostConstruct
    public void registerSubscriptions() {
        broadcast(Topics.CONTENT_CREATED, SseEventType.CONTENT_CHANGED);
        broadcast(Topics.CONTENT_UPDATED, SseEventType.CONTENT_CHANGED);
        broadcast(Topics.CONTENT_DELETED, SseEventType.CONTENT_CHANGED);
        broadcast(Topics.SETTINGS_UPDATED, SseEventType.SETTINGS_CHANGED);
        broadcast(Topics.SETTINGS_FPCON_CHANGED, SseEventType.FPCON_CHANGED);
        broadcast(Topics.SETTINGS_LAN_CHANGED, SseEventType.LAN_CHANGED);
        broadcast(Topics.SCHEDULE_CREATED, SseEventType.SCHEDULE_CHANGED);
        broadcast(Topics.SCHEDULE_UPDATED, SseEventType.SCHEDULE_CHANGED);
        broadcast(Topics.SCHEDULE_DELETED, SseEventType.SCHEDULE_CHANGED);
        broadcast(Topics.DISPLAY_ONLINE, SseEventType.DISPLAY_STATUS);
        broadcast(Topics.DISPLAY_OFFLINE, SseEventType.DISPLAY_STATUS);
        broadcast(Topics.DISPLAY_ERROR_HIGH, SseEventType.DISPLAY_ERROR);

        castToDisplay(Topics.SCHEDULE_TRIGGERED, SseEventType.SCHEDULE_TRIGGERED);
        castToDisplay(Topics.DISPLAY_CONTENT_CHANGED, SseEventType.CONTENT_UPDATE);
        castToDisplay(Topics.DISPLAY_DEBUG, SseEventType.DEBUG_TOGGLE);

        log.info("Registered live delivery subscriptions on the event bus");
    }

    private void broadcast(String topic, SseEventType eventType) {
        eventBus.subscribe(topic, (receivedTopic, payload) -> {
            DeliveryResult result = liveDeliveryHub.broadcast(eventType.wireName(), payload);
            log.debug("{} -> broadcast {}: {}", receivedTopic, eventType.wireName(), result);
        });
    }

    private void castToDisplay(String topic, SseEventType eventType) {
        eventBus.subscribe(topic, (receivedTopic, payload) -> {
            Long displayId = displayIdOf(payload);
            if (displayId == null) {
                log.warn("Event {} has no displayId; nothing to deliver", receivedTopic);
                return;
            }
            DeliveryResult result = liveDeliveryHub.castToDisplay(displayId, eventType.wireName(), payload);
            log.debug("{} -> display {} {}: {}", receivedTopic, displayId, eventType.wireName(), result);
        });
    }

    static Long displayIdOf(Map<String, Object> payload) {
        Object value = payload == null ? null : payload.get("displayId");
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.valueOf(text.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric displayId '{}'", text);
            }
        }
        return null;
    }
}
