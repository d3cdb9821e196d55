package com.example.signage.service.admin.service;

import com.example.signage.shared.event.EventBus;
import com.example.signage.shared.util.Constants.Topics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes mutations made by the content library and the settings store onto the event bus,
 * so connected displays hear about them. Each method returns the number of bus handlers
 * that completed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollaboratorEventRelay {

    private final EventBus eventBus;

    public int contentChanged(String action, Long contentId) {
        String topic = switch (action == null ? "" : action.toLowerCase()) {
            case "created" -> Topics.CONTENT_CREATED;
            case "updated" -> Topics.CONTENT_UPDATED;
            case "deleted" -> Topics.CONTENT_DELETED;
            default -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Unknown content action '" + action + "'; expected created, updated or deleted");
        };
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contentId", contentId);
        payload.put("action", action.toLowerCase());
        log.info("Relaying {} for content {}", topic, contentId);
        return eventBus.publish(topic, payload);
    }

    public int settingsUpdated(String key, String value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("key", key);
        payload.put("value", value);
        log.info("Relaying settings change for key '{}'", key);
        return eventBus.publish(Topics.SETTINGS_UPDATED, payload);
    }

    public int fpconChanged(String status) {
        log.info("Relaying FPCON change to '{}'", status);
        return eventBus.publish(Topics.SETTINGS_FPCON_CHANGED, statusPayload(status));
    }

    public int lanChanged(String status) {
        log.info("Relaying LAN status change to '{}'", status);
        return eventBus.publish(Topics.SETTINGS_LAN_CHANGED, statusPayload(status));
    }

    private static Map<String, Object> statusPayload(String status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status);
        return payload;
    }
}
