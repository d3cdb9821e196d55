package com.example.signage.service.delivery;

import com.example.signage.shared.util.Constants.SseEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SseEventFactory {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Builds a named SSE event whose JSON data always carries a server {@code timestamp}.
     * @param eventName The wire event name (e.g. content.update).
     * @param eventId An optional event id.
     * @param data The payload fields; a {@code timestamp} field is added when missing.
     * @return The event, or null if the payload cannot be serialized.
     */
    public ServerSentEvent<String> createEvent(String eventName, String eventId, Map<String, Object> data) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (data != null) {
            body.putAll(data);
        }
        body.putIfAbsent("timestamp", OffsetDateTime.now(clock).toString());
        try {
            String payload = objectMapper.writeValueAsString(body);
            return ServerSentEvent.<String>builder()
                .event(eventName)
                .id(eventId)
                .data(payload)
                .build();
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for SSE event {}: {}", eventName, e.getMessage());
            return null;
        }
    }

    public ServerSentEvent<String> createHeartbeatEvent() {
        return createEvent(SseEventType.HEARTBEAT.wireName(), null, Map.of());
    }

    public ServerSentEvent<String> createConnectedEvent(String connectionId, Long displayId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("clientId", connectionId);
        data.put("displayId", displayId);
        data.put("message", "SSE connection established");
        return createEvent(SseEventType.CONNECTED.wireName(), connectionId, data);
    }

    public ServerSentEvent<String> createShutdownEvent() {
        return createEvent(SseEventType.SERVER_SHUTDOWN.wireName(), null,
                Map.of("message", "Server is shutting down. Please reconnect momentarily."));
    }
}
