package com.example.signage.service.delivery;

import com.example.signage.shared.config.MonitoringConfig;
import com.example.signage.shared.event.EventBus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventSubscriptionRegistrarTest {

    @Mock
    private LiveDeliveryHub hub;

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus(new MonitoringConfig.SignageMetricsCollector(new SimpleMeterRegistry()));
        new EventSubscriptionRegistrar(eventBus, hub).registerSubscriptions();
    }

    @Test
    void broadcastTopicsUseTheirWireNames() {
        when(hub.broadcast(anyString(), any())).thenReturn(DeliveryResult.NONE);
        Map<String, String> expected = Map.ofEntries(
                Map.entry("content.created", "content.changed"),
                Map.entry("content.updated", "content.changed"),
                Map.entry("content.deleted", "content.changed"),
                Map.entry("settings.updated", "settings.changed"),
                Map.entry("settings.fpcon.changed", "fpcon.changed"),
                Map.entry("settings.lan.changed", "lan.changed"),
                Map.entry("schedule.created", "schedule.changed"),
                Map.entry("schedule.updated", "schedule.changed"),
                Map.entry("schedule.deleted", "schedule.changed"),
                Map.entry("display.online", "display.status"),
                Map.entry("display.offline", "display.status"),
                Map.entry("display.error.high", "display.error"));

        expected.forEach((topic, wireName) -> {
            Map<String, Object> payload = Map.of("topic", topic);
            assertThat(eventBus.publish(topic, payload)).as(topic).isEqualTo(1);
            verify(hub).broadcast(wireName, payload);
        });
    }

    @Test
    void displayTopicsAreCastToTheNamedDisplay() {
        when(hub.castToDisplay(anyLong(), anyString(), any())).thenReturn(DeliveryResult.NONE);

        Map<String, Object> triggered = Map.of("displayId", 10L, "scheduleId", 1L);
        Map<String, Object> contentChanged = Map.of("displayId", 11, "contentId", 5L);
        Map<String, Object> debug = Map.of("displayId", "12", "enabled", true);
        eventBus.publish("schedule.triggered", triggered);
        eventBus.publish("display.content.changed", contentChanged);
        eventBus.publish("display.debug", debug);

        verify(hub).castToDisplay(10L, "schedule.triggered", triggered);
        verify(hub).castToDisplay(11L, "content.update", contentChanged);
        verify(hub).castToDisplay(12L, "debug.toggle", debug);
    }

    @Test
    void displayEventWithoutDisplayIdIsDropped() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("displayId", null);

        eventBus.publish("schedule.triggered", payload);
        eventBus.publish("display.debug", Map.of("displayId", "not-a-number"));

        verify(hub, never()).castToDisplay(anyLong(), anyString(), any());
    }

    @Test
    void displayIdAcceptsNumbersAndNumericText() {
        assertThat(EventSubscriptionRegistrar.displayIdOf(Map.of("displayId", 3))).isEqualTo(3L);
        assertThat(EventSubscriptionRegistrar.displayIdOf(Map.of("displayId", " 4 "))).isEqualTo(4L);
        assertThat(EventSubscriptionRegistrar.displayIdOf(Map.of())).isNull();
        assertThat(EventSubscriptionRegistrar.displayIdOf(null)).isNull();
    }
}
