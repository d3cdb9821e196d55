package com.example.signage.service.delivery;

import com.example.signage.shared.config.AppProperties;
import com.example.signage.shared.config.MonitoringConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LiveDeliveryHubTest {

    private VirtualTimeScheduler scheduler;
    private AppProperties appProperties;
    private LiveDeliveryHub hub;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        appProperties = new AppProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T09:00:00Z"), ZoneOffset.UTC);
        hub = new LiveDeliveryHub(new SseEventFactory(new ObjectMapper(), clock), appProperties, scheduler, clock,
                new MonitoringConfig.SignageMetricsCollector(new SimpleMeterRegistry()));
        hub.init();
    }

    @AfterEach
    void tearDown() {
        hub.shutdown();
        scheduler.dispose();
    }

    private List<ServerSentEvent<String>> connect(String connectionId, Long displayId) {
        List<ServerSentEvent<String>> received = new ArrayList<>();
        hub.register(connectionId, displayId).subscribe(received::add);
        return received;
    }

    private static List<String> names(List<ServerSentEvent<String>> events) {
        return events.stream().map(ServerSentEvent::event).toList();
    }

    @Test
    void firstEventIsConnected() {
        StepVerifier.create(hub.register("c1", 10L))
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo("connected");
                    assertThat(event.data()).contains("\"clientId\":\"c1\"", "\"displayId\":10", "\"timestamp\"");
                })
                .thenCancel()
                .verify();

        assertThat(hub.getConnectionCount()).isZero();
    }

    @Test
    void broadcastCountsSuccessesAndDropsDeadConnections() {
        List<ServerSentEvent<String>> first = connect("c1", null);
        List<ServerSentEvent<String>> second = connect("c2", 10L);
        hub.register("c3", null);
        hub.getConnection("c3").orElseThrow().getSink().tryEmitComplete();

        DeliveryResult result = hub.broadcast("content.changed", Map.of("contentId", 5L));

        assertThat(result).isEqualTo(new DeliveryResult(2, 1));
        assertThat(hub.getConnection("c3")).isEmpty();
        assertThat(hub.getConnectionCount()).isEqualTo(2);
        assertThat(names(first)).containsExactly("connected", "content.changed");
        assertThat(names(second)).containsExactly("connected", "content.changed");
        assertThat(first.get(1).data()).contains("\"contentId\":5", "\"timestamp\"");
    }

    @Test
    void castToDisplayReachesOnlyThatDisplaysConnections() {
        List<ServerSentEvent<String>> target = connect("c1", 10L);
        List<ServerSentEvent<String>> otherDisplay = connect("c2", 11L);
        List<ServerSentEvent<String>> unscoped = connect("c3", null);

        DeliveryResult result = hub.castToDisplay(10L, "content.update", Map.of("displayId", 10L, "contentId", 7L));

        assertThat(result).isEqualTo(new DeliveryResult(1, 0));
        assertThat(names(target)).containsExactly("connected", "content.update");
        assertThat(names(otherDisplay)).containsExactly("connected");
        assertThat(names(unscoped)).containsExactly("connected");
    }

    @Test
    void castToDisplayWithoutConnectionsIsANoOp() {
        connect("c1", 11L);

        assertThat(hub.castToDisplay(10L, "content.update", Map.of())).isEqualTo(DeliveryResult.NONE);
    }

    @Test
    void keepaliveReachesEveryConnection() {
        List<ServerSentEvent<String>> first = connect("c1", 10L);
        List<ServerSentEvent<String>> second = connect("c2", null);

        scheduler.advanceTimeBy(Duration.ofSeconds(29));
        assertThat(names(first)).containsExactly("connected");

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertThat(names(first)).containsExactly("connected", "heartbeat");
        assertThat(names(second)).containsExactly("connected", "heartbeat");

        scheduler.advanceTimeBy(Duration.ofSeconds(60));
        assertThat(names(first)).containsExactly("connected", "heartbeat", "heartbeat", "heartbeat");
    }

    @Test
    void sendTargetsOneConnection() {
        List<ServerSentEvent<String>> first = connect("c1", null);
        List<ServerSentEvent<String>> second = connect("c2", null);

        assertThat(hub.send("c1", "settings.changed", Map.of("key", "theme"))).isTrue();
        assertThat(hub.send("missing", "settings.changed", Map.of())).isFalse();

        assertThat(names(first)).containsExactly("connected", "settings.changed");
        assertThat(names(second)).containsExactly("connected");
    }

    @Test
    void clientThatStopsReadingIsDroppedOnceItsBufferIsFull() {
        hub.register("slow", null);

        boolean delivered = true;
        int attempts = 0;
        while (delivered && attempts < 10_000) {
            delivered = hub.send("slow", "content.changed", Map.of("n", attempts));
            attempts++;
        }

        assertThat(delivered).isFalse();
        assertThat(hub.getConnection("slow")).isEmpty();
    }

    @Test
    void deregisterCompletesTheStreamAndIsIdempotent() {
        StepVerifier.create(hub.register("c1", null))
                .expectNextMatches(event -> "connected".equals(event.event()))
                .then(() -> assertThat(hub.deregister("c1")).isTrue())
                .verifyComplete();

        assertThat(hub.deregister("c1")).isFalse();
        assertThat(hub.getConnectionCount()).isZero();
    }

    @Test
    void reRegisteringAnIdReplacesThePreviousStream() {
        StepVerifier.create(hub.register("c1", 10L))
                .expectNextMatches(event -> "connected".equals(event.event()))
                .then(() -> hub.register("c1", 10L))
                .verifyComplete();

        assertThat(hub.getConnectionCount()).isEqualTo(1);
        assertThat(hub.getConnection("c1")).isPresent();
    }

    @Test
    void statsSplitDisplayAndGeneralConnections() {
        connect("c1", 10L);
        connect("c2", 11L);
        connect("c3", null);

        HubStats stats = hub.getStats();

        assertThat(stats.getTotalConnections()).isEqualTo(3);
        assertThat(stats.getDisplayConnections()).isEqualTo(2);
        assertThat(stats.getGeneralConnections()).isEqualTo(1);
        assertThat(stats.getConnections()).extracting(HubStats.ConnectionInfo::getConnectionId)
                .containsExactlyInAnyOrder("c1", "c2", "c3");
    }

    @Test
    void shutdownNotifiesAndClosesEveryConnection() {
        List<ServerSentEvent<String>> first = connect("c1", 10L);

        hub.shutdown();

        assertThat(names(first)).containsExactly("connected", "server.shutdown");
        assertThat(hub.getConnectionCount()).isZero();
    }
}
