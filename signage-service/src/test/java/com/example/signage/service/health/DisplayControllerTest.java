package com.example.signage.service.health;

import com.example.signage.service.admin.dto.CurrentContentResponse;
import com.example.signage.service.admin.service.ScheduleService;
import com.example.signage.shared.dto.ErrorLogEntry;
import com.example.signage.shared.exception.GlobalExceptionHandler;
import com.example.signage.shared.exception.ResourceNotFoundException;
import com.example.signage.shared.model.Display;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.OffsetDateTime;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DisplayControllerTest {

    @Mock
    private DisplayHealthService displayHealthService;
    @Mock
    private ScheduleService scheduleService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new DisplayController(displayHealthService, scheduleService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static Display online() {
        return Display.builder().id(1L).status("ONLINE").lastSeen(OffsetDateTime.parse("2026-10-19T09:00:00Z")).build();
    }

    @Test
    void heartbeatPassesTheRawBodyThrough() {
        String body = "{\"cpuUsage\": 12}";
        when(displayHealthService.heartbeat(1L, body)).thenReturn(online());

        client.post().uri("/api/displays/1/heartbeat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ONLINE")
                .jsonPath("$.debugEnabled").isEqualTo(false);
    }

    @Test
    void heartbeatWithoutBodyIsAccepted() {
        when(displayHealthService.heartbeat(eq(1L), isNull())).thenReturn(online());

        client.post().uri("/api/displays/1/heartbeat")
                .exchange()
                .expectStatus().isOk();

        verify(displayHealthService).heartbeat(eq(1L), isNull());
    }

    @Test
    void errorReportRejectsUnknownSeverity() {
        client.post().uri("/api/displays/1/errors")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"message\": \"boom\", \"severity\": \"FATAL\"}")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(displayHealthService);
    }

    @Test
    void errorReportAcceptsLowerCaseSeverity() {
        when(displayHealthService.logError(1L, "panel overheating", "high"))
                .thenReturn(new ErrorLogEntry("HIGH", "panel overheating", OffsetDateTime.parse("2026-10-19T09:00:00Z")));

        client.post().uri("/api/displays/1/errors")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"message\": \"panel overheating\", \"severity\": \"high\"}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.severity").isEqualTo("HIGH");
    }

    @Test
    void currentContentReportsTheDefaultFallback() {
        when(scheduleService.getCurrentForDisplay(1L)).thenReturn(CurrentContentResponse.builder()
                .displayId(1L)
                .source(CurrentContentResponse.SOURCE_DEFAULT)
                .build());

        client.get().uri("/api/displays/1/content/current")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.source").isEqualTo("default");
    }

    @Test
    void unknownDisplayIsNotFound() {
        when(scheduleService.getActiveForDisplay(9L)).thenThrow(new ResourceNotFoundException("Display not found with ID: 9"));

        client.get().uri("/api/displays/9/schedules")
                .exchange()
                .expectStatus().isNotFound();
    }
}
