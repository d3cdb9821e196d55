package com.example.signage.service.health;

import com.example.signage.service.admin.dto.CurrentContentResponse;
import com.example.signage.service.admin.dto.ScheduleResponse;
import com.example.signage.service.admin.service.ScheduleService;
import com.example.signage.service.health.dto.ErrorReportRequest;
import com.example.signage.service.health.dto.HeartbeatResponse;
import com.example.signage.shared.dto.ErrorLogEntry;
import com.example.signage.shared.model.Display;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Endpoints called by the displays themselves.
 */
@RestController
@RequestMapping("/api/displays/{displayId}")
@RequiredArgsConstructor
@Slf4j
public class DisplayController {

    private final DisplayHealthService displayHealthService;
    private final ScheduleService scheduleService;

    /**
     * The body, when present, is the display's performance metrics as a JSON object.
     * It is read as text so that a malformed body never rejects the heartbeat.
     */
    @PostMapping("/heartbeat")
    public ResponseEntity<HeartbeatResponse> heartbeat(@PathVariable Long displayId,
                                                       @RequestBody(required = false) String metrics) {
        log.debug("Heartbeat from display {}", displayId);
        Display display = displayHealthService.heartbeat(displayId, metrics);
        return ResponseEntity.ok(HeartbeatResponse.builder()
                .displayId(display.getId())
                .status(display.getStatus())
                .debugEnabled(display.isDebugEnabled())
                .lastSeen(display.getLastSeen())
                .build());
    }

    @PostMapping("/errors")
    public ResponseEntity<ErrorLogEntry> reportError(@PathVariable Long displayId,
                                                     @Valid @RequestBody ErrorReportRequest request) {
        ErrorLogEntry entry = displayHealthService.logError(displayId, request.getMessage(), request.getSeverity());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping("/content/current")
    public ResponseEntity<CurrentContentResponse> getCurrentContent(@PathVariable Long displayId) {
        return ResponseEntity.ok(scheduleService.getCurrentForDisplay(displayId));
    }

    @GetMapping("/schedules")
    public ResponseEntity<List<ScheduleResponse>> getSchedules(@PathVariable Long displayId) {
        return ResponseEntity.ok(scheduleService.getActiveForDisplay(displayId));
    }
}
