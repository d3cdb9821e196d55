package com.example.signage.service.admin.controller;

import com.example.signage.service.admin.dto.CurrentContentResponse;
import com.example.signage.service.admin.dto.ScheduleRequest;
import com.example.signage.service.admin.dto.ScheduleResponse;
import com.example.signage.service.admin.dto.ScheduleStatsResponse;
import com.example.signage.service.admin.dto.ScheduleUpdateRequest;
import com.example.signage.service.admin.service.ScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/schedules")
@RequiredArgsConstructor
@Slf4j
public class ScheduleAdminController {

    private final ScheduleService scheduleService;

    @PostMapping
    public ResponseEntity<ScheduleResponse> createSchedule(@Valid @RequestBody ScheduleRequest request) {
        log.info("Received schedule creation request, display={}, group={}", request.getDisplayId(), request.getDisplayGroupId());
        ScheduleResponse response = scheduleService.createSchedule(request);
        log.info("Schedule created successfully with ID: {}", response.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<ScheduleResponse>> getSchedules(@RequestParam(required = false) Long displayId) {
        log.info("Admin retrieving schedules, displayId filter: {}", displayId);
        return ResponseEntity.ok(scheduleService.getSchedules(displayId));
    }

    @GetMapping("/stats")
    public ResponseEntity<ScheduleStatsResponse> getStats() {
        return ResponseEntity.ok(scheduleService.getStats());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScheduleResponse> getSchedule(@PathVariable Long id) {
        log.info("Admin retrieving schedule with ID: {}", id);
        return ResponseEntity.ok(scheduleService.getSchedule(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ScheduleResponse> updateSchedule(@PathVariable Long id,
                                                           @Valid @RequestBody ScheduleUpdateRequest request) {
        log.info("Admin updating schedule with ID: {}", id);
        return ResponseEntity.ok(scheduleService.updateSchedule(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSchedule(@PathVariable Long id) {
        log.info("Admin deleting schedule with ID: {}", id);
        scheduleService.deleteSchedule(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/display/{displayId}/active")
    public ResponseEntity<List<ScheduleResponse>> getActiveForDisplay(@PathVariable Long displayId) {
        return ResponseEntity.ok(scheduleService.getActiveForDisplay(displayId));
    }

    @GetMapping("/display/{displayId}/current")
    public ResponseEntity<CurrentContentResponse> getCurrentForDisplay(@PathVariable Long displayId) {
        return ResponseEntity.ok(scheduleService.getCurrentForDisplay(displayId));
    }
}
