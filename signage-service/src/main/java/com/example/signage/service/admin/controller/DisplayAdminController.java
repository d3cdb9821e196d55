package com.example.signage.service.admin.controller;

import com.example.signage.service.admin.dto.DisplayRequest;
import com.example.signage.service.admin.dto.DisplayResponse;
import com.example.signage.service.admin.dto.DisplayStatsResponse;
import com.example.signage.service.admin.service.DisplayAdminService;
import com.example.signage.service.health.DisplayHealthService;
import com.example.signage.service.health.dto.DebugToggleRequest;
import com.example.signage.service.health.dto.DisplayHealthResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/displays")
@RequiredArgsConstructor
@Slf4j
public class DisplayAdminController {

    private final DisplayAdminService displayAdminService;
    private final DisplayHealthService displayHealthService;

    @PostMapping
    public ResponseEntity<DisplayResponse> createDisplay(@Valid @RequestBody DisplayRequest request) {
        log.info("Registering display '{}' at '{}'", request.getName(), request.getLocation());
        return ResponseEntity.status(HttpStatus.CREATED).body(displayAdminService.createDisplay(request));
    }

    @GetMapping
    public ResponseEntity<List<DisplayResponse>> getDisplays() {
        return ResponseEntity.ok(displayAdminService.getDisplays());
    }

    @GetMapping("/stats")
    public ResponseEntity<DisplayStatsResponse> getStats() {
        return ResponseEntity.ok(displayAdminService.getStats());
    }

    @GetMapping("/{id}")
    public ResponseEntity<DisplayResponse> getDisplay(@PathVariable Long id) {
        return ResponseEntity.ok(displayAdminService.getDisplay(id));
    }

    @GetMapping("/{id}/health")
    public ResponseEntity<DisplayHealthResponse> getHealth(@PathVariable Long id) {
        return ResponseEntity.ok(displayHealthService.getHealth(id));
    }

    @PostMapping("/{id}/debug")
    public ResponseEntity<DisplayHealthResponse> toggleDebug(@PathVariable Long id,
                                                             @Valid @RequestBody DebugToggleRequest request) {
        log.info("Admin setting debug overlay for display {} to {}", id, request.getEnabled());
        displayHealthService.setDebug(id, request.getEnabled());
        return ResponseEntity.ok(displayHealthService.getHealth(id));
    }
}
