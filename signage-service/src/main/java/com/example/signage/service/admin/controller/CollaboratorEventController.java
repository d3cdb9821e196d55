package com.example.signage.service.admin.controller;

import com.example.signage.service.admin.dto.ContentEventRequest;
import com.example.signage.service.admin.dto.SettingsChangeRequest;
import com.example.signage.service.admin.dto.StatusChangeRequest;
import com.example.signage.service.admin.service.CollaboratorEventRelay;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Entry point for the content library and settings store to announce their changes.
 */
@RestController
@RequestMapping("/api/admin/events")
@RequiredArgsConstructor
public class CollaboratorEventController {

    private final CollaboratorEventRelay relay;

    @PostMapping("/content/{action}")
    public ResponseEntity<Map<String, Object>> contentChanged(@PathVariable String action,
                                                              @Valid @RequestBody ContentEventRequest request) {
        int handled = relay.contentChanged(action, request.getContentId());
        return ResponseEntity.accepted().body(Map.of("handlers", handled));
    }

    @PostMapping("/settings")
    public ResponseEntity<Map<String, Object>> settingsUpdated(@Valid @RequestBody SettingsChangeRequest request) {
        int handled = relay.settingsUpdated(request.getKey(), request.getValue());
        return ResponseEntity.accepted().body(Map.of("handlers", handled));
    }

    @PostMapping("/settings/fpcon")
    public ResponseEntity<Map<String, Object>> fpconChanged(@Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.accepted().body(Map.of("handlers", relay.fpconChanged(request.getStatus())));
    }

    @PostMapping("/settings/lan")
    public ResponseEntity<Map<String, Object>> lanChanged(@Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.accepted().body(Map.of("handlers", relay.lanChanged(request.getStatus())));
    }
}
