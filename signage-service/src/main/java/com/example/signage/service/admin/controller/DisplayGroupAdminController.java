package com.example.signage.service.admin.controller;

import com.example.signage.service.admin.dto.DisplayGroupRequest;
import com.example.signage.service.admin.dto.DisplayGroupResponse;
import com.example.signage.service.admin.service.DisplayGroupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/display-groups")
@RequiredArgsConstructor
@Slf4j
public class DisplayGroupAdminController {

    private final DisplayGroupService displayGroupService;

    @PostMapping
    public ResponseEntity<DisplayGroupResponse> createGroup(@Valid @RequestBody DisplayGroupRequest request) {
        log.info("Creating display group '{}'", request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(displayGroupService.createGroup(request));
    }

    @GetMapping
    public ResponseEntity<List<DisplayGroupResponse>> getGroups() {
        return ResponseEntity.ok(displayGroupService.getGroups());
    }

    @GetMapping("/{id}")
    public ResponseEntity<DisplayGroupResponse> getGroup(@PathVariable Long id) {
        return ResponseEntity.ok(displayGroupService.getGroup(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<DisplayGroupResponse> updateGroup(@PathVariable Long id,
                                                            @Valid @RequestBody DisplayGroupRequest request) {
        log.info("Updating display group {}", id);
        return ResponseEntity.ok(displayGroupService.updateGroup(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteGroup(@PathVariable Long id) {
        log.info("Deleting display group {}", id);
        displayGroupService.deleteGroup(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/displays/{displayId}")
    public ResponseEntity<DisplayGroupResponse> addMember(@PathVariable Long id, @PathVariable Long displayId) {
        log.info("Adding display {} to group {}", displayId, id);
        return ResponseEntity.ok(displayGroupService.addMember(id, displayId));
    }

    @DeleteMapping("/{id}/displays/{displayId}")
    public ResponseEntity<DisplayGroupResponse> removeMember(@PathVariable Long id, @PathVariable Long displayId) {
        log.info("Removing display {} from group {}", displayId, id);
        return ResponseEntity.ok(displayGroupService.removeMember(id, displayId));
    }
}
