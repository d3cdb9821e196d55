package com.example.signage.service.health.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatResponse {
    private Long displayId;
    private String status;
    private boolean debugEnabled;
    private OffsetDateTime lastSeen;
}
