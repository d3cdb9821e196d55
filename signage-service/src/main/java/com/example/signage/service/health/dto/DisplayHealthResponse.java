package com.example.signage.service.health.dto;

import com.example.signage.shared.dto.ErrorLogEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisplayHealthResponse {
    private Long displayId;
    private String name;
    private String status;
    private OffsetDateTime lastSeen;
    private OffsetDateTime lastOnlineAt;
    private OffsetDateTime lastOfflineAt;
    private long totalHeartbeats;
    private long missedHeartbeats;
    private double uptimePercentage;
    private int healthScore;
    private List<ErrorLogEntry> recentErrors;
    private Map<String, Object> performanceMetrics;
    private boolean debugEnabled;
}
