package com.example.signage.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@With
@Table("displays")
public class Display {
    @Id
    private Long id;
    private String name;
    private String location;
    private String status;
    private OffsetDateTime lastSeen;
    private OffsetDateTime lastOnlineAt;
    private OffsetDateTime lastOfflineAt;
    @Builder.Default
    private long totalHeartbeats = 0;
    @Builder.Default
    private long missedHeartbeats = 0;
    @Builder.Default
    private double uptimePercentage = 100.0;
    // JSON array of ErrorLogEntry, newest first
    private String errorLog;
    // Opaque JSON object reported with heartbeats
    private String performanceMetrics;
    @Builder.Default
    private boolean debugEnabled = false;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
