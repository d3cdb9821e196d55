package com.example.signage.service.delivery;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HubStats {
    private int totalConnections;
    private int displayConnections;
    private int generalConnections;
    private List<ConnectionInfo> connections;
    private OffsetDateTime timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectionInfo {
        private String connectionId;
        private Long displayId;
        private OffsetDateTime connectedAt;
        private OffsetDateTime lastHeartbeat;
    }
}
