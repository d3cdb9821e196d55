package com.example.signage.shared.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
public class AppProperties {

    private final Sse sse = new Sse();
    private final Scheduling scheduling = new Scheduling();
    private final Health health = new Health();

    @Data
    public static class Sse {
        @Positive
        private long heartbeatInterval = 30000L;
        // Per-connection buffer; a client that falls this far behind is dropped
        @Positive
        private int bufferSize = 256;
    }

    @Data
    public static class Scheduling {
        @NotBlank
        private String zone = "UTC";
        @Positive
        private int poolSize = 10;
        @Positive
        private int failedJobRetention = 100;
    }

    @Data
    public static class Health {
        @Positive
        private long staleThreshold = 300000L;
        @Positive
        private long assumedHeartbeatInterval = 300000L;
        @Positive
        private long sweepInterval = 60000L;
        @Positive
        @Max(1000)
        private int errorLogCapacity = 50;
    }
}
