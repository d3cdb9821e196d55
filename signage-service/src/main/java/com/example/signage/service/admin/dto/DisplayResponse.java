package com.example.signage.service.admin.dto;

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
public class DisplayResponse {
    private Long id;
    private String name;
    private String location;
    private String status;
    private OffsetDateTime lastSeen;
    private double uptimePercentage;
    private boolean debugEnabled;
    private List<Long> groupIds;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
