package com.example.signage.service.admin.dto;

import com.example.signage.shared.util.Constants;
import com.fasterxml.jackson.annotation.JsonProperty;
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
public class ScheduleResponse {
    private Long id;
    private Constants.TargetType targetType;
    private Long displayId;
    private String displayName;
    private Long displayGroupId;
    private String displayGroupName;
    private List<Long> groupMemberIds;
    private Constants.PayloadType payloadType;
    private Long contentId;
    private List<Long> contentIds;
    private Long playlistId;
    private OffsetDateTime startTime;
    private OffsetDateTime endTime;
    private String recurrenceRule;
    private int priority;
    @JsonProperty("isActive")
    private boolean active;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
