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
public class DisplayGroupResponse {
    private Long id;
    private String name;
    private String description;
    private List<Long> displayIds;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
