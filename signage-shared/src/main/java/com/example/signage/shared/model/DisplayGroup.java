package com.example.signage.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * Named set of displays. Members live in {@code display_group_members} and are
 * always read through {@code DisplayGroupRepository} queries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@With
@Table("display_groups")
public class DisplayGroup {
    @Id
    private Long id;
    private String name;
    private String description;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
