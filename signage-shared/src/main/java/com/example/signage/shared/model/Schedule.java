package com.example.signage.shared.model;

import com.example.signage.shared.util.Constants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * A time-windowed, prioritized assignment of content to a display or a display group.
 * Exactly one of {@code displayId}/{@code displayGroupId} is set, and exactly one of
 * {@code contentId}/{@code contentIds}/{@code playlistId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@With
@Table("schedules")
public class Schedule {
    @Id
    private Long id;
    private Long displayId;
    private Long displayGroupId;
    private Long contentId;
    // JSON array of content ids, in play order
    private String contentIds;
    private Long playlistId;
    private OffsetDateTime startTime;
    private OffsetDateTime endTime;
    private String recurrenceRule;
    @Builder.Default
    private int priority = 0;
    @Column("is_active")
    @Builder.Default
    private boolean active = true;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    @Transient
    public Constants.TargetType getTargetType() {
        return displayGroupId != null ? Constants.TargetType.GROUP : Constants.TargetType.DISPLAY;
    }

    @Transient
    public Constants.PayloadType getPayloadType() {
        if (playlistId != null) {
            return Constants.PayloadType.PLAYLIST;
        }
        return contentIds != null ? Constants.PayloadType.CONTENT_LIST : Constants.PayloadType.CONTENT;
    }

    @Transient
    public boolean isRecurring() {
        return recurrenceRule != null && !recurrenceRule.isBlank();
    }

    /**
     * Whether the window has closed by {@code now}. An open-ended schedule never expires.
     */
    public boolean isExpiredAt(OffsetDateTime now) {
        return endTime != null && endTime.isBefore(now);
    }
}
