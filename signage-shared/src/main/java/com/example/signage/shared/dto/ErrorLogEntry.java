package com.example.signage.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One entry of a display's bounded error ring, stored newest first as JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorLogEntry {
    private String severity;
    private String message;
    private OffsetDateTime timestamp;
}
