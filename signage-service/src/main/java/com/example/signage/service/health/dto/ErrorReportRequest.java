package com.example.signage.service.health.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorReportRequest {

    @NotBlank(message = "Error message is required")
    @Size(max = 2000, message = "Error message must be at most 2000 characters")
    private String message;

    @Pattern(regexp = "(?i)LOW|MEDIUM|HIGH", message = "Severity must be one of LOW, MEDIUM, HIGH")
    @Builder.Default
    private String severity = "MEDIUM";
}
