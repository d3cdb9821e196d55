package com.example.signage.service.admin.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentEventRequest {

    @NotNull(message = "contentId is required")
    private Long contentId;
}
