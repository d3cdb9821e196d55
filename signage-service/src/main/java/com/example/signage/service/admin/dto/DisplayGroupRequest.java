package com.example.signage.service.admin.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisplayGroupRequest {

    @NotBlank(message = "Group name is required")
    @Size(max = 255, message = "Group name must be at most 255 characters")
    private String name;

    @Size(max = 1024, message = "Description must be at most 1024 characters")
    private String description;

    // Null keeps the current members on update; an empty list removes them all
    private List<Long> displayIds;
}
