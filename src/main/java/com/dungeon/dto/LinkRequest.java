package com.dungeon.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for linking a frontier node of one region to another region.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LinkRequest {

    @NotBlank(message = "Source node is required")
    private String sourceNodeId;

    @NotBlank(message = "Target region is required")
    private String targetRegionId;
}
