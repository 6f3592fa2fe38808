package com.dungeon.dto;

import com.dungeon.config.LayoutDefinition;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for generating a region, either from a template or from a theme and optional layout.
 * Explicit fields override the template's values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GenerateRegionRequest {

    @Size(max = 60, message = "Region name must be at most 60 characters")
    private String name;

    private String templateId;

    @Size(max = 30, message = "Theme must be at most 30 characters")
    private String theme;

    @Min(value = 0, message = "Difficulty must be at least 0")
    @Max(value = 10, message = "Difficulty must be at most 10")
    private Integer difficulty;

    private Long seed;

    private String lore;

    private LayoutDefinition layout;

    public boolean hasTemplate() {
        return templateId != null && !templateId.isBlank();
    }
}
