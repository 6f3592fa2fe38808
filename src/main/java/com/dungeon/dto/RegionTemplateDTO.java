package com.dungeon.dto;

import com.dungeon.config.RegionTemplate;
import com.dungeon.layout.LayoutType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for exposing available region templates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegionTemplateDTO {

    private String id;
    private String name;
    private String description;
    private String theme;
    private int difficulty;
    private LayoutType layoutType;

    public static RegionTemplateDTO fromTemplate(RegionTemplate template) {
        return RegionTemplateDTO.builder()
                .id(template.id())
                .name(template.name())
                .description(template.description())
                .theme(template.theme())
                .difficulty(template.difficulty())
                .layoutType(template.resolveLayout().type())
                .build();
    }
}
