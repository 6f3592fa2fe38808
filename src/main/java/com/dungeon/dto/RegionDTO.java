package com.dungeon.dto;

import com.dungeon.layout.LayoutType;
import com.dungeon.model.RegionEntity;
import com.dungeon.model.RegionGraph;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for a generated region. {@code nodes} is empty in listings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegionDTO {

    private String regionId;
    private String name;
    private String templateId;
    private String theme;
    private int difficulty;
    private long seed;
    private LayoutType layoutType;
    private String entryNodeId;
    private int nodeCount;
    private int edgeCount;
    private double averageDegree;
    private LocalDateTime createdAt;
    private List<NodeDTO> nodes;

    public static RegionDTO fromRegion(RegionEntity region) {
        return RegionDTO.builder()
                .regionId(region.getId())
                .name(region.getName())
                .templateId(region.getTemplateId())
                .theme(region.getTheme())
                .difficulty(region.getDifficulty())
                .seed(region.getSeed())
                .layoutType(region.getLayoutType())
                .entryNodeId(region.getEntryNodeId())
                .nodeCount(region.getNodeCount())
                .createdAt(region.getCreatedAt())
                .nodes(List.of())
                .build();
    }

    public static RegionDTO fromRegion(RegionEntity region, RegionGraph graph) {
        RegionDTO dto = fromRegion(region);
        dto.setEdgeCount(graph.edgeCount());
        dto.setAverageDegree(graph.averageDegree());
        dto.setNodes(graph.getNodes().stream().map(NodeDTO::fromNode).toList());
        return dto;
    }
}
