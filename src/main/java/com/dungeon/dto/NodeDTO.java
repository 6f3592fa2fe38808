package com.dungeon.dto;

import com.dungeon.model.GraphNode;
import com.dungeon.model.NodeType;
import com.dungeon.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for a node with all of its edges, hidden ones included.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NodeDTO {

    private String id;
    private NodeType type;
    private Integer x;
    private Integer y;
    private List<EdgeDTO> edges;
    private String description;

    public static NodeDTO fromNode(GraphNode node) {
        Position.Coordinates at = node.getPosition().coordinates().orElse(null);
        return NodeDTO.builder()
                .id(node.getId())
                .type(node.getType())
                .x(at != null ? at.x() : null)
                .y(at != null ? at.y() : null)
                .edges(node.getEdges().stream().map(EdgeDTO::fromEdge).toList())
                .build();
    }
}
