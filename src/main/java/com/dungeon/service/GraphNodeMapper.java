package com.dungeon.service;

import com.dungeon.model.Condition;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import com.dungeon.model.GraphNodeEntity;
import com.dungeon.model.Position;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.util.Arrays;
import java.util.List;

/**
 * Converts between {@link GraphNode} and its stored form. Edges are written as
 * a JSON array on the node row.
 */
@Component
@RequiredArgsConstructor
public class GraphNodeMapper {

    static final String SKILL = "skill";
    static final String ITEM = "item";

    private final ObjectMapper objectMapper;

    public record ConditionDocument(String kind, String skill, Integer difficulty, String itemTag) {}

    public record EdgeDocument(String targetId, String label, boolean hidden, List<ConditionDocument> conditions,
                               Double bearing, Integer targetX, Integer targetY) {}

    public GraphNodeEntity toEntity(GraphNode node, int ordinal) {
        Position.Coordinates at = node.getPosition().coordinates().orElse(null);
        return GraphNodeEntity.builder()
                .id(node.getId())
                .regionId(node.getRegionId())
                .ordinal(ordinal)
                .x(at != null ? at.x() : null)
                .y(at != null ? at.y() : null)
                .type(node.getType())
                .edgesJson(writeEdges(node.getEdges()))
                .build();
    }

    public GraphNode toNode(GraphNodeEntity entity) {
        Position position = entity.getX() != null && entity.getY() != null
                ? Position.of(entity.getX(), entity.getY())
                : Position.none();
        return GraphNode.builder()
                .id(entity.getId())
                .position(position)
                .type(entity.getType())
                .regionId(entity.getRegionId())
                .edges(readEdges(entity.getEdgesJson(), position))
                .build();
    }

    public String writeEdges(List<Edge> edges) {
        List<EdgeDocument> documents = edges.stream().map(this::toDocument).toList();
        return objectMapper.writeValueAsString(documents);
    }

    public List<Edge> readEdges(String json, Position source) {
        EdgeDocument[] documents = objectMapper.readValue(json, EdgeDocument[].class);
        return Arrays.stream(documents).map(d -> fromDocument(d, source)).toList();
    }

    private EdgeDocument toDocument(Edge edge) {
        Position.Coordinates target = edge.getTargetPosition().coordinates().orElse(null);
        return new EdgeDocument(
                edge.getTargetId(),
                edge.getLabel(),
                edge.isHidden(),
                edge.getConditions().stream().map(this::toDocument).toList(),
                edge.getBearing(),
                target != null ? target.x() : null,
                target != null ? target.y() : null);
    }

    private ConditionDocument toDocument(Condition condition) {
        if (condition instanceof Condition.SkillCheck check) {
            return new ConditionDocument(SKILL, check.skill(), check.difficulty(), null);
        }
        if (condition instanceof Condition.ItemRequired item) {
            return new ConditionDocument(ITEM, null, null, item.itemTag());
        }
        throw new IllegalArgumentException("Unsupported condition: " + condition);
    }

    private Edge fromDocument(EdgeDocument document, Position source) {
        List<ConditionDocument> conditions = document.conditions() != null ? document.conditions() : List.of();
        Position target = document.targetX() != null && document.targetY() != null
                ? Position.of(document.targetX(), document.targetY())
                : Position.none();
        return Edge.builder()
                .targetId(document.targetId())
                .label(document.label())
                .hidden(document.hidden())
                .conditions(conditions.stream().map(this::fromDocument).toList())
                .bearing(document.bearing())
                .sourcePosition(source)
                .targetPosition(target)
                .build();
    }

    private Condition fromDocument(ConditionDocument document) {
        return switch (document.kind()) {
            case SKILL -> new Condition.SkillCheck(document.skill(), document.difficulty());
            case ITEM -> new Condition.ItemRequired(document.itemTag());
            default -> throw new IllegalStateException("Unknown stored condition kind: " + document.kind());
        };
    }
}
