package com.dungeon.service;

import com.dungeon.model.Condition;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import com.dungeon.model.GraphNodeEntity;
import com.dungeon.model.NodeType;
import com.dungeon.model.Position;
import tools.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GraphNodeMapper with a real ObjectMapper.
 */
class GraphNodeMapperTest {

    private final GraphNodeMapper mapper = new GraphNodeMapper(new ObjectMapper());

    @Test
    @DisplayName("a placed node survives storage with its conditions and geometry")
    void shouldPreservePlacedNode() {
        Position here = Position.of(2, 3);
        GraphNode node = GraphNode.builder()
                .id("r:grid_2_3")
                .position(here)
                .type(NodeType.BRANCHING)
                .regionId("r")
                .edges(List.of(
                        Edge.builder().targetId("r:grid_3_3").label("east").bearing(0.0)
                                .sourcePosition(here).targetPosition(Position.of(3, 3))
                                .conditions(List.of(new Condition.ItemRequired("lantern")))
                                .build()
                                .hiddenBehind(Condition.perception(22)),
                        Edge.builder().targetId("other:flood_4").label("passage-1")
                                .sourcePosition(here)
                                .build()))
                .build();

        GraphNodeEntity entity = mapper.toEntity(node, 7);
        GraphNode restored = mapper.toNode(entity);

        assertEquals(7, entity.getOrdinal());
        assertEquals(2, entity.getX());
        assertEquals(3, entity.getY());
        assertEquals(node, restored);
    }

    @Test
    @DisplayName("a node without coordinates is stored without them")
    void shouldStoreAbstractNode() {
        GraphNode node = GraphNode.builder()
                .id("void:0")
                .type(NodeType.HUB)
                .regionId("void")
                .edges(List.of(Edge.builder().targetId("void:1").label("down").build()))
                .build();

        GraphNodeEntity entity = mapper.toEntity(node, 0);

        assertNull(entity.getX());
        assertNull(entity.getY());
        assertEquals(node, mapper.toNode(entity));
    }

    @Test
    @DisplayName("an unknown stored condition kind is rejected")
    void shouldRejectUnknownConditionKind() {
        String json = "[{\"targetId\":\"b\",\"label\":\"up\",\"hidden\":false,\"conditions\":[{\"kind\":\"spell\"}]}]";

        assertThrows(IllegalStateException.class, () -> mapper.readEdges(json, Position.none()));
    }

    @Test
    @DisplayName("missing optional fields read as absent")
    void shouldReadMinimalEdges() {
        List<Edge> edges = mapper.readEdges("[{\"targetId\":\"b\",\"label\":\"up\",\"hidden\":false}]", Position.of(0, 0));

        assertEquals(1, edges.size());
        assertTrue(edges.get(0).getConditions().isEmpty());
        assertNull(edges.get(0).getBearing());
        assertEquals(Position.of(0, 0), edges.get(0).getSourcePosition());
        assertEquals(Position.none(), edges.get(0).getTargetPosition());
    }
}
