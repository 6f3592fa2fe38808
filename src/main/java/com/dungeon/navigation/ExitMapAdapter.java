package com.dungeon.navigation;

import com.dungeon.model.Direction;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Direction-keyed view of a node's visible exits for callers that predate
 * free-form labels. Synthetic passages have no direction and are left out.
 */
@Component
public class ExitMapAdapter {

    public Map<Direction, String> toExitMap(GraphNode node, Set<String> revealedEdgeIds) {
        Map<Direction, String> exits = new EnumMap<>(Direction.class);
        for (Edge edge : node.visibleEdges(revealedEdgeIds)) {
            Direction.fromLabel(edge.getLabel())
                    .filter(d -> d.label().equalsIgnoreCase(edge.getLabel()))
                    .ifPresent(d -> exits.putIfAbsent(d, edge.getTargetId()));
        }
        return exits;
    }
}
