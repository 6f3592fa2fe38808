package com.dungeon.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A navigable location in a region together with its outgoing edges.
 */
@Value
@Builder(toBuilder = true)
public class GraphNode {

    /** Tolerance for matching a requested compass direction to an edge bearing. */
    public static final double GEOMETRIC_TOLERANCE = Math.PI / 4;

    String id;

    @Builder.Default
    Position position = Position.none();

    NodeType type;
    String regionId;

    @Builder.Default
    List<Edge> edges = List.of();

    public int degree() {
        return edges.size();
    }

    /**
     * Case-insensitive label lookup.
     */
    public Optional<Edge> findEdge(String label) {
        return edges.stream().filter(e -> e.hasLabel(label)).findFirst();
    }

    public Optional<Edge> findEdgeTo(String targetId) {
        return edges.stream().filter(e -> e.getTargetId().equals(targetId)).findFirst();
    }

    /**
     * Edge whose bearing lies closest to {@code direction}, accepted only when the
     * difference is under 45 degrees. Nodes without coordinates never match.
     */
    public Optional<Edge> findEdgeGeometric(Direction direction) {
        if (!position.isPlaced() || !direction.isCompass()) {
            return Optional.empty();
        }
        return edges.stream()
                .filter(e -> e.getBearing() != null)
                .min(Comparator.comparingDouble(e -> Direction.angularDistance(e.getBearing(), direction.bearing())))
                .filter(e -> Direction.angularDistance(e.getBearing(), direction.bearing()) < GEOMETRIC_TOLERANCE);
    }

    public boolean isVisible(Edge edge, Set<String> revealedEdgeIds) {
        return !edge.isHidden() || revealedEdgeIds.contains(edge.edgeId(id));
    }

    /** Edges that are not hidden or have been revealed. */
    public List<Edge> visibleEdges(Set<String> revealedEdgeIds) {
        return edges.stream().filter(e -> isVisible(e, revealedEdgeIds)).toList();
    }
}
