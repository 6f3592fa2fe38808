package com.dungeon.generation;

import com.dungeon.exception.GraphGenerationException;
import com.dungeon.layout.LayoutNode;
import com.dungeon.model.Direction;
import com.dungeon.model.DirectionLabels;
import com.dungeon.model.Edge;
import com.dungeon.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns undirected edges into pairs of labeled directed edges.
 * <p>
 * Each undirected edge is handled exactly once: a label and its canonical
 * opposite are chosen together and committed only when both are free on their
 * respective nodes. Candidate order is the nearest compass bucket, the second
 * nearest bucket, then {@code up}/{@code down}. When nothing fits, a synthetic
 * {@code passage-N}/{@code passage-back-N} pair is used. Nodes without
 * coordinates skip the compass candidates.
 */
@Component
@Slf4j
public class DirectionAssigner {

    private static final List<Direction> VERTICAL = List.of(Direction.UP, Direction.DOWN);
    private static final int COMPASS_CANDIDATES = 2;

    /**
     * @return outgoing edges keyed by node id, in node order
     * @throws GraphGenerationException if the result violates the opposite-label invariant
     */
    public Map<String, List<Edge>> assign(List<LayoutNode> nodes, List<UndirectedEdge> edges) {
        int n = nodes.size();
        List<Set<String>> usedLabels = new ArrayList<>(n);
        List<List<Edge>> outgoing = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            usedLabels.add(new HashSet<>());
            outgoing.add(new ArrayList<>());
        }

        int syntheticCounter = 1;
        for (UndirectedEdge edge : edges) {
            LayoutNode source = nodes.get(edge.from());
            LayoutNode target = nodes.get(edge.to());
            Double bearing = bearing(source.position(), target.position());

            Optional<Direction> choice = candidates(bearing).stream()
                    .filter(d -> !usedLabels.get(edge.from()).contains(d.label())
                            && !usedLabels.get(edge.to()).contains(d.opposite().label()))
                    .findFirst();

            String forwardLabel;
            String reverseLabel;
            if (choice.isPresent()) {
                forwardLabel = choice.get().label();
                reverseLabel = choice.get().opposite().label();
            } else {
                forwardLabel = DirectionLabels.passage(syntheticCounter);
                reverseLabel = DirectionLabels.passageBack(syntheticCounter);
                syntheticCounter++;
            }

            usedLabels.get(edge.from()).add(forwardLabel);
            usedLabels.get(edge.to()).add(reverseLabel);
            outgoing.get(edge.from()).add(Edge.builder()
                    .targetId(target.id())
                    .label(forwardLabel)
                    .bearing(bearing)
                    .sourcePosition(source.position())
                    .targetPosition(target.position())
                    .build());
            outgoing.get(edge.to()).add(Edge.builder()
                    .targetId(source.id())
                    .label(reverseLabel)
                    .bearing(bearing == null ? null : Direction.normalize(bearing + Math.PI))
                    .sourcePosition(target.position())
                    .targetPosition(source.position())
                    .build());
        }

        Map<String, List<Edge>> result = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            result.put(nodes.get(i).id(), List.copyOf(outgoing.get(i)));
        }

        List<String> issues = verify(result);
        if (!issues.isEmpty()) {
            throw new GraphGenerationException("Direction assignment is inconsistent", issues);
        }
        log.debug("Assigned directions to {} edge pairs ({} synthetic)", edges.size(), syntheticCounter - 1);
        return result;
    }

    private List<Direction> candidates(Double bearing) {
        if (bearing == null) {
            return VERTICAL;
        }
        List<Direction> candidates = new ArrayList<>(Direction.byProximity(bearing).subList(0, COMPASS_CANDIDATES));
        candidates.addAll(VERTICAL);
        return candidates;
    }

    private Double bearing(Position from, Position to) {
        if (from instanceof Position.Coordinates a && to instanceof Position.Coordinates b && !a.equals(b)) {
            return a.bearingTo(b);
        }
        return null;
    }

    /**
     * Every edge needs a reverse edge carrying the opposite label, and labels
     * must be unique per node.
     */
    List<String> verify(Map<String, List<Edge>> outgoing) {
        List<String> issues = new ArrayList<>();
        outgoing.forEach((nodeId, edges) -> {
            Set<String> seen = new HashSet<>();
            for (Edge edge : edges) {
                if (!seen.add(edge.getLabel().toLowerCase(Locale.ROOT))) {
                    issues.add("Duplicate label '" + edge.getLabel() + "' on " + nodeId);
                }
                List<Edge> targetEdges = outgoing.get(edge.getTargetId());
                Optional<Edge> reverse = targetEdges == null ? Optional.empty() : targetEdges.stream()
                        .filter(e -> e.getTargetId().equals(nodeId))
                        .findFirst();
                if (reverse.isEmpty()) {
                    issues.add("Missing reverse edge for " + edge.edgeId(nodeId));
                } else if (!DirectionLabels.areOpposites(edge.getLabel(), reverse.get().getLabel())) {
                    issues.add("Direction mismatch on " + edge.edgeId(nodeId) + ": '" + edge.getLabel()
                            + "' is not the opposite of '" + reverse.get().getLabel() + "'");
                }
            }
        });
        return issues;
    }
}
