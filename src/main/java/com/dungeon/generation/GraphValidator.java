package com.dungeon.generation;

import com.dungeon.model.DirectionLabels;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import com.dungeon.model.NodeType;
import com.dungeon.model.RegionGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural quality gate run on every generated region. All failing checks are
 * reported together.
 */
@Component
public class GraphValidator {

    static final double TARGET_AVERAGE_DEGREE = 3.0;
    static final int MIN_FRONTIERS = 2;

    public ValidationResult validate(RegionGraph graph) {
        return validate(graph, MIN_FRONTIERS);
    }

    /**
     * @param minFrontiers frontier nodes the region must offer, never fewer than {@link #MIN_FRONTIERS}
     */
    public ValidationResult validate(RegionGraph graph, int minFrontiers) {
        List<String> reasons = new ArrayList<>();
        if (graph.size() == 0) {
            reasons.add("Region has no nodes");
            return new ValidationResult(reasons);
        }

        checkEdges(graph, reasons);
        checkConnectivity(graph, reasons);
        checkLoops(graph, reasons);
        checkDegree(graph, reasons);
        checkRoles(graph, Math.max(MIN_FRONTIERS, minFrontiers), reasons);
        return new ValidationResult(reasons);
    }

    private void checkEdges(RegionGraph graph, List<String> reasons) {
        for (GraphNode node : graph.getNodes()) {
            if (node.degree() == 0) {
                reasons.add("Node " + node.getId() + " has no edges");
            }
            Set<String> labels = new HashSet<>();
            for (Edge edge : node.getEdges()) {
                if (!labels.add(edge.getLabel().toLowerCase(Locale.ROOT))) {
                    reasons.add("Node " + node.getId() + " has duplicate label '" + edge.getLabel() + "'");
                }
                Optional<GraphNode> target = graph.node(edge.getTargetId());
                if (target.isEmpty()) {
                    reasons.add("Edge " + edge.edgeId(node.getId()) + " points to an unknown node");
                    continue;
                }
                Optional<Edge> reverse = target.get().findEdgeTo(node.getId());
                if (reverse.isEmpty()) {
                    reasons.add("Edge " + edge.edgeId(node.getId()) + " has no reverse edge");
                } else if (!DirectionLabels.areOpposites(edge.getLabel(), reverse.get().getLabel())) {
                    reasons.add("Edge " + edge.edgeId(node.getId()) + " labeled '" + edge.getLabel()
                            + "' has reverse label '" + reverse.get().getLabel() + "'");
                }
            }
        }
    }

    private void checkConnectivity(RegionGraph graph, List<String> reasons) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        String entry = graph.entry().getId();
        visited.add(entry);
        queue.add(entry);
        while (!queue.isEmpty()) {
            graph.node(queue.poll()).ifPresent(node -> node.getEdges().forEach(edge -> {
                if (visited.add(edge.getTargetId())) {
                    queue.add(edge.getTargetId());
                }
            }));
        }
        long unreachable = graph.getNodes().stream().filter(n -> !visited.contains(n.getId())).count();
        if (unreachable > 0) {
            reasons.add(unreachable + " node(s) unreachable from entry " + entry);
        }
    }

    /**
     * Undirected cycle search: a visited neighbor other than the parent closes a loop.
     */
    private void checkLoops(RegionGraph graph, List<String> reasons) {
        if (graph.size() < 3) {
            return;
        }
        Map<String, String> parent = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        for (GraphNode start : graph.getNodes()) {
            if (parent.containsKey(start.getId())) {
                continue;
            }
            parent.put(start.getId(), null);
            stack.push(start.getId());
            while (!stack.isEmpty()) {
                String current = stack.pop();
                Optional<GraphNode> node = graph.node(current);
                if (node.isEmpty()) {
                    continue;
                }
                for (Edge edge : node.get().getEdges()) {
                    String next = edge.getTargetId();
                    if (!parent.containsKey(next)) {
                        parent.put(next, current);
                        stack.push(next);
                    } else if (!next.equals(parent.get(current)) && !current.equals(parent.get(next))) {
                        return;
                    }
                }
            }
        }
        reasons.add("Region has no loops");
    }

    private void checkDegree(RegionGraph graph, List<String> reasons) {
        double required = Math.min(TARGET_AVERAGE_DEGREE, graph.size() - 1);
        if (graph.averageDegree() < required) {
            reasons.add(String.format(Locale.ROOT, "Average degree %.2f is below %.2f", graph.averageDegree(), required));
        }
    }

    private void checkRoles(RegionGraph graph, int minFrontiers, List<String> reasons) {
        int hubs = graph.nodesOfType(NodeType.HUB).size();
        if (hubs != 1) {
            reasons.add("Expected exactly one hub, found " + hubs);
        }
        int bosses = graph.nodesOfType(NodeType.BOSS).size();
        if (bosses > 1) {
            reasons.add("Expected at most one boss, found " + bosses);
        }
        int frontiers = graph.nodesOfType(NodeType.FRONTIER).size();
        if (frontiers < minFrontiers) {
            reasons.add("Expected at least " + minFrontiers + " frontier nodes, found " + frontiers);
        }
    }
}
