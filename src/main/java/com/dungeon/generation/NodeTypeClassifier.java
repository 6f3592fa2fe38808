package com.dungeon.generation;

import com.dungeon.config.GenerationSettings;
import com.dungeon.model.Edge;
import com.dungeon.model.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Assigns a structural role to every node: the entry is the hub, the node
 * farthest from it is the boss, low-degree nodes become frontiers and dead
 * ends, and the rest are linear or branching by degree.
 */
@Component
@Slf4j
public class NodeTypeClassifier {

    /** Nodes of at most this degree sit on the region boundary. */
    static final int BOUNDARY_DEGREE = 2;

    /**
     * @param nodeIds node ids in generation order; the first is the entry
     * @return role per node id, in node order
     */
    public Map<String, NodeType> classify(List<String> nodeIds, Map<String, List<Edge>> edges,
                                          GenerationSettings settings, Random random) {
        Map<String, NodeType> types = new LinkedHashMap<>();
        if (nodeIds.isEmpty()) {
            return types;
        }
        nodeIds.forEach(id -> types.put(id, null));

        String entry = nodeIds.get(0);
        types.put(entry, NodeType.HUB);

        String boss = farthestFrom(entry, edges);
        if (!boss.equals(entry)) {
            types.put(boss, NodeType.BOSS);
        }

        assignFrontiers(nodeIds, types, edges, settings, random);
        assignDeadEnds(nodeIds, types, edges, settings, random);

        for (String id : nodeIds) {
            if (types.get(id) == null) {
                types.put(id, degree(id, edges) >= 3 ? NodeType.BRANCHING : NodeType.LINEAR);
            }
        }
        log.debug("Classified {} nodes: {}", nodeIds.size(), summarize(types));
        return types;
    }

    private void assignFrontiers(List<String> nodeIds, Map<String, NodeType> types, Map<String, List<Edge>> edges,
                                 GenerationSettings settings, Random random) {
        int quota = Math.max(settings.minFrontiers(), nodeIds.size() / 10);

        List<String> boundary = new ArrayList<>();
        for (String id : nodeIds) {
            if (types.get(id) == null && degree(id, edges) <= BOUNDARY_DEGREE) {
                boundary.add(id);
            }
        }
        Collections.shuffle(boundary, random);
        int assigned = 0;
        for (String id : boundary) {
            if (assigned >= quota) {
                break;
            }
            types.put(id, NodeType.FRONTIER);
            assigned++;
        }

        if (assigned < settings.minFrontiers()) {
            List<String> remaining = untyped(nodeIds, types);
            Collections.shuffle(remaining, random);
            for (String id : remaining) {
                if (assigned >= settings.minFrontiers()) {
                    break;
                }
                types.put(id, NodeType.FRONTIER);
                assigned++;
            }
        }
    }

    private void assignDeadEnds(List<String> nodeIds, Map<String, NodeType> types, Map<String, List<Edge>> edges,
                                GenerationSettings settings, Random random) {
        List<String> eligible = new ArrayList<>(untyped(nodeIds, types).stream()
                .filter(id -> degree(id, edges) == 1)
                .toList());
        if (eligible.isEmpty()) {
            return;
        }
        int count = Math.max(1, (int) Math.round(eligible.size() * settings.deadEndFraction()));
        Collections.shuffle(eligible, random);
        eligible.subList(0, Math.min(count, eligible.size())).forEach(id -> types.put(id, NodeType.DEAD_END));
    }

    /**
     * Breadth-first search over outgoing edges; ties go to the first node reached.
     */
    private String farthestFrom(String entry, Map<String, List<Edge>> edges) {
        Map<String, Integer> distance = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distance.put(entry, 0);
        queue.add(entry);
        String farthest = entry;
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int d = distance.get(current);
            if (d > distance.get(farthest)) {
                farthest = current;
            }
            for (Edge edge : edges.getOrDefault(current, List.of())) {
                if (!distance.containsKey(edge.getTargetId())) {
                    distance.put(edge.getTargetId(), d + 1);
                    queue.add(edge.getTargetId());
                }
            }
        }
        return farthest;
    }

    private List<String> untyped(List<String> nodeIds, Map<String, NodeType> types) {
        List<String> result = new ArrayList<>();
        for (String id : nodeIds) {
            if (types.get(id) == null) {
                result.add(id);
            }
        }
        return result;
    }

    private int degree(String id, Map<String, List<Edge>> edges) {
        return edges.getOrDefault(id, List.of()).size();
    }

    private Map<NodeType, Long> summarize(Map<String, NodeType> types) {
        Map<NodeType, Long> counts = new LinkedHashMap<>();
        types.values().forEach(t -> counts.merge(t, 1L, Long::sum));
        return counts;
    }
}
