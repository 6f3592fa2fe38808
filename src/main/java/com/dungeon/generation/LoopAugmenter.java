package com.dungeon.generation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * Adds non-tree edges to a spanning tree so the region gets cycles and an
 * average degree of at least 3.
 */
@Component
@Slf4j
public class LoopAugmenter {

    /** Pairs further apart than this in the tree are preferred loop candidates. */
    static final int PREFERRED_TREE_DISTANCE = 2;

    /**
     * Returns only the added loop edges; the tree itself is left untouched.
     */
    public List<UndirectedEdge> augment(int nodeCount, List<UndirectedEdge> tree, double loopFrequency, Random random) {
        if (nodeCount < 3) {
            return List.of();
        }

        int[][] distances = treeDistances(nodeCount, tree);
        boolean[][] connected = new boolean[nodeCount][nodeCount];
        for (UndirectedEdge edge : tree) {
            connected[edge.from()][edge.to()] = true;
            connected[edge.to()][edge.from()] = true;
        }

        List<UndirectedEdge> preferred = new ArrayList<>();
        List<UndirectedEdge> fallback = new ArrayList<>();
        for (int i = 0; i < nodeCount; i++) {
            for (int j = i + 1; j < nodeCount; j++) {
                if (connected[i][j]) {
                    continue;
                }
                if (distances[i][j] > PREFERRED_TREE_DISTANCE) {
                    preferred.add(new UndirectedEdge(i, j));
                } else {
                    fallback.add(new UndirectedEdge(i, j));
                }
            }
        }

        int target = Math.min(targetExtraEdges(nodeCount, loopFrequency, random), preferred.size() + fallback.size());

        Collections.shuffle(preferred, random);
        List<UndirectedEdge> loops = new ArrayList<>(preferred.subList(0, Math.min(target, preferred.size())));
        if (loops.size() < target) {
            Collections.shuffle(fallback, random);
            loops.addAll(fallback.subList(0, target - loops.size()));
        }

        log.debug("Added {} loop edges to {} nodes ({} preferred candidates)", loops.size(), nodeCount, preferred.size());
        return loops;
    }

    /**
     * Number of loop edges to add. {@code ceil((n + 2) / 2)} extra edges lift the
     * total degree to at least {@code 3n}; the frequency knob adds a randomized
     * buffer on top.
     */
    int targetExtraEdges(int nodeCount, double loopFrequency, Random random) {
        int minExtra = Math.max(1, (nodeCount + 3) / 2);
        int buffer = Math.max(1, (int) Math.round(minExtra * (0.10 + random.nextDouble() * 0.10)));
        return minExtra + (int) Math.round(loopFrequency * (buffer + nodeCount / 4));
    }

    private int[][] treeDistances(int nodeCount, List<UndirectedEdge> tree) {
        List<List<Integer>> adjacency = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            adjacency.add(new ArrayList<>());
        }
        for (UndirectedEdge edge : tree) {
            adjacency.get(edge.from()).add(edge.to());
            adjacency.get(edge.to()).add(edge.from());
        }

        int[][] distances = new int[nodeCount][];
        for (int source = 0; source < nodeCount; source++) {
            int[] dist = new int[nodeCount];
            Arrays.fill(dist, Integer.MAX_VALUE);
            dist[source] = 0;
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(source);
            while (!queue.isEmpty()) {
                int current = queue.poll();
                for (int next : adjacency.get(current)) {
                    if (dist[next] == Integer.MAX_VALUE) {
                        dist[next] = dist[current] + 1;
                        queue.add(next);
                    }
                }
            }
            distances[source] = dist;
        }
        return distances;
    }
}
