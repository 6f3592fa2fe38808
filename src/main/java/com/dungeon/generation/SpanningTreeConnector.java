package com.dungeon.generation;

import com.dungeon.layout.LayoutNode;
import com.dungeon.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Kruskal minimum spanning tree over all node pairs. Pairs are weighted by
 * Euclidean distance when both nodes have coordinates, and 1.0 otherwise.
 */
@Component
@Slf4j
public class SpanningTreeConnector {

    private record WeightedPair(int from, int to, double weight) {}

    public List<UndirectedEdge> connect(List<LayoutNode> nodes) {
        int n = nodes.size();
        if (n < 2) {
            return List.of();
        }

        List<WeightedPair> pairs = new ArrayList<>(n * (n - 1) / 2);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                pairs.add(new WeightedPair(i, j, weight(nodes.get(i), nodes.get(j))));
            }
        }
        // List.sort is stable, so equal weights keep pair order
        pairs.sort(Comparator.comparingDouble(WeightedPair::weight));

        UnionFind components = new UnionFind(n);
        List<UndirectedEdge> tree = new ArrayList<>(n - 1);
        for (WeightedPair pair : pairs) {
            if (components.union(pair.from(), pair.to())) {
                tree.add(new UndirectedEdge(pair.from(), pair.to()));
                if (tree.size() == n - 1) {
                    break;
                }
            }
        }
        log.debug("Spanning tree connected {} nodes with {} edges", n, tree.size());
        return tree;
    }

    private double weight(LayoutNode a, LayoutNode b) {
        Optional<Position.Coordinates> pa = a.position().coordinates();
        Optional<Position.Coordinates> pb = b.position().coordinates();
        if (pa.isEmpty() || pb.isEmpty()) {
            return 1.0;
        }
        double dx = pa.get().x() - pb.get().x();
        double dy = pa.get().y() - pb.get().y();
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Disjoint sets with path compression.
     */
    static final class UnionFind {

        private final int[] parent;

        UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        int find(int x) {
            while (parent[x] != x) {
                parent[x] = parent[parent[x]];
                x = parent[x];
            }
            return x;
        }

        /** Merge the sets of a and b; false when they were already joined. */
        boolean union(int a, int b) {
            int rootA = find(a);
            int rootB = find(b);
            if (rootA == rootB) {
                return false;
            }
            parent[rootB] = rootA;
            return true;
        }
    }
}
