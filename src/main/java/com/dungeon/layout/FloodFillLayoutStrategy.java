package com.dungeon.layout;

import com.dungeon.model.Position;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Grows a cave-like blob of cells outwards from the origin.
 */
@Component
public class FloodFillLayoutStrategy implements LayoutStrategy {

    private static final int[][] NEIGHBOR_OFFSETS = {{0, -1}, {1, 0}, {0, 1}, {-1, 0}};

    @Override
    public LayoutType type() {
        return LayoutType.FLOOD_FILL;
    }

    @Override
    public List<LayoutNode> layout(String regionId, GraphLayout layout, Random random) {
        GraphLayout.FloodFill fill = (GraphLayout.FloodFill) layout;
        List<LayoutNode> nodes = new ArrayList<>(fill.nodeCount());
        Set<Position.Coordinates> occupied = new HashSet<>();
        List<Position.Coordinates> frontier = new ArrayList<>();

        Position.Coordinates origin = new Position.Coordinates(0, 0);
        occupied.add(origin);
        frontier.add(origin);
        nodes.add(new LayoutNode(regionId + ":flood_0", origin));

        while (nodes.size() < fill.nodeCount() && !frontier.isEmpty()) {
            Position.Coordinates cell = frontier.remove(random.nextInt(frontier.size()));
            List<Position.Coordinates> free = freeNeighbors(cell, occupied);
            if (free.isEmpty()) {
                continue;
            }
            Collections.shuffle(free, random);
            int claim = Math.max(1, (int) (free.size() * fill.density()));
            for (int i = 0; i < claim && nodes.size() < fill.nodeCount(); i++) {
                Position.Coordinates next = free.get(i);
                occupied.add(next);
                frontier.add(next);
                nodes.add(new LayoutNode(regionId + ":flood_" + nodes.size(), next));
            }
            if (free.size() > claim) {
                frontier.add(cell);
            }
        }
        return nodes;
    }

    private List<Position.Coordinates> freeNeighbors(Position.Coordinates cell, Set<Position.Coordinates> occupied) {
        List<Position.Coordinates> free = new ArrayList<>(4);
        for (int[] offset : NEIGHBOR_OFFSETS) {
            Position.Coordinates candidate = new Position.Coordinates(cell.x() + offset[0], cell.y() + offset[1]);
            if (!occupied.contains(candidate)) {
                free.add(candidate);
            }
        }
        return free;
    }
}
