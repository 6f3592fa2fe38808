package com.dungeon.layout;

import com.dungeon.model.Position;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Row-major lattice starting at (0,0).
 */
@Component
public class GridLayoutStrategy implements LayoutStrategy {

    @Override
    public LayoutType type() {
        return LayoutType.GRID;
    }

    @Override
    public List<LayoutNode> layout(String regionId, GraphLayout layout, Random random) {
        GraphLayout.Grid grid = (GraphLayout.Grid) layout;
        List<LayoutNode> nodes = new ArrayList<>(grid.width() * grid.height());
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                nodes.add(new LayoutNode(regionId + ":grid_" + x + "_" + y, Position.of(x, y)));
            }
        }
        return nodes;
    }
}
