package com.dungeon.layout;

import java.util.List;
import java.util.Random;

/**
 * Places the nodes of a region. Implementations draw all randomness from the
 * supplied source so identical seeds yield identical layouts.
 */
public interface LayoutStrategy {

    LayoutType type();

    /**
     * Produce the nodes of a region, entry node first.
     */
    List<LayoutNode> layout(String regionId, GraphLayout layout, Random random);
}
