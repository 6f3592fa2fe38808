package com.dungeon.config;

import com.dungeon.layout.GraphLayout;
import com.dungeon.layout.LayoutType;

/**
 * Explicit layout choice in a region template or generation request. Only the
 * parameters of the chosen {@code type} are read; absent ones take defaults.
 *
 * @param type          layout algorithm
 * @param width         grid width
 * @param height        grid height
 * @param minRoomSize   smallest BSP room side
 * @param maxDepth      BSP recursion limit
 * @param nodeCount     flood-fill node count
 * @param density       flood-fill neighbor claim ratio
 * @param loopFrequency extra loop density in [0, 1]
 */
public record LayoutDefinition(
        LayoutType type,
        Integer width,
        Integer height,
        Integer minRoomSize,
        Integer maxDepth,
        Integer nodeCount,
        Double density,
        Double loopFrequency
) {

    /**
     * @throws IllegalArgumentException if the type is missing or a parameter is out of range
     */
    public GraphLayout toLayout() {
        if (type == null) {
            throw new IllegalArgumentException("Layout type is required");
        }
        double loops = loopFrequency != null ? loopFrequency : GraphLayout.DEFAULT_LOOP_FREQUENCY;
        return switch (type) {
            case GRID -> new GraphLayout.Grid(orDefault(width, 5), orDefault(height, 5), loops);
            case BSP -> new GraphLayout.Bsp(orDefault(minRoomSize, 3), orDefault(maxDepth, 4), loops);
            case FLOOD_FILL -> new GraphLayout.FloodFill(orDefault(nodeCount, 20),
                    density != null ? density : 0.4, loops);
        };
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
