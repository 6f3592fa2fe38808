package com.dungeon.layout;

import java.util.Locale;

/**
 * Layout configuration for a region. Every variant carries the loop-frequency knob
 * in [0, 1]: 0 adds only the loops needed for an average degree of 3, 1 is the
 * densest setting.
 */
public sealed interface GraphLayout permits GraphLayout.Grid, GraphLayout.Bsp, GraphLayout.FloodFill {

    double DEFAULT_LOOP_FREQUENCY = 0.5;

    LayoutType type();

    double loopFrequency();

    /**
     * Rectangular lattice of {@code width × height} nodes.
     */
    record Grid(int width, int height, double loopFrequency) implements GraphLayout {

        public static final int MAX_CELLS = 100;

        public Grid {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Grid dimensions must be positive, got " + width + "x" + height);
            }
            if (width * height > MAX_CELLS) {
                throw new IllegalArgumentException("Grid may hold at most " + MAX_CELLS + " cells, got " + width * height);
            }
            checkLoopFrequency(loopFrequency);
        }

        public Grid(int width, int height) {
            this(width, height, DEFAULT_LOOP_FREQUENCY);
        }

        @Override
        public LayoutType type() {
            return LayoutType.GRID;
        }
    }

    /**
     * Recursive binary space partition of a fixed area; one node per leaf room.
     */
    record Bsp(int minRoomSize, int maxDepth, double loopFrequency) implements GraphLayout {

        public static final int AREA_SIZE = 50;

        public Bsp {
            if (minRoomSize < 2) {
                throw new IllegalArgumentException("BSP minRoomSize must be at least 2, got " + minRoomSize);
            }
            // depth 1 yields at most two rooms, too few for a valid region
            if (maxDepth < 2 || maxDepth > 6) {
                throw new IllegalArgumentException("BSP maxDepth must be between 2 and 6, got " + maxDepth);
            }
            checkLoopFrequency(loopFrequency);
        }

        public Bsp(int minRoomSize, int maxDepth) {
            this(minRoomSize, maxDepth, DEFAULT_LOOP_FREQUENCY);
        }

        @Override
        public LayoutType type() {
            return LayoutType.BSP;
        }
    }

    /**
     * Organic growth from the origin over orthogonal neighbor cells.
     */
    record FloodFill(int nodeCount, double density, double loopFrequency) implements GraphLayout {

        public FloodFill {
            if (nodeCount < 5 || nodeCount > 100) {
                throw new IllegalArgumentException("Flood fill nodeCount must be between 5 and 100, got " + nodeCount);
            }
            if (density < 0.1 || density > 1.0) {
                throw new IllegalArgumentException("Flood fill density must be between 0.1 and 1.0, got " + density);
            }
            checkLoopFrequency(loopFrequency);
        }

        public FloodFill(int nodeCount, double density) {
            this(nodeCount, density, DEFAULT_LOOP_FREQUENCY);
        }

        @Override
        public LayoutType type() {
            return LayoutType.FLOOD_FILL;
        }
    }

    private static void checkLoopFrequency(double loopFrequency) {
        if (loopFrequency < 0.0 || loopFrequency > 1.0) {
            throw new IllegalArgumentException("loopFrequency must be between 0 and 1, got " + loopFrequency);
        }
    }

    /**
     * Default layout for a region theme, chosen by the first keyword the theme
     * contains (case-insensitive), e.g. "haunted dungeon" gets the dungeon grid.
     * Themes without a known keyword get a 5x5 grid.
     */
    static GraphLayout forBiome(String theme) {
        String key = theme == null ? "" : theme.toLowerCase(Locale.ROOT);
        if (key.contains("dungeon")) {
            return new Grid(6, 6);
        } else if (key.contains("building")) {
            return new Bsp(4, 3);
        } else if (key.contains("tower")) {
            return new Grid(3, 8);
        } else if (key.contains("cave")) {
            return new FloodFill(20, 0.3);
        } else if (key.contains("mine")) {
            return new FloodFill(25, 0.35);
        } else if (key.contains("temple")) {
            return new Bsp(5, 3);
        } else if (key.contains("forest")) {
            return new FloodFill(30, 0.4);
        } else if (key.contains("ruins")) {
            return new Bsp(3, 4);
        }
        return new Grid(5, 5);
    }

    /**
     * Layout sized for roughly {@code nodeCount} nodes.
     */
    static GraphLayout forNodeCount(int nodeCount) {
        if (nodeCount <= 10) {
            return new Grid(3, 3);
        } else if (nodeCount <= 25) {
            return new Grid(5, 5);
        } else if (nodeCount <= 50) {
            return new Bsp(4, 4);
        }
        return new FloodFill(Math.min(nodeCount, 100), 0.4);
    }
}
