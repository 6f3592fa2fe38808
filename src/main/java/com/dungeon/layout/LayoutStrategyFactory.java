package com.dungeon.layout;

import com.dungeon.exception.GraphGenerationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;

/**
 * Selects the layout strategy for a layout configuration and runs it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LayoutStrategyFactory {

    private final GridLayoutStrategy gridStrategy;
    private final BspLayoutStrategy bspStrategy;
    private final FloodFillLayoutStrategy floodFillStrategy;

    public LayoutStrategy getStrategy(LayoutType type) {
        return switch (type) {
            case GRID -> gridStrategy;
            case BSP -> bspStrategy;
            case FLOOD_FILL -> floodFillStrategy;
        };
    }

    /**
     * Lay out the nodes of a region.
     *
     * @throws GraphGenerationException if the strategy produced no node
     */
    public List<LayoutNode> layout(String regionId, GraphLayout layout, Random random) {
        List<LayoutNode> nodes = getStrategy(layout.type()).layout(regionId, layout, random);
        if (nodes.isEmpty()) {
            throw new GraphGenerationException("Layout " + layout + " produced no nodes for region " + regionId);
        }
        log.debug("{} layout placed {} nodes for region {}", layout.type(), nodes.size(), regionId);
        return nodes;
    }
}
