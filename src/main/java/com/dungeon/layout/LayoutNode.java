package com.dungeon.layout;

import com.dungeon.model.Position;

/**
 * A node as produced by a layout strategy, before any edge exists.
 *
 * @param id       node id, prefixed with the region id
 * @param position layout coordinates, or {@link Position#none()}
 */
public record LayoutNode(String id, Position position) {}
