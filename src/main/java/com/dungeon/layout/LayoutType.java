package com.dungeon.layout;

/**
 * Node placement algorithm selector.
 */
public enum LayoutType {
    GRID,
    BSP,
    FLOOD_FILL
}
