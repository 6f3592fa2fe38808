package com.dungeon.model;

/**
 * Structural role of a node within a generated region.
 */
public enum NodeType {
    HUB,
    LINEAR,
    BRANCHING,
    DEAD_END,
    BOSS,
    FRONTIER,
    /** Reserved for quest placement; never assigned during generation. */
    QUESTABLE
}
