package com.dungeon.navigation;

/**
 * Tells whether descriptive content already exists for a node.
 */
@FunctionalInterface
public interface ContentAvailability {

    boolean isMaterialized(String nodeId);

    static ContentAvailability always() {
        return nodeId -> true;
    }
}
