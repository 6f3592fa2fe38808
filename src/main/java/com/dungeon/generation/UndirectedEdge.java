package com.dungeon.generation;

/**
 * Connection between two nodes, by index into the layout's node list. Direction
 * labels are assigned from {@code from} towards {@code to}.
 */
public record UndirectedEdge(int from, int to) {

    public UndirectedEdge {
        if (from == to) {
            throw new IllegalArgumentException("Self loop on node " + from);
        }
    }

    public boolean connects(int a, int b) {
        return (from == a && to == b) || (from == b && to == a);
    }
}
