package com.dungeon.exception;

import java.util.List;

/**
 * Region generation could not produce a graph that satisfies the structural guarantees.
 */
public class GraphGenerationException extends RuntimeException {

    private final List<String> reasons;

    public GraphGenerationException(String message) {
        super(message);
        this.reasons = List.of(message);
    }

    public GraphGenerationException(String message, List<String> reasons) {
        super(message + ": " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
