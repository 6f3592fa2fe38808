package com.dungeon.model;

import java.util.Optional;

/**
 * Location of a node on the layout plane, or the absence of one.
 */
public sealed interface Position permits Position.Coordinates, Position.Abstract {

    static Position of(int x, int y) {
        return new Coordinates(x, y);
    }

    static Position none() {
        return Abstract.INSTANCE;
    }

    default boolean isPlaced() {
        return this instanceof Coordinates;
    }

    default Optional<Coordinates> coordinates() {
        return this instanceof Coordinates c ? Optional.of(c) : Optional.empty();
    }

    /**
     * Integer grid coordinates; y grows southwards.
     */
    record Coordinates(int x, int y) implements Position {

        /**
         * Bearing towards {@code other} in radians, normalized to [0, 2π).
         *
         * @throws IllegalArgumentException if both points coincide
         */
        public double bearingTo(Coordinates other) {
            int dx = other.x - x;
            int dy = other.y - y;
            if (dx == 0 && dy == 0) {
                throw new IllegalArgumentException("No bearing between identical points " + this);
            }
            return Direction.normalize(Math.atan2(dy, dx));
        }
    }

    /** A node without geometry. */
    enum Abstract implements Position {
        INSTANCE
    }
}
