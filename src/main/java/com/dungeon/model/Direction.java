package com.dungeon.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Named movement directions. Compass directions carry a bearing in radians
 * measured clockwise from east on a grid whose y axis grows southwards.
 */
public enum Direction {
    NORTH("north", "n", 3 * Math.PI / 2),
    NORTHEAST("northeast", "ne", 7 * Math.PI / 4),
    EAST("east", "e", 0.0),
    SOUTHEAST("southeast", "se", Math.PI / 4),
    SOUTH("south", "s", Math.PI / 2),
    SOUTHWEST("southwest", "sw", 3 * Math.PI / 4),
    WEST("west", "w", Math.PI),
    NORTHWEST("northwest", "nw", 5 * Math.PI / 4),
    UP("up", "u", Double.NaN),
    DOWN("down", "d", Double.NaN);

    public static final double TWO_PI = 2 * Math.PI;

    private static final List<Direction> COMPASS = Arrays.stream(values())
            .filter(Direction::isCompass)
            .toList();

    private final String label;
    private final String alias;
    private final double bearing;

    Direction(String label, String alias, double bearing) {
        this.label = label;
        this.alias = alias;
        this.bearing = bearing;
    }

    public String label() {
        return label;
    }

    public double bearing() {
        return bearing;
    }

    public boolean isCompass() {
        return !Double.isNaN(bearing);
    }

    public Direction opposite() {
        return switch (this) {
            case NORTH -> SOUTH;
            case NORTHEAST -> SOUTHWEST;
            case EAST -> WEST;
            case SOUTHEAST -> NORTHWEST;
            case SOUTH -> NORTH;
            case SOUTHWEST -> NORTHEAST;
            case WEST -> EAST;
            case NORTHWEST -> SOUTHEAST;
            case UP -> DOWN;
            case DOWN -> UP;
        };
    }

    /**
     * Looks up a direction by its canonical label or short alias, ignoring case.
     */
    public static Optional<Direction> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(d -> d.label.equals(normalized) || d.alias.equals(normalized))
                .findFirst();
    }

    public static List<Direction> compass() {
        return COMPASS;
    }

    /**
     * Compass directions ordered by angular distance from the given bearing, nearest first.
     */
    public static List<Direction> byProximity(double bearing) {
        return COMPASS.stream()
                .sorted((a, b) -> Double.compare(
                        angularDistance(a.bearing, bearing),
                        angularDistance(b.bearing, bearing)))
                .toList();
    }

    /**
     * Smallest absolute difference between two angles, wrap-around aware. Result is in [0, π].
     */
    public static double angularDistance(double a, double b) {
        double diff = Math.abs(normalize(a) - normalize(b));
        return diff > Math.PI ? TWO_PI - diff : diff;
    }

    public static double normalize(double angle) {
        double result = angle % TWO_PI;
        return result < 0 ? result + TWO_PI : result;
    }
}
