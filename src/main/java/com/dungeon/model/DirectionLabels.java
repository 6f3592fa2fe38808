package com.dungeon.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Opposites for edge labels, covering named directions and the synthetic
 * {@code passage-N} / {@code passage-back-N} pairs.
 */
public final class DirectionLabels {

    public static final String PASSAGE = "passage-";
    public static final String PASSAGE_BACK = "passage-back-";

    private DirectionLabels() {}

    public static String passage(int index) {
        return PASSAGE + index;
    }

    public static String passageBack(int index) {
        return PASSAGE_BACK + index;
    }

    public static boolean isSynthetic(String label) {
        return label != null && label.toLowerCase(Locale.ROOT).startsWith(PASSAGE);
    }

    /**
     * The label the reverse edge must carry, if {@code label} has a defined opposite.
     */
    public static Optional<String> opposite(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(PASSAGE_BACK)) {
            return Optional.of(PASSAGE + normalized.substring(PASSAGE_BACK.length()));
        }
        if (normalized.startsWith(PASSAGE)) {
            return Optional.of(PASSAGE_BACK + normalized.substring(PASSAGE.length()));
        }
        return Direction.fromLabel(normalized)
                .filter(d -> d.label().equals(normalized))
                .map(d -> d.opposite().label());
    }

    public static boolean areOpposites(String label, String reverse) {
        return opposite(label).map(o -> o.equalsIgnoreCase(reverse)).orElse(false);
    }
}
