package com.dungeon.generation;

import java.util.List;

/**
 * Outcome of a structural check; valid when no reason was recorded.
 */
public record ValidationResult(List<String> reasons) {

    public ValidationResult {
        reasons = List.copyOf(reasons);
    }

    public static ValidationResult valid() {
        return new ValidationResult(List.of());
    }

    public boolean isValid() {
        return reasons.isEmpty();
    }
}
