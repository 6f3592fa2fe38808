package com.dungeon.navigation;

import java.util.List;
import java.util.Optional;

/**
 * Free-text exit interpretation backed by a language model. Implementations
 * answer {@code EXIT:<label>} or {@code UNCLEAR}; an empty result means no
 * interpretation is available.
 */
public interface ExitIntentInterpreter {

    Optional<String> interpret(String intent, List<String> exitLabels);
}
