package com.dungeon.navigation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Used when no language model is configured.
 */
@Component
public class UnavailableExitIntentInterpreter implements ExitIntentInterpreter {

    @Override
    public Optional<String> interpret(String intent, List<String> exitLabels) {
        return Optional.empty();
    }
}
