package com.dungeon.navigation;

import com.dungeon.model.Edge;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of mapping player text to an exit.
 */
@Value
@Builder
public class ExitResolution {

    public enum Status {
        MATCHED,
        AMBIGUOUS,
        NO_MATCH,
        NO_EXITS
    }

    public enum Phase {
        EXACT,
        FUZZY,
        INTERPRETER
    }

    Status status;
    Edge edge;
    Phase phase;
    String message;

    @Builder.Default
    List<String> suggestions = List.of();

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    public static ExitResolution matched(Edge edge, Phase phase) {
        return ExitResolution.builder()
                .status(Status.MATCHED)
                .edge(edge)
                .phase(phase)
                .build();
    }

    public static ExitResolution ambiguous(List<String> suggestions) {
        return ExitResolution.builder()
                .status(Status.AMBIGUOUS)
                .message("Which way do you mean: " + String.join(", ", suggestions) + "?")
                .suggestions(List.copyOf(suggestions))
                .build();
    }

    public static ExitResolution noMatch(List<String> exits) {
        return ExitResolution.builder()
                .status(Status.NO_MATCH)
                .message("I'm not sure which way you want to go. Available exits: " + String.join(", ", exits))
                .suggestions(List.copyOf(exits))
                .build();
    }

    public static ExitResolution noExits() {
        return ExitResolution.builder()
                .status(Status.NO_EXITS)
                .message("There are no visible exits here.")
                .build();
    }
}
