package com.dungeon.navigation;

import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps free text such as "nort" or "the mossy tunnel" to one of a node's
 * visible exits.
 * <ol>
 *   <li>Exact: a direction word that equals an exit label.</li>
 *   <li>Fuzzy: exactly one exit label within edit distance 2.</li>
 *   <li>Interpreter: the language model, bounded by a timeout.</li>
 * </ol>
 * Interpreter failures and timeouts fall back to a no-match answer listing the exits.
 */
@Component
@Slf4j
public class ExitIntentResolver {

    static final int MAX_EDIT_DISTANCE = 2;
    static final String EXIT_PREFIX = "EXIT:";
    static final String UNCLEAR = "UNCLEAR";

    private static final Set<String> DIRECTION_WORDS = Set.of(
            "n", "north", "s", "south", "e", "east", "w", "west",
            "ne", "northeast", "nw", "northwest", "se", "southeast", "sw", "southwest",
            "u", "up", "d", "down");

    private final ExitIntentInterpreter interpreter;
    private final AsyncTaskExecutor executor;
    private final long timeoutMs;

    public ExitIntentResolver(ExitIntentInterpreter interpreter,
                              @Qualifier("exitIntentExecutor") AsyncTaskExecutor executor,
                              @Value("${dungeon.navigation.llm-timeout-ms:3000}") long timeoutMs) {
        this.interpreter = interpreter;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    public ExitResolution resolve(GraphNode node, Set<String> revealedEdgeIds, String intent) {
        List<Edge> exits = node.visibleEdges(revealedEdgeIds);
        if (exits.isEmpty()) {
            return ExitResolution.noExits();
        }
        List<String> labels = exits.stream().map(Edge::getLabel).toList();
        String normalized = intent == null ? "" : intent.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return ExitResolution.noMatch(labels);
        }

        if (DIRECTION_WORDS.contains(normalized)) {
            Optional<Edge> exact = exits.stream().filter(e -> e.hasLabel(normalized)).findFirst();
            if (exact.isPresent()) {
                return ExitResolution.matched(exact.get(), ExitResolution.Phase.EXACT);
            }
        }

        List<Edge> close = exits.stream()
                .filter(e -> Levenshtein.distance(normalized, e.getLabel().toLowerCase(Locale.ROOT)) <= MAX_EDIT_DISTANCE)
                .toList();
        if (close.size() == 1) {
            return ExitResolution.matched(close.get(0), ExitResolution.Phase.FUZZY);
        }

        ExitResolution interpreted = interpret(normalized, exits, labels);
        if (interpreted.getStatus() == ExitResolution.Status.NO_MATCH && close.size() > 1) {
            return ExitResolution.ambiguous(close.stream().map(Edge::getLabel).toList());
        }
        return interpreted;
    }

    private ExitResolution interpret(String intent, List<Edge> exits, List<String> labels) {
        Optional<String> response = ask(intent, labels);
        if (response.isEmpty()) {
            return ExitResolution.noMatch(labels);
        }

        String answer = response.get().trim();
        if (answer.equalsIgnoreCase(UNCLEAR)) {
            return ExitResolution.ambiguous(labels);
        }
        if (answer.regionMatches(true, 0, EXIT_PREFIX, 0, EXIT_PREFIX.length())) {
            String label = answer.substring(EXIT_PREFIX.length()).trim();
            Optional<Edge> match = exits.stream().filter(e -> e.hasLabel(label)).findFirst();
            if (match.isPresent()) {
                return ExitResolution.matched(match.get(), ExitResolution.Phase.INTERPRETER);
            }
        }
        log.debug("Interpreter answer '{}' names no visible exit", answer);
        return ExitResolution.noMatch(labels);
    }

    private Optional<String> ask(String intent, List<String> labels) {
        Future<Optional<String>> future;
        try {
            future = executor.submit(() -> interpreter.interpret(intent, labels));
        } catch (RejectedExecutionException e) {
            log.warn("Exit interpreter is saturated, skipping '{}'", intent);
            return Optional.empty();
        }
        try {
            Optional<String> result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result == null ? Optional.empty() : result;
        } catch (TimeoutException e) {
            // interrupts the worker so a hung call does not keep its pool thread
            future.cancel(true);
            log.warn("Exit interpreter timed out after {} ms for '{}'", timeoutMs, intent);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for exit interpreter");
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Exit interpreter failed for '{}': {}", intent, e.getCause().getMessage());
            return Optional.empty();
        }
    }
}
