package com.dungeon.navigation;

import com.dungeon.model.Condition;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import com.dungeon.model.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ExitIntentResolver. The interpreter runs on the calling thread
 * unless a test says otherwise.
 */
@ExtendWith(MockitoExtension.class)
class ExitIntentResolverTest {

    @Mock
    private ExitIntentInterpreter interpreter;

    private ExitIntentResolver resolver;
    private GraphNode junction;

    private static Edge edge(String target, String label) {
        return Edge.builder().targetId(target).label(label).build();
    }

    @BeforeEach
    void setUp() {
        resolver = new ExitIntentResolver(interpreter, new TaskExecutorAdapter(Runnable::run), 500);
        junction = GraphNode.builder()
                .id("j")
                .type(NodeType.BRANCHING)
                .regionId("r")
                .edges(List.of(
                        edge("a", "north"),
                        edge("b", "northeast"),
                        edge("c", "mossy tunnel"),
                        edge("d", "down").hiddenBehind(Condition.perception(20))))
                .build();
    }

    @Nested
    @DisplayName("local phases")
    class LocalPhases {

        @Test
        @DisplayName("a direction word equal to a label matches exactly")
        void shouldMatchExactly() {
            ExitResolution resolution = resolver.resolve(junction, Set.of(), " North ");

            assertTrue(resolution.isMatched());
            assertEquals(ExitResolution.Phase.EXACT, resolution.getPhase());
            assertEquals("a", resolution.getEdge().getTargetId());
            verifyNoInteractions(interpreter);
        }

        @Test
        @DisplayName("a typo within two edits of one label matches fuzzily")
        void shouldMatchTypos() {
            ExitResolution nort = resolver.resolve(junction, Set.of(), "nort");
            ExitResolution tunnel = resolver.resolve(junction, Set.of(), "mosy tunel");

            assertEquals(ExitResolution.Phase.FUZZY, nort.getPhase());
            assertEquals("north", nort.getEdge().getLabel());
            assertEquals("mossy tunnel", tunnel.getEdge().getLabel());
            verifyNoInteractions(interpreter);
        }

        @Test
        @DisplayName("blank input lists the exits without asking the interpreter")
        void shouldNotMatchBlankInput() {
            ExitResolution resolution = resolver.resolve(junction, Set.of(), "   ");

            assertEquals(ExitResolution.Status.NO_MATCH, resolution.getStatus());
            assertEquals(List.of("north", "northeast", "mossy tunnel"), resolution.getSuggestions());
            verifyNoInteractions(interpreter);
        }

        @Test
        @DisplayName("two equally close labels are ambiguous when the interpreter has nothing")
        void shouldReportAmbiguousTypos() {
            GraphNode crossing = junction.toBuilder()
                    .edges(List.of(edge("e", "east"), edge("w", "west")))
                    .build();
            when(interpreter.interpret(eq("est"), anyList())).thenReturn(Optional.empty());

            ExitResolution resolution = resolver.resolve(crossing, Set.of(), "est");

            assertEquals(ExitResolution.Status.AMBIGUOUS, resolution.getStatus());
            assertEquals(List.of("east", "west"), resolution.getSuggestions());
            assertEquals("Which way do you mean: east, west?", resolution.getMessage());
        }

        @Test
        @DisplayName("a node without visible exits says so")
        void shouldReportNoExits() {
            GraphNode sealed = junction.toBuilder()
                    .edges(List.of(edge("d", "down").hiddenBehind(Condition.perception(20))))
                    .build();

            ExitResolution resolution = resolver.resolve(sealed, Set.of(), "down");

            assertEquals(ExitResolution.Status.NO_EXITS, resolution.getStatus());
            assertEquals("There are no visible exits here.", resolution.getMessage());
        }
    }

    @Nested
    @DisplayName("interpreter phase")
    class InterpreterPhase {

        @Test
        @DisplayName("a single-letter alias is left to the interpreter")
        void shouldAskInterpreterForAlias() {
            when(interpreter.interpret("n", List.of("north", "northeast", "mossy tunnel")))
                    .thenReturn(Optional.of("EXIT:north"));

            ExitResolution resolution = resolver.resolve(junction, Set.of(), "n");

            assertEquals(ExitResolution.Phase.INTERPRETER, resolution.getPhase());
            assertEquals("north", resolution.getEdge().getLabel());
        }

        @Test
        @DisplayName("UNCLEAR turns into a question listing every exit")
        void shouldAskBackWhenUnclear() {
            when(interpreter.interpret(anyString(), anyList())).thenReturn(Optional.of("unclear"));

            ExitResolution resolution = resolver.resolve(junction, Set.of(), "the way we came");

            assertEquals(ExitResolution.Status.AMBIGUOUS, resolution.getStatus());
            assertEquals(List.of("north", "northeast", "mossy tunnel"), resolution.getSuggestions());
        }

        @Test
        @DisplayName("an answer naming a hidden exit is not a match")
        void shouldIgnoreHiddenExitAnswers() {
            when(interpreter.interpret(anyString(), anyList())).thenReturn(Optional.of("EXIT:down"));

            ExitResolution resolution = resolver.resolve(junction, Set.of(), "climb down the shaft");

            assertEquals(ExitResolution.Status.NO_MATCH, resolution.getStatus());
            assertTrue(resolution.getMessage().startsWith("I'm not sure which way you want to go."));
        }

        @Test
        @DisplayName("a revealed hidden exit can be chosen")
        void shouldAcceptRevealedExit() {
            when(interpreter.interpret(anyString(), anyList())).thenReturn(Optional.of("EXIT: Down"));

            ExitResolution resolution = resolver.resolve(junction, Set.of("j->d"), "climb down the shaft");

            assertTrue(resolution.isMatched());
            assertEquals("d", resolution.getEdge().getTargetId());
        }

        @Test
        @DisplayName("an interpreter failure falls back to listing the exits")
        void shouldSurviveInterpreterFailure() {
            when(interpreter.interpret(anyString(), anyList())).thenThrow(new IllegalStateException("model offline"));

            ExitResolution resolution = resolver.resolve(junction, Set.of(), "towards the light");

            assertEquals(ExitResolution.Status.NO_MATCH, resolution.getStatus());
            assertEquals(List.of("north", "northeast", "mossy tunnel"), resolution.getSuggestions());
        }

        @Test
        @DisplayName("a saturated executor skips the interpreter")
        void shouldSurviveRejectedExecution() {
            ExitIntentResolver saturated = new ExitIntentResolver(interpreter, new TaskExecutorAdapter(task -> {
                throw new RejectedExecutionException("queue full");
            }), 500);

            ExitResolution resolution = saturated.resolve(junction, Set.of(), "towards the light");

            assertEquals(ExitResolution.Status.NO_MATCH, resolution.getStatus());
            verify(interpreter, never()).interpret(anyString(), anyList());
        }

        @Test
        @DisplayName("a slow interpreter is interrupted after the timeout and frees its thread")
        void shouldInterruptSlowInterpreter() throws InterruptedException {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(1);
            executor.setMaxPoolSize(1);
            executor.setQueueCapacity(1);
            executor.initialize();

            AtomicInteger calls = new AtomicInteger();
            CountDownLatch interrupted = new CountDownLatch(1);
            ExitIntentInterpreter hangsOnce = (intent, labels) -> {
                if (calls.incrementAndGet() == 1) {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        Thread.currentThread().interrupt();
                    }
                    return Optional.empty();
                }
                return Optional.of("EXIT:mossy tunnel");
            };
            try {
                ExitIntentResolver impatient = new ExitIntentResolver(hangsOnce, executor, 200);

                long start = System.nanoTime();
                ExitResolution first = impatient.resolve(junction, Set.of(), "towards the light");
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;

                assertEquals(ExitResolution.Status.NO_MATCH, first.getStatus());
                assertTrue(elapsedMs < 5_000, "waited " + elapsedMs + " ms");
                assertTrue(interrupted.await(2, TimeUnit.SECONDS), "hung call was never interrupted");

                ExitResolution second = impatient.resolve(junction, Set.of(), "towards the light");

                assertTrue(second.isMatched());
                assertEquals(ExitResolution.Phase.INTERPRETER, second.getPhase());
                assertEquals(2, calls.get());
            } finally {
                executor.shutdown();
            }
        }
    }

    @Test
    @DisplayName("Levenshtein distance counts single-character edits")
    void shouldComputeEditDistance() {
        assertEquals(0, Levenshtein.distance("north", "north"));
        assertEquals(1, Levenshtein.distance("nort", "north"));
        assertEquals(4, Levenshtein.distance("n", "north"));
        assertEquals(3, Levenshtein.distance("kitten", "sitting"));
        assertEquals(5, Levenshtein.distance("", "south"));
    }
}
