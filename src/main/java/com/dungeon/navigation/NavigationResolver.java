package com.dungeon.navigation;

import com.dungeon.model.Condition;
import com.dungeon.model.Direction;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import com.dungeon.model.PlayerNavigationState;
import com.dungeon.model.PlayerSnapshot;
import com.dungeon.model.RegionGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves a movement request against a region snapshot.
 * <p>
 * Refusals are returned as {@link MoveOutcome} denials and never change the
 * player's state. A successful move into a hidden edge reveals it, together
 * with the reverse edge when that one is hidden as well.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NavigationResolver {

    private final ConditionEvaluator conditionEvaluator;

    public MoveOutcome resolve(RegionGraph graph, PlayerNavigationState state, PlayerSnapshot player,
                               Direction direction, ContentAvailability content) {
        return resolve(graph, state, player, direction.label(), content);
    }

    public MoveOutcome resolve(RegionGraph graph, PlayerNavigationState state, PlayerSnapshot player,
                               String requested, ContentAvailability content) {
        Optional<GraphNode> current = graph.node(state.getCurrentNodeId());
        if (current.isEmpty()) {
            return MoveOutcome.denied(DenialReason.UNKNOWN_LOCATION,
                    "You are nowhere in region " + graph.getRegionId() + ".", state);
        }
        GraphNode origin = current.get();

        Optional<Edge> candidate = findEdge(origin, requested);
        if (candidate.isEmpty()) {
            return MoveOutcome.denied(DenialReason.NO_EXIT, "You can't go " + requested + " from here.", state);
        }
        Edge edge = candidate.get();
        String edgeId = edge.edgeId(origin.getId());
        boolean revealed = state.hasRevealed(edgeId);

        List<String> newlyRevealed = new ArrayList<>();
        if (edge.isHidden() && !revealed) {
            boolean discovered = edge.discoveryChecks().stream().allMatch(c -> conditionEvaluator.isMet(c, player));
            if (!discovered) {
                return MoveOutcome.denied(DenialReason.HIDDEN_UNREVEALED,
                        "You can't go " + requested + " from here.", state);
            }
            newlyRevealed.add(edgeId);
        }

        // Perception checks only govern discovery; on a plain edge every condition gates
        List<Condition> gating = edge.isHidden() ? edge.gatingConditions() : edge.getConditions();
        List<Condition> unmet = gating.stream().filter(c -> !conditionEvaluator.isMet(c, player)).toList();
        if (!unmet.isEmpty()) {
            return MoveOutcome.builder()
                    .moved(false)
                    .reason(DenialReason.CONDITION_UNMET)
                    .message("The way " + edge.getLabel() + " is barred: "
                            + unmet.stream().map(Condition::describe).collect(Collectors.joining(", ")) + ".")
                    .state(state)
                    .unmetConditions(unmet)
                    .build();
        }

        Optional<GraphNode> target = graph.node(edge.getTargetId());
        if (target.isEmpty()) {
            log.warn("Edge {} points to node {} which is not loaded", edgeId, edge.getTargetId());
            return MoveOutcome.denied(DenialReason.UNKNOWN_TARGET, "That way leads nowhere yet.", state);
        }
        if (!content.isMaterialized(edge.getTargetId())) {
            return MoveOutcome.denied(DenialReason.CONTENT_NOT_GENERATED,
                    "The way " + edge.getLabel() + " is still taking shape.", state);
        }

        target.get().findEdgeTo(origin.getId())
                .filter(Edge::isHidden)
                .map(reverse -> reverse.edgeId(target.get().getId()))
                .filter(reverseId -> !state.hasRevealed(reverseId))
                .ifPresent(newlyRevealed::add);

        PlayerNavigationState next = state.reveal(newlyRevealed).moveTo(target.get().getId());
        log.debug("Player {} moved {} from {} to {}", state.getPlayerId(), edge.getLabel(),
                origin.getId(), target.get().getId());
        return MoveOutcome.moved(next, edge, target.get().getRegionId(), newlyRevealed);
    }

    /**
     * Label match first, accepting direction aliases; then the geometric match
     * for placed nodes.
     */
    Optional<Edge> findEdge(GraphNode node, String requested) {
        if (requested == null || requested.isBlank()) {
            return Optional.empty();
        }
        Optional<Edge> exact = node.findEdge(requested);
        if (exact.isPresent()) {
            return exact;
        }
        Optional<Direction> direction = Direction.fromLabel(requested);
        if (direction.isEmpty()) {
            return Optional.empty();
        }
        return node.findEdge(direction.get().label())
                .or(() -> node.findEdgeGeometric(direction.get()));
    }
}
