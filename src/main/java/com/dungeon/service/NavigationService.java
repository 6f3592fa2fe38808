package com.dungeon.service;

import com.dungeon.model.Condition;
import com.dungeon.model.Direction;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import com.dungeon.model.PlayerNavigationState;
import com.dungeon.model.PlayerSnapshot;
import com.dungeon.model.RegionGraph;
import com.dungeon.navigation.ConditionEvaluator;
import com.dungeon.navigation.DenialReason;
import com.dungeon.navigation.ExitIntentResolver;
import com.dungeon.navigation.ExitMapAdapter;
import com.dungeon.navigation.ExitResolution;
import com.dungeon.navigation.MoveOutcome;
import com.dungeon.navigation.NavigationResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runtime movement against persisted regions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NavigationService {

    private final RegionService regionService;
    private final NavigationResolver navigationResolver;
    private final ExitIntentResolver exitIntentResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final ExitMapAdapter exitMapAdapter;

    /**
     * Place a player on the entry node of a region.
     */
    public PlayerNavigationState enterRegion(String regionId, String playerId) {
        String entry = regionService.getRegion(regionId).getEntryNodeId();
        log.info("Player {} enters region {} at {}", playerId, regionId, entry);
        return PlayerNavigationState.startingAt(playerId, entry);
    }

    /**
     * Move along the exit named by {@code direction}. On success the content
     * around the new location is materialized.
     */
    public MoveOutcome move(String regionId, PlayerNavigationState state, PlayerSnapshot player, String direction) {
        RegionGraph graph = regionService.loadNeighborhood(regionId, state.getCurrentNodeId());
        MoveOutcome outcome = navigationResolver.resolve(graph, state, player, direction, regionService::isMaterialized);
        if (outcome.isMoved()) {
            GraphNode arrived = graph.node(outcome.getState().getCurrentNodeId()).orElseThrow();
            regionService.materializeAround(arrived.getRegionId(), arrived.getId());
        } else {
            log.debug("Player {} could not go {}: {}", state.getPlayerId(), direction, outcome.getReason());
        }
        return outcome;
    }

    /**
     * Resolve free text to an exit first, then move along it.
     */
    public MoveOutcome moveByIntent(String regionId, PlayerNavigationState state, PlayerSnapshot player, String intent) {
        RegionGraph graph = regionService.loadNeighborhood(regionId, state.getCurrentNodeId());
        Optional<GraphNode> current = graph.node(state.getCurrentNodeId());
        if (current.isEmpty()) {
            return MoveOutcome.denied(DenialReason.UNKNOWN_LOCATION,
                    "You are nowhere in region " + regionId + ".", state);
        }

        ExitResolution resolution = exitIntentResolver.resolve(current.get(), state.getRevealedEdgeIds(), intent);
        if (!resolution.isMatched()) {
            return MoveOutcome.builder()
                    .moved(false)
                    .reason(DenialReason.NO_EXIT)
                    .message(resolution.getMessage())
                    .state(state)
                    .suggestions(resolution.getSuggestions())
                    .build();
        }
        log.debug("Intent '{}' resolved to '{}' ({})", intent, resolution.getEdge().getLabel(), resolution.getPhase());
        return move(regionId, state, player, resolution.getEdge().getLabel());
    }

    /**
     * Visible exits of the player's node, each followed by hints for unmet conditions,
     * e.g. {@code north (requires climbing-gear)}.
     */
    public List<String> visibleExits(String regionId, PlayerNavigationState state, PlayerSnapshot player) {
        RegionGraph graph = regionService.loadNeighborhood(regionId, state.getCurrentNodeId());
        return graph.node(state.getCurrentNodeId())
                .map(node -> node.visibleEdges(state.getRevealedEdgeIds()).stream()
                        .map(edge -> describeExit(edge, player))
                        .toList())
                .orElse(List.of());
    }

    public Map<Direction, String> exitMap(String regionId, PlayerNavigationState state) {
        RegionGraph graph = regionService.loadNeighborhood(regionId, state.getCurrentNodeId());
        return graph.node(state.getCurrentNodeId())
                .map(node -> exitMapAdapter.toExitMap(node, state.getRevealedEdgeIds()))
                .orElse(Map.of());
    }

    String describeExit(Edge edge, PlayerSnapshot player) {
        List<Condition> unmet = edge.gatingConditions().stream()
                .filter(c -> !conditionEvaluator.isMet(c, player))
                .toList();
        if (unmet.isEmpty()) {
            return edge.getLabel();
        }
        return edge.getLabel() + " (" + unmet.stream().map(Condition::describe).collect(Collectors.joining(", ")) + ")";
    }
}
