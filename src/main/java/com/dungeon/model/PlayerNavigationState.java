package com.dungeon.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Player-owned navigation record. Revealed edge ids only ever grow; every
 * update returns a new instance.
 */
@Value
@Builder(toBuilder = true)
public class PlayerNavigationState {

    public static final int BREADCRUMB_LIMIT = 20;

    String playerId;
    String currentNodeId;

    @Builder.Default
    Set<String> revealedEdgeIds = Set.of();

    @Builder.Default
    List<String> breadcrumbs = List.of();

    public static PlayerNavigationState startingAt(String playerId, String nodeId) {
        return PlayerNavigationState.builder()
                .playerId(playerId)
                .currentNodeId(nodeId)
                .breadcrumbs(List.of(nodeId))
                .build();
    }

    public boolean hasRevealed(String edgeId) {
        return revealedEdgeIds.contains(edgeId);
    }

    public PlayerNavigationState reveal(Collection<String> edgeIds) {
        if (edgeIds.isEmpty() || revealedEdgeIds.containsAll(edgeIds)) {
            return this;
        }
        Set<String> merged = new LinkedHashSet<>(revealedEdgeIds);
        merged.addAll(edgeIds);
        return toBuilder().revealedEdgeIds(Collections.unmodifiableSet(merged)).build();
    }

    public PlayerNavigationState moveTo(String nodeId) {
        List<String> trail = new ArrayList<>(breadcrumbs);
        trail.add(nodeId);
        if (trail.size() > BREADCRUMB_LIMIT) {
            trail = trail.subList(trail.size() - BREADCRUMB_LIMIT, trail.size());
        }
        return toBuilder()
                .currentNodeId(nodeId)
                .breadcrumbs(List.copyOf(trail))
                .build();
    }
}
