package com.dungeon.dto;

import com.dungeon.model.PlayerNavigationState;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wire form of a player's navigation state. The client keeps it between moves.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerStateDTO {

    @NotBlank(message = "Player id is required")
    private String playerId;

    @NotBlank(message = "Current node is required")
    private String currentNodeId;

    private Set<String> revealedEdgeIds;
    private List<String> breadcrumbs;

    public PlayerNavigationState toState() {
        return PlayerNavigationState.builder()
                .playerId(playerId)
                .currentNodeId(currentNodeId)
                .revealedEdgeIds(revealedEdgeIds != null ? Set.copyOf(revealedEdgeIds) : Set.of())
                .breadcrumbs(breadcrumbs != null ? List.copyOf(breadcrumbs) : List.of(currentNodeId))
                .build();
    }

    public static PlayerStateDTO fromState(PlayerNavigationState state) {
        return PlayerStateDTO.builder()
                .playerId(state.getPlayerId())
                .currentNodeId(state.getCurrentNodeId())
                .revealedEdgeIds(new LinkedHashSet<>(state.getRevealedEdgeIds()))
                .breadcrumbs(new ArrayList<>(state.getBreadcrumbs()))
                .build();
    }
}
