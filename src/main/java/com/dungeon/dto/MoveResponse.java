package com.dungeon.dto;

import com.dungeon.model.Condition;
import com.dungeon.navigation.DenialReason;
import com.dungeon.navigation.MoveOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for the result of a movement request, including what the player sees next.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoveResponse {

    private boolean moved;
    private DenialReason reason;
    private String message;
    private String regionId;
    private PlayerStateDTO player;
    private EdgeDTO traversed;
    private List<String> revealedEdgeIds;
    private List<String> unmetConditions;
    private List<String> suggestions;
    private List<String> exits;
    private String description;

    public static MoveResponse fromOutcome(MoveOutcome outcome, String regionId, List<String> exits, String description) {
        return MoveResponse.builder()
                .moved(outcome.isMoved())
                .reason(outcome.getReason())
                .message(outcome.getMessage())
                .regionId(regionId)
                .player(PlayerStateDTO.fromState(outcome.getState()))
                .traversed(outcome.getTraversed() != null ? EdgeDTO.fromEdge(outcome.getTraversed()) : null)
                .revealedEdgeIds(outcome.getRevealedEdgeIds())
                .unmetConditions(outcome.getUnmetConditions().stream().map(Condition::describe).toList())
                .suggestions(outcome.getSuggestions())
                .exits(exits)
                .description(description)
                .build();
    }
}
