package com.dungeon.navigation;

import com.dungeon.model.Condition;
import com.dungeon.model.Edge;
import com.dungeon.model.PlayerNavigationState;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of a movement request. A denial carries the caller's state unchanged.
 */
@Value
@Builder
public class MoveOutcome {

    boolean moved;
    DenialReason reason;
    String message;
    PlayerNavigationState state;
    Edge traversed;

    /** Region of the node the player ends up on; null for denials. */
    String regionId;

    @Builder.Default
    List<String> revealedEdgeIds = List.of();

    @Builder.Default
    List<Condition> unmetConditions = List.of();

    @Builder.Default
    List<String> suggestions = List.of();

    public static MoveOutcome moved(PlayerNavigationState state, Edge traversed, String regionId,
                                    List<String> revealedEdgeIds) {
        return MoveOutcome.builder()
                .moved(true)
                .regionId(regionId)
                .message("You go " + traversed.getLabel() + ".")
                .state(state)
                .traversed(traversed)
                .revealedEdgeIds(List.copyOf(revealedEdgeIds))
                .build();
    }

    public static MoveOutcome denied(DenialReason reason, String message, PlayerNavigationState state) {
        return MoveOutcome.builder()
                .moved(false)
                .reason(reason)
                .message(message)
                .state(state)
                .build();
    }
}
