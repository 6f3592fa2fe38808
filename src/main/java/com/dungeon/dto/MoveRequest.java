package com.dungeon.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for a movement request. Either {@code direction} (an exit label or
 * direction word) or free-text {@code intent} must be given.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoveRequest {

    @NotNull(message = "Player state is required")
    @Valid
    private PlayerStateDTO player;

    @Valid
    private PlayerSnapshotDTO snapshot;

    private String direction;

    private String intent;

    public PlayerSnapshotDTO getSnapshot() {
        return snapshot != null ? snapshot : new PlayerSnapshotDTO();
    }

    public boolean hasDirection() {
        return direction != null && !direction.isBlank();
    }

    public boolean hasIntent() {
        return intent != null && !intent.isBlank();
    }
}
