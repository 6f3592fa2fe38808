package com.dungeon.dto;

import com.dungeon.model.PlayerSnapshot;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * DTO for the player stats that movement checks read.
 * Uses an Integer wrapper so an absent wisdom falls back to the average score.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerSnapshotDTO {

    private Integer wisdom;
    private Map<String, @NotNull(message = "Skill levels must not be null") Integer> skills;
    private Set<@NotBlank(message = "Item tags must not be blank") String> itemTags;

    public PlayerSnapshot toSnapshot() {
        return PlayerSnapshot.builder()
                .wisdom(wisdom != null ? wisdom : 10)
                .skills(skills != null ? Map.copyOf(skills) : Map.of())
                .itemTags(itemTags != null ? Set.copyOf(itemTags) : Set.of())
                .build();
    }
}
