package com.dungeon.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Stats, skills and carried items of a player at the moment of a movement request.
 */
@Value
@Builder
public class PlayerSnapshot {

    @Builder.Default
    int wisdom = 10;

    @Builder.Default
    Map<String, Integer> skills = Map.of();

    @Builder.Default
    Set<String> itemTags = Set.of();

    public int skillLevel(String skill) {
        return skills.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(skill))
                .mapToInt(Map.Entry::getValue)
                .findFirst()
                .orElse(0);
    }

    public int wisdomModifier() {
        return wisdom / 2 - 5;
    }

    /**
     * Baseline Perception score used against hidden-edge difficulty without an explicit search.
     */
    public int passivePerception() {
        return 10 + wisdomModifier() + skillLevel(Condition.PERCEPTION);
    }

    public boolean hasItem(String tag) {
        return itemTags.stream().anyMatch(t -> t.equalsIgnoreCase(tag));
    }
}
