package com.dungeon.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlayerSnapshotTest {

    @Test
    @DisplayName("passive Perception is 10 + wisdom modifier + Perception skill")
    void shouldComputePassivePerception() {
        PlayerSnapshot average = PlayerSnapshot.builder().build();
        PlayerSnapshot sharp = PlayerSnapshot.builder()
                .wisdom(16)
                .skills(Map.of("perception", 4))
                .build();

        assertEquals(0, average.wisdomModifier());
        assertEquals(10, average.passivePerception());
        assertEquals(3, sharp.wisdomModifier());
        assertEquals(17, sharp.passivePerception());
    }

    @Test
    @DisplayName("skills and item tags are matched case-insensitively")
    void shouldIgnoreCase() {
        PlayerSnapshot player = PlayerSnapshot.builder()
                .skills(Map.of("Athletics", 12))
                .itemTags(Set.of("Climbing-Gear"))
                .build();

        assertEquals(12, player.skillLevel("athletics"));
        assertEquals(0, player.skillLevel("Stealth"));
        assertTrue(player.hasItem("climbing-gear"));
        assertFalse(player.hasItem("rope"));
    }
}
