package com.dungeon.config;

import com.dungeon.layout.GraphLayout;

/**
 * A reusable region recipe, loaded from a JSON file.
 *
 * @param id          unique slug, e.g. "crypt-of-ash"
 * @param name        display name
 * @param description short description
 * @param theme       biome theme, e.g. "dungeon" or "cave"
 * @param difficulty  region difficulty, scales hidden-edge checks
 * @param lore        background text handed to content generation
 * @param layout      explicit layout, or null to derive one from the theme
 */
public record RegionTemplate(
        String id,
        String name,
        String description,
        String theme,
        int difficulty,
        String lore,
        LayoutDefinition layout
) {

    public GraphLayout resolveLayout() {
        return layout != null ? layout.toLayout() : GraphLayout.forBiome(theme);
    }
}
