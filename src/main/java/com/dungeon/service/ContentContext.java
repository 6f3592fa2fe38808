package com.dungeon.service;

import com.dungeon.model.NodeType;

/**
 * Everything a content generator may use to describe a node.
 *
 * @param regionId      owning region
 * @param nodeId        node being described
 * @param theme         region biome theme
 * @param lore          region background text, may be null
 * @param difficulty    region difficulty
 * @param type          structural role of the node
 * @param directionHint label of the edge the player will arrive through, may be null
 */
public record ContentContext(
        String regionId,
        String nodeId,
        String theme,
        String lore,
        int difficulty,
        NodeType type,
        String directionHint
) {}
