package com.dungeon.navigation;

import com.dungeon.model.Condition;
import com.dungeon.model.PlayerSnapshot;

/**
 * Decides whether a player meets an edge condition.
 */
public interface ConditionEvaluator {

    boolean isMet(Condition condition, PlayerSnapshot player);
}
