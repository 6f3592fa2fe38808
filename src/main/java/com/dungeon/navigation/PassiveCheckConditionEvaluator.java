package com.dungeon.navigation;

import com.dungeon.model.Condition;
import com.dungeon.model.PlayerSnapshot;
import org.springframework.stereotype.Component;

/**
 * Evaluates conditions without rolling: Perception checks use passive
 * Perception, other skill checks the raw skill level, item requirements the
 * carried tags.
 */
@Component
public class PassiveCheckConditionEvaluator implements ConditionEvaluator {

    @Override
    public boolean isMet(Condition condition, PlayerSnapshot player) {
        if (condition instanceof Condition.SkillCheck check) {
            int score = check.isPerception()
                    ? player.passivePerception()
                    : player.skillLevel(check.skill());
            return score >= check.difficulty();
        }
        if (condition instanceof Condition.ItemRequired item) {
            return player.hasItem(item.itemTag());
        }
        throw new IllegalArgumentException("Unsupported condition: " + condition);
    }
}
