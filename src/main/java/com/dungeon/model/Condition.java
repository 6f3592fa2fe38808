package com.dungeon.model;

/**
 * Access requirement attached to an edge. Every condition on an edge must hold to traverse it.
 */
public sealed interface Condition permits Condition.SkillCheck, Condition.ItemRequired {

    String PERCEPTION = "Perception";

    /**
     * Short player-facing hint, e.g. {@code requires Perception 15}.
     */
    String describe();

    static SkillCheck perception(int difficulty) {
        return new SkillCheck(PERCEPTION, difficulty);
    }

    record SkillCheck(String skill, int difficulty) implements Condition {

        public boolean isPerception() {
            return PERCEPTION.equalsIgnoreCase(skill);
        }

        @Override
        public String describe() {
            return "requires " + skill + " " + difficulty;
        }
    }

    record ItemRequired(String itemTag) implements Condition {

        @Override
        public String describe() {
            return "requires " + itemTag;
        }
    }
}
