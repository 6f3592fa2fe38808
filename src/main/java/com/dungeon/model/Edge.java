package com.dungeon.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One-way labeled connection from a node to {@link #targetId}.
 */
@Value
@Builder(toBuilder = true)
public class Edge {

    String targetId;
    String label;
    boolean hidden;

    @Builder.Default
    List<Condition> conditions = List.of();

    /** Radians in [0, 2π), or null when either endpoint has no coordinates. */
    Double bearing;

    @Builder.Default
    Position sourcePosition = Position.none();

    @Builder.Default
    Position targetPosition = Position.none();

    /**
     * Identifier used to record revealed hidden edges on a player.
     */
    public static String edgeId(String sourceId, String targetId) {
        return sourceId + "->" + targetId;
    }

    public String edgeId(String sourceId) {
        return edgeId(sourceId, targetId);
    }

    public boolean hasLabel(String text) {
        return text != null && label.equalsIgnoreCase(text.trim());
    }

    /**
     * Copy of this edge marked hidden with {@code check} appended to its conditions.
     */
    public Edge hiddenBehind(Condition check) {
        List<Condition> extended = new ArrayList<>(conditions);
        extended.add(check);
        return toBuilder()
                .hidden(true)
                .conditions(List.copyOf(extended))
                .build();
    }

    /** Perception checks, which govern discovery of a hidden edge. */
    public List<Condition> discoveryChecks() {
        return conditions.stream()
                .filter(c -> c instanceof Condition.SkillCheck check && check.isPerception())
                .toList();
    }

    /** Everything except Perception checks. */
    public List<Condition> gatingConditions() {
        return conditions.stream()
                .filter(c -> !(c instanceof Condition.SkillCheck check && check.isPerception()))
                .toList();
    }
}
