package com.dungeon.service;

import com.dungeon.model.NodeType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic descriptions built from fixed phrases, used when no language
 * model is wired in. The same node always gets the same text.
 */
@Component
public class TemplateContentGenerator implements ContentGenerator {

    private static final Map<NodeType, List<String>> ROLE_PHRASES = Map.of(
            NodeType.HUB, List.of("a wide gathering place where many paths meet",
                    "a broad chamber that feels like the heart of the place"),
            NodeType.BOSS, List.of("an oppressive hall where something powerful waits",
                    "a silent vault heavy with menace"),
            NodeType.FRONTIER, List.of("a ragged edge where the region gives way to the unknown",
                    "a half-finished passage that seems to lead beyond"),
            NodeType.DEAD_END, List.of("a cramped nook with no way onward",
                    "a collapsed end where the path simply stops"),
            NodeType.BRANCHING, List.of("a junction splitting in several directions",
                    "a crossing of worn paths"),
            NodeType.LINEAR, List.of("a narrow stretch leading onward",
                    "a quiet passage between places"),
            NodeType.QUESTABLE, List.of("a place that feels important to someone",
                    "a spot marked by old purpose"));

    private static final Map<String, String> THEME_NOUNS = Map.of(
            "dungeon", "stone corridors",
            "cave", "damp rock",
            "mine", "timber-propped tunnels",
            "forest", "tangled undergrowth",
            "temple", "carved pillars",
            "ruins", "broken masonry",
            "tower", "winding stairs",
            "building", "dusty rooms");

    @Override
    public String generate(ContentContext context) {
        String theme = context.theme() == null ? "" : context.theme().toLowerCase(Locale.ROOT);
        String noun = THEME_NOUNS.getOrDefault(theme, "shadowed halls");
        List<String> phrases = ROLE_PHRASES.get(context.type() != null ? context.type() : NodeType.LINEAR);
        String phrase = phrases.get(Math.floorMod(context.nodeId().hashCode(), phrases.size()));

        StringBuilder text = new StringBuilder()
                .append("Among the ").append(noun).append(", you find ").append(phrase).append('.');
        if (context.directionHint() != null) {
            text.append(" The way ").append(context.directionHint()).append(" leads here.");
        }
        if (context.difficulty() >= 5) {
            text.append(" The air carries a sense of danger.");
        }
        return text.toString();
    }
}
