package com.dungeon.generation;

import com.dungeon.config.GenerationSettings;
import com.dungeon.model.Condition;
import com.dungeon.model.Edge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Hides 15 to 25 percent of all directed edge references behind a Perception
 * check. Each direction of an edge pair is drawn independently.
 */
@Component
@Slf4j
public class HiddenEdgeMarker {

    static final int MIN_PERCENT = 15;
    static final int MAX_PERCENT = 25;

    private record EdgeRef(String nodeId, int index) {}

    public Map<String, List<Edge>> mark(Map<String, List<Edge>> edges, int regionDifficulty,
                                        GenerationSettings settings, Random random) {
        List<EdgeRef> refs = new ArrayList<>();
        edges.forEach((nodeId, list) -> {
            for (int i = 0; i < list.size(); i++) {
                refs.add(new EdgeRef(nodeId, i));
            }
        });

        Map<String, List<Edge>> result = new LinkedHashMap<>();
        edges.forEach((nodeId, list) -> result.put(nodeId, new ArrayList<>(list)));
        if (refs.isEmpty()) {
            return freeze(result);
        }

        double fraction = (MIN_PERCENT + random.nextDouble() * (MAX_PERCENT - MIN_PERCENT)) / 100.0;
        int count = hiddenCount(refs.size(), fraction);

        Collections.shuffle(refs, random);
        for (EdgeRef ref : refs.subList(0, count)) {
            int difficulty = settings.clampHiddenDifficulty(settings.hiddenBaseDifficulty()
                    + regionDifficulty * settings.hiddenDifficultyStep()
                    + random.nextInt(settings.hiddenDifficultyJitter()));
            List<Edge> list = result.get(ref.nodeId());
            list.set(ref.index(), list.get(ref.index()).hiddenBehind(Condition.perception(difficulty)));
        }

        log.debug("Hid {} of {} edge references", count, refs.size());
        return freeze(result);
    }

    /**
     * {@code round(total * fraction)} kept inside [15%, 25%] of the total, and at least one.
     */
    static int hiddenCount(int total, double fraction) {
        int lower = (total * MIN_PERCENT + 99) / 100;
        int upper = Math.max(lower, total * MAX_PERCENT / 100);
        int count = (int) Math.round(total * fraction);
        count = Math.max(lower, Math.min(upper, count));
        return Math.min(total, Math.max(1, count));
    }

    private Map<String, List<Edge>> freeze(Map<String, List<Edge>> edges) {
        Map<String, List<Edge>> frozen = new LinkedHashMap<>();
        edges.forEach((nodeId, list) -> frozen.put(nodeId, List.copyOf(list)));
        return frozen;
    }
}
