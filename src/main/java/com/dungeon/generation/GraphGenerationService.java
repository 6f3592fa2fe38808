package com.dungeon.generation;

import com.dungeon.config.GenerationSettings;
import com.dungeon.exception.GraphGenerationException;
import com.dungeon.layout.GraphLayout;
import com.dungeon.layout.LayoutNode;
import com.dungeon.layout.LayoutStrategyFactory;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import com.dungeon.model.NodeType;
import com.dungeon.model.RegionGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Runs the generation pipeline for one region: layout, spanning tree, loops,
 * direction labels, node roles and hidden edges, followed by validation.
 * <p>
 * A single {@link Random} seeded from the request drives every step, so the
 * same seed and layout always produce the same graph. No I/O happens here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphGenerationService {

    private final LayoutStrategyFactory layoutFactory;
    private final SpanningTreeConnector spanningTreeConnector;
    private final LoopAugmenter loopAugmenter;
    private final DirectionAssigner directionAssigner;
    private final NodeTypeClassifier nodeTypeClassifier;
    private final HiddenEdgeMarker hiddenEdgeMarker;
    private final GraphValidator graphValidator;
    private final GenerationSettings settings;

    /**
     * Generate a region graph.
     *
     * @throws GraphGenerationException if the layout is empty or the result fails validation
     */
    public RegionGraph generate(String regionId, GraphLayout layout, int difficulty, long seed) {
        Random random = new Random(seed);

        List<LayoutNode> layoutNodes = layoutFactory.layout(regionId, layout, random);
        List<UndirectedEdge> tree = spanningTreeConnector.connect(layoutNodes);
        List<UndirectedEdge> loops = loopAugmenter.augment(layoutNodes.size(), tree, layout.loopFrequency(), random);

        List<UndirectedEdge> all = new ArrayList<>(tree);
        all.addAll(loops);
        Map<String, List<Edge>> edges = directionAssigner.assign(layoutNodes, all);

        List<String> nodeIds = layoutNodes.stream().map(LayoutNode::id).toList();
        Map<String, NodeType> types = nodeTypeClassifier.classify(nodeIds, edges, settings, random);
        Map<String, List<Edge>> marked = hiddenEdgeMarker.mark(edges, difficulty, settings, random);

        List<GraphNode> nodes = new ArrayList<>(layoutNodes.size());
        for (LayoutNode layoutNode : layoutNodes) {
            nodes.add(GraphNode.builder()
                    .id(layoutNode.id())
                    .position(layoutNode.position())
                    .type(types.get(layoutNode.id()))
                    .regionId(regionId)
                    .edges(marked.get(layoutNode.id()))
                    .build());
        }
        RegionGraph graph = new RegionGraph(regionId, nodes);

        ValidationResult validation = graphValidator.validate(graph, settings.minFrontiers());
        if (!validation.isValid()) {
            log.warn("Region {} failed validation with seed {}: {}", regionId, seed, validation.reasons());
            throw new GraphGenerationException("Generated region " + regionId + " is invalid", validation.reasons());
        }

        log.info("Generated region {} ({}): {} nodes, {} tree edges, {} loop edges, average degree {}",
                regionId, layout.type(), graph.size(), tree.size(), loops.size(),
                String.format(Locale.ROOT, "%.2f", graph.averageDegree()));
        return graph;
    }
}
