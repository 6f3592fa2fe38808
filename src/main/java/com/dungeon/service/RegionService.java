package com.dungeon.service;

import com.dungeon.config.RegionTemplate;
import com.dungeon.config.RegionTemplateLoader;
import com.dungeon.dto.GenerateRegionRequest;
import com.dungeon.generation.GraphGenerationService;
import com.dungeon.layout.GraphLayout;
import com.dungeon.model.Direction;
import com.dungeon.model.DirectionLabels;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import com.dungeon.model.GraphNodeEntity;
import com.dungeon.model.NodeContentEntity;
import com.dungeon.model.NodeType;
import com.dungeon.model.RegionEntity;
import com.dungeon.model.RegionGraph;
import com.dungeon.repository.GraphNodeRepository;
import com.dungeon.repository.NodeContentRepository;
import com.dungeon.repository.RegionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Region lifecycle: generation, persistence, lazy content and cross-region links.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegionService {

    private static final String DEFAULT_THEME = "dungeon";

    private final GraphGenerationService generationService;
    private final RegionTemplateLoader templateLoader;
    private final RegionRepository regionRepository;
    private final GraphNodeRepository nodeRepository;
    private final NodeContentRepository contentRepository;
    private final GraphNodeMapper nodeMapper;
    private final ContentGenerator contentGenerator;

    /**
     * Generate and persist a new region, then materialize its entry and the entry's neighbors.
     */
    @Transactional
    public RegionGraph generateRegion(GenerateRegionRequest request) {
        RegionTemplate template = request.hasTemplate() ? templateLoader.getTemplate(request.getTemplateId()) : null;

        String theme = firstNonBlank(request.getTheme(), template != null ? template.theme() : null, DEFAULT_THEME);
        int difficulty = request.getDifficulty() != null ? request.getDifficulty()
                : template != null ? template.difficulty() : 1;
        GraphLayout layout = request.getLayout() != null ? request.getLayout().toLayout()
                : template != null ? template.resolveLayout() : GraphLayout.forBiome(theme);
        long seed = request.getSeed() != null ? request.getSeed() : ThreadLocalRandom.current().nextLong();
        String regionId = UUID.randomUUID().toString();

        log.info("Generating region {} (theme {}, difficulty {}, seed {})", regionId, theme, difficulty, seed);
        RegionGraph graph = generationService.generate(regionId, layout, difficulty, seed);

        RegionEntity region = regionRepository.save(RegionEntity.builder()
                .id(regionId)
                .name(firstNonBlank(request.getName(), template != null ? template.name() : null, "Unnamed " + theme))
                .templateId(template != null ? template.id() : null)
                .theme(theme)
                .lore(firstNonBlank(request.getLore(), template != null ? template.lore() : null, null))
                .difficulty(difficulty)
                .seed(seed)
                .layoutType(layout.type())
                .entryNodeId(graph.entry().getId())
                .nodeCount(graph.size())
                .build());

        List<GraphNodeEntity> entities = new ArrayList<>(graph.size());
        for (int i = 0; i < graph.size(); i++) {
            entities.add(nodeMapper.toEntity(graph.getNodes().get(i), i));
        }
        nodeRepository.saveAll(entities);

        materialize(region, graph, graph.entry().getId());
        return graph;
    }

    public List<RegionEntity> getRegions() {
        return regionRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * @throws IllegalArgumentException if the region does not exist
     */
    public RegionEntity getRegion(String regionId) {
        return regionRepository.findById(regionId)
                .orElseThrow(() -> new IllegalArgumentException("Region not found: " + regionId));
    }

    /**
     * Rebuild the immutable graph of a stored region.
     *
     * @throws IllegalArgumentException if the region does not exist
     */
    @Transactional(readOnly = true)
    public RegionGraph loadRegion(String regionId) {
        List<GraphNodeEntity> entities = nodeRepository.findByRegionIdOrderByOrdinalAsc(regionId);
        if (entities.isEmpty()) {
            throw new IllegalArgumentException("Region not found: " + regionId);
        }
        return new RegionGraph(regionId, entities.stream().map(nodeMapper::toNode).toList());
    }

    /**
     * The region graph plus the nodes of other regions that {@code nodeId} links to.
     */
    @Transactional(readOnly = true)
    public RegionGraph loadNeighborhood(String regionId, String nodeId) {
        RegionGraph graph = loadRegion(regionId);
        Optional<GraphNode> node = graph.node(nodeId);
        if (node.isEmpty()) {
            return graph;
        }
        List<String> foreignIds = node.get().getEdges().stream()
                .map(Edge::getTargetId)
                .filter(id -> !graph.contains(id))
                .toList();
        if (foreignIds.isEmpty()) {
            return graph;
        }
        List<GraphNode> foreign = nodeRepository.findAllById(foreignIds).stream().map(nodeMapper::toNode).toList();
        return graph.withExtraNodes(foreign);
    }

    /**
     * Generate content for a node and its in-region neighbors that have none yet.
     *
     * @return number of nodes that received new content
     */
    @Transactional
    public int materializeAround(String regionId, String nodeId) {
        return materialize(getRegion(regionId), loadRegion(regionId), nodeId);
    }

    public boolean isMaterialized(String nodeId) {
        return contentRepository.existsById(nodeId);
    }

    public Optional<String> describeNode(String nodeId) {
        return contentRepository.findById(nodeId).map(NodeContentEntity::getDescription);
    }

    /**
     * Join a frontier node of one region to the first frontier node of another
     * with a mutually opposite label pair.
     */
    @Transactional
    public LinkResult linkFrontiers(String sourceRegionId, String sourceNodeId, String targetRegionId) {
        if (sourceRegionId.equals(targetRegionId)) {
            return LinkResult.failed("Cannot link region " + sourceRegionId + " to itself");
        }
        Optional<RegionEntity> sourceRegion = regionRepository.findById(sourceRegionId);
        if (sourceRegion.isEmpty()) {
            return LinkResult.failed("Unknown source region: " + sourceRegionId);
        }
        Optional<RegionEntity> targetRegion = regionRepository.findById(targetRegionId);
        if (targetRegion.isEmpty()) {
            return LinkResult.failed("Unknown target region: " + targetRegionId);
        }
        Optional<GraphNodeEntity> sourceEntity = nodeRepository.findById(sourceNodeId)
                .filter(e -> e.getRegionId().equals(sourceRegionId));
        if (sourceEntity.isEmpty()) {
            return LinkResult.failed("Node " + sourceNodeId + " is not part of region " + sourceRegionId);
        }
        GraphNode source = nodeMapper.toNode(sourceEntity.get());
        if (source.getType() != NodeType.FRONTIER) {
            return LinkResult.failed("Node " + sourceNodeId + " is not a frontier");
        }

        for (GraphNodeEntity candidateEntity : nodeRepository.findByRegionAndType(targetRegionId, NodeType.FRONTIER)) {
            GraphNode candidate = nodeMapper.toNode(candidateEntity);
            if (source.findEdgeTo(candidate.getId()).isPresent()) {
                continue;
            }
            String[] labels = freeLabelPair(source, candidate);

            sourceEntity.get().setEdgesJson(nodeMapper.writeEdges(append(source, candidate.getId(), labels[0])));
            candidateEntity.setEdgesJson(nodeMapper.writeEdges(append(candidate, source.getId(), labels[1])));
            nodeRepository.save(sourceEntity.get());
            nodeRepository.save(candidateEntity);

            ensureContent(sourceRegion.get(), source, null);
            ensureContent(targetRegion.get(), candidate, labels[1]);
            log.info("Linked {} ({}) to {} ({})", source.getId(), labels[0], candidate.getId(), labels[1]);
            return LinkResult.linked(source.getId(), candidate.getId(), labels[0], labels[1]);
        }
        return LinkResult.failed("Region " + targetRegionId + " has no frontier available for linking");
    }

    // ── helpers ─────────────────────────────────────────────────────────

    private int materialize(RegionEntity region, RegionGraph graph, String nodeId) {
        GraphNode center = graph.node(nodeId)
                .orElseThrow(() -> new IllegalArgumentException("Node " + nodeId + " is not part of region " + region.getId()));

        Map<String, String> pending = new LinkedHashMap<>();
        pending.put(center.getId(), null);
        for (Edge edge : center.getEdges()) {
            if (graph.contains(edge.getTargetId())) {
                pending.putIfAbsent(edge.getTargetId(), edge.getLabel());
            }
        }

        int created = 0;
        for (Map.Entry<String, String> entry : pending.entrySet()) {
            GraphNode node = graph.node(entry.getKey()).orElseThrow();
            if (ensureContent(region, node, entry.getValue())) {
                created++;
            }
        }
        log.debug("Materialized {} node(s) around {}", created, nodeId);
        return created;
    }

    private boolean ensureContent(RegionEntity region, GraphNode node, String directionHint) {
        if (contentRepository.existsById(node.getId())) {
            return false;
        }
        String description = contentGenerator.generate(new ContentContext(region.getId(), node.getId(),
                region.getTheme(), region.getLore(), region.getDifficulty(), node.getType(), directionHint));
        contentRepository.save(NodeContentEntity.builder()
                .nodeId(node.getId())
                .regionId(region.getId())
                .description(description)
                .build());
        return true;
    }

    /**
     * Vertical pair first, then a synthetic passage pair with an index free on both nodes.
     */
    private String[] freeLabelPair(GraphNode source, GraphNode target) {
        for (Direction direction : List.of(Direction.UP, Direction.DOWN)) {
            String forward = direction.label();
            String reverse = direction.opposite().label();
            if (source.findEdge(forward).isEmpty() && target.findEdge(reverse).isEmpty()) {
                return new String[]{forward, reverse};
            }
        }
        int index = 1;
        while (source.findEdge(DirectionLabels.passage(index)).isPresent()
                || target.findEdge(DirectionLabels.passageBack(index)).isPresent()) {
            index++;
        }
        return new String[]{DirectionLabels.passage(index), DirectionLabels.passageBack(index)};
    }

    private List<Edge> append(GraphNode node, String targetId, String label) {
        List<Edge> edges = new ArrayList<>(node.getEdges());
        edges.add(Edge.builder()
                .targetId(targetId)
                .label(label)
                .sourcePosition(node.getPosition())
                .build());
        return edges;
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return fallback;
    }
}
