package com.dungeon.service;

import com.dungeon.config.LayoutDefinition;
import com.dungeon.config.RegionTemplate;
import com.dungeon.config.RegionTemplateLoader;
import com.dungeon.dto.GenerateRegionRequest;
import com.dungeon.generation.GraphGenerationService;
import com.dungeon.layout.GraphLayout;
import com.dungeon.layout.LayoutType;
import com.dungeon.model.Edge;
import com.dungeon.model.GraphNode;
import com.dungeon.model.GraphNodeEntity;
import com.dungeon.model.NodeContentEntity;
import com.dungeon.model.NodeType;
import com.dungeon.model.Position;
import com.dungeon.model.RegionEntity;
import com.dungeon.model.RegionGraph;
import com.dungeon.repository.GraphNodeRepository;
import com.dungeon.repository.NodeContentRepository;
import com.dungeon.repository.RegionRepository;
import tools.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RegionService with mocked repositories.
 */
@ExtendWith(MockitoExtension.class)
class RegionServiceTest {

    @Mock private GraphGenerationService generationService;
    @Mock private RegionTemplateLoader templateLoader;
    @Mock private RegionRepository regionRepository;
    @Mock private GraphNodeRepository nodeRepository;
    @Mock private NodeContentRepository contentRepository;
    @Mock private ContentGenerator contentGenerator;

    private final GraphNodeMapper mapper = new GraphNodeMapper(new ObjectMapper());
    private RegionService service;

    @BeforeEach
    void setUp() {
        service = new RegionService(generationService, templateLoader, regionRepository, nodeRepository,
                contentRepository, mapper, contentGenerator);
    }

    private static GraphNode node(String id, String regionId, NodeType type, Edge... edges) {
        return GraphNode.builder()
                .id(id)
                .position(Position.none())
                .type(type)
                .regionId(regionId)
                .edges(List.of(edges))
                .build();
    }

    private static Edge edge(String target, String label) {
        return Edge.builder().targetId(target).label(label).build();
    }

    /** Triangle: hub 0 links to 1 and 2, which link to each other. */
    private static RegionGraph triangle(String regionId) {
        return new RegionGraph(regionId, List.of(
                node(regionId + ":0", regionId, NodeType.HUB, edge(regionId + ":1", "up"), edge(regionId + ":2", "down")),
                node(regionId + ":1", regionId, NodeType.FRONTIER, edge(regionId + ":0", "down"), edge(regionId + ":2", "up")),
                node(regionId + ":2", regionId, NodeType.FRONTIER, edge(regionId + ":0", "up"), edge(regionId + ":1", "down"))));
    }

    private static RegionEntity region(String id) {
        return RegionEntity.builder()
                .id(id)
                .name("Region " + id)
                .theme("cave")
                .difficulty(2)
                .layoutType(LayoutType.FLOOD_FILL)
                .entryNodeId(id + ":0")
                .build();
    }

    private List<GraphNodeEntity> entities(RegionGraph graph) {
        List<GraphNode> nodes = graph.getNodes();
        return java.util.stream.IntStream.range(0, nodes.size())
                .mapToObj(i -> mapper.toEntity(nodes.get(i), i))
                .toList();
    }

    // ── generateRegion ───────────────────────────────────────────────────

    @Nested
    @DisplayName("generateRegion")
    class GenerateRegion {

        @Test
        @DisplayName("should generate from a template and persist region, nodes and entry content")
        @SuppressWarnings("unchecked")
        void shouldGenerateFromTemplate() {
            RegionTemplate crypt = new RegionTemplate("crypt-of-ash", "Crypt of Ash", "Vaults", "dungeon", 3,
                    "Burned long ago",
                    new LayoutDefinition(LayoutType.GRID, 3, 3, null, null, null, null, 0.5));
            when(templateLoader.getTemplate("crypt-of-ash")).thenReturn(crypt);
            when(generationService.generate(anyString(), eq(new GraphLayout.Grid(3, 3, 0.5)), eq(3), eq(42L)))
                    .thenReturn(triangle("r"));
            when(regionRepository.save(any(RegionEntity.class))).thenAnswer(inv -> inv.getArgument(0));
            when(contentRepository.existsById(anyString())).thenReturn(false);
            when(contentGenerator.generate(any(ContentContext.class))).thenReturn("A dark vault.");

            RegionGraph graph = service.generateRegion(GenerateRegionRequest.builder()
                    .templateId("crypt-of-ash")
                    .seed(42L)
                    .build());

            assertEquals(3, graph.size());

            ArgumentCaptor<RegionEntity> region = ArgumentCaptor.forClass(RegionEntity.class);
            verify(regionRepository).save(region.capture());
            assertEquals("Crypt of Ash", region.getValue().getName());
            assertEquals("crypt-of-ash", region.getValue().getTemplateId());
            assertEquals("dungeon", region.getValue().getTheme());
            assertEquals(3, region.getValue().getDifficulty());
            assertEquals(42L, region.getValue().getSeed());
            assertEquals(LayoutType.GRID, region.getValue().getLayoutType());
            assertEquals("r:0", region.getValue().getEntryNodeId());
            assertEquals(3, region.getValue().getNodeCount());

            ArgumentCaptor<List<GraphNodeEntity>> nodes = ArgumentCaptor.forClass(List.class);
            verify(nodeRepository).saveAll(nodes.capture());
            assertEquals(List.of(0, 1, 2), nodes.getValue().stream().map(GraphNodeEntity::getOrdinal).toList());

            verify(contentRepository, times(3)).save(any(NodeContentEntity.class));
        }

        @Test
        @DisplayName("explicit request fields override the theme defaults")
        void shouldUseRequestFields() {
            when(generationService.generate(anyString(), eq(GraphLayout.forBiome("cave")), eq(1), anyLong()))
                    .thenReturn(triangle("r"));
            when(regionRepository.save(any(RegionEntity.class))).thenAnswer(inv -> inv.getArgument(0));
            when(contentRepository.existsById(anyString())).thenReturn(true);

            service.generateRegion(GenerateRegionRequest.builder().name("Echo Hollow").theme("cave").build());

            ArgumentCaptor<RegionEntity> region = ArgumentCaptor.forClass(RegionEntity.class);
            verify(regionRepository).save(region.capture());
            assertEquals("Echo Hollow", region.getValue().getName());
            assertNull(region.getValue().getTemplateId());
            verify(templateLoader, never()).getTemplate(anyString());
            verify(contentGenerator, never()).generate(any());
        }

        @Test
        @DisplayName("an explicit layout wins over the theme")
        void shouldUseExplicitLayout() {
            when(generationService.generate(anyString(), eq(new GraphLayout.Bsp(4, 3, 0.5)), anyInt(), eq(9L)))
                    .thenReturn(triangle("r"));
            when(regionRepository.save(any(RegionEntity.class))).thenAnswer(inv -> inv.getArgument(0));
            when(contentRepository.existsById(anyString())).thenReturn(true);

            service.generateRegion(GenerateRegionRequest.builder()
                    .theme("cave")
                    .seed(9L)
                    .layout(new LayoutDefinition(LayoutType.BSP, null, null, 4, 3, null, null, null))
                    .build());

            verify(nodeRepository).saveAll(any());
        }
    }

    // ── lookup ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("getRegion() should throw for an unknown region")
    void shouldThrowForUnknownRegion() {
        when(regionRepository.findById("missing")).thenReturn(Optional.empty());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> service.getRegion("missing"));
        assertEquals("Region not found: missing", ex.getMessage());
    }

    @Test
    @DisplayName("loadRegion() should rebuild the graph in generation order")
    void shouldLoadRegion() {
        RegionGraph stored = triangle("r");
        when(nodeRepository.findByRegionIdOrderByOrdinalAsc("r")).thenReturn(entities(stored));

        RegionGraph loaded = service.loadRegion("r");

        assertEquals(stored.getNodes(), loaded.getNodes());
        assertEquals("r:0", loaded.entry().getId());
    }

    @Test
    @DisplayName("loadRegion() should throw when no node is stored")
    void shouldThrowForRegionWithoutNodes() {
        when(nodeRepository.findByRegionIdOrderByOrdinalAsc("r")).thenReturn(List.of());

        assertThrows(IllegalArgumentException.class, () -> service.loadRegion("r"));
    }

    @Test
    @DisplayName("loadNeighborhood() should pull in nodes of linked regions")
    void shouldLoadForeignNeighbors() {
        GraphNode linked = node("a:0", "a", NodeType.HUB, edge("b:5", "passage-1"));
        GraphNode foreign = node("b:5", "b", NodeType.FRONTIER, edge("a:0", "passage-back-1"));
        when(nodeRepository.findByRegionIdOrderByOrdinalAsc("a")).thenReturn(List.of(mapper.toEntity(linked, 0)));
        when(nodeRepository.findAllById(List.of("b:5"))).thenReturn(List.of(mapper.toEntity(foreign, 5)));

        RegionGraph graph = service.loadNeighborhood("a", "a:0");

        assertEquals(2, graph.size());
        assertEquals("b", graph.node("b:5").orElseThrow().getRegionId());
    }

    @Test
    @DisplayName("materializeAround() should only generate missing content")
    void shouldMaterializeMissingContent() {
        when(regionRepository.findById("r")).thenReturn(Optional.of(region("r")));
        when(nodeRepository.findByRegionIdOrderByOrdinalAsc("r")).thenReturn(entities(triangle("r")));
        when(contentRepository.existsById("r:1")).thenReturn(true);
        when(contentRepository.existsById("r:0")).thenReturn(false);
        when(contentRepository.existsById("r:2")).thenReturn(false);
        when(contentGenerator.generate(any(ContentContext.class))).thenReturn("text");

        int created = service.materializeAround("r", "r:1");

        assertEquals(2, created);
        ArgumentCaptor<ContentContext> context = ArgumentCaptor.forClass(ContentContext.class);
        verify(contentGenerator, times(2)).generate(context.capture());
        assertEquals("cave", context.getAllValues().get(0).theme());
        assertEquals("down", context.getAllValues().get(0).directionHint());
    }

    @Test
    @DisplayName("describeNode() should return stored content")
    void shouldDescribeNode() {
        when(contentRepository.findById("r:0"))
                .thenReturn(Optional.of(NodeContentEntity.builder().nodeId("r:0").description("A hall.").build()));

        assertEquals(Optional.of("A hall."), service.describeNode("r:0"));
    }

    // ── linkFrontiers ────────────────────────────────────────────────────

    @Nested
    @DisplayName("linkFrontiers")
    class LinkFrontiers {

        @Test
        @DisplayName("should join two frontiers with an opposite label pair")
        void shouldLinkFrontiers() {
            RegionGraph source = triangle("a");
            RegionGraph target = triangle("b");
            GraphNodeEntity sourceEntity = mapper.toEntity(source.node("a:1").orElseThrow(), 1);
            GraphNodeEntity targetEntity = mapper.toEntity(target.node("b:2").orElseThrow(), 2);
            when(regionRepository.findById("a")).thenReturn(Optional.of(region("a")));
            when(regionRepository.findById("b")).thenReturn(Optional.of(region("b")));
            when(nodeRepository.findById("a:1")).thenReturn(Optional.of(sourceEntity));
            when(nodeRepository.findByRegionAndType("b", NodeType.FRONTIER)).thenReturn(List.of(targetEntity));
            when(contentRepository.existsById(anyString())).thenReturn(true);

            LinkResult result = service.linkFrontiers("a", "a:1", "b");

            assertTrue(result.isLinked(), result.getFailureReason());
            assertEquals("b:2", result.getTargetNodeId());
            assertEquals("passage-1", result.getLabel());
            assertEquals("passage-back-1", result.getReverseLabel());

            GraphNode updatedSource = mapper.toNode(sourceEntity);
            GraphNode updatedTarget = mapper.toNode(targetEntity);
            assertEquals("b:2", updatedSource.findEdge("passage-1").orElseThrow().getTargetId());
            assertEquals("a:1", updatedTarget.findEdge("passage-back-1").orElseThrow().getTargetId());
            verify(nodeRepository).save(sourceEntity);
            verify(nodeRepository).save(targetEntity);
        }

        @Test
        @DisplayName("should prefer a free vertical pair and skip frontiers already linked")
        void shouldPreferVerticalPair() {
            GraphNode source = node("a:1", "a", NodeType.FRONTIER, edge("a:0", "up"), edge("b:7", "passage-1"));
            GraphNode linked = node("b:7", "b", NodeType.FRONTIER, edge("a:1", "passage-back-1"));
            GraphNode fresh = node("b:8", "b", NodeType.FRONTIER, edge("b:0", "north"));
            GraphNodeEntity sourceEntity = mapper.toEntity(source, 1);
            when(regionRepository.findById("a")).thenReturn(Optional.of(region("a")));
            when(regionRepository.findById("b")).thenReturn(Optional.of(region("b")));
            when(nodeRepository.findById("a:1")).thenReturn(Optional.of(sourceEntity));
            when(nodeRepository.findByRegionAndType("b", NodeType.FRONTIER))
                    .thenReturn(List.of(mapper.toEntity(linked, 7), mapper.toEntity(fresh, 8)));
            when(contentRepository.existsById(anyString())).thenReturn(true);

            LinkResult result = service.linkFrontiers("a", "a:1", "b");

            assertEquals("b:8", result.getTargetNodeId());
            assertEquals("down", result.getLabel());
            assertEquals("up", result.getReverseLabel());
        }

        @Test
        @DisplayName("should report failures instead of throwing")
        void shouldReportFailures() {
            assertEquals("Cannot link region a to itself", service.linkFrontiers("a", "a:1", "a").getFailureReason());

            when(regionRepository.findById("a")).thenReturn(Optional.of(region("a")));
            when(regionRepository.findById("zz")).thenReturn(Optional.empty());
            assertEquals("Unknown target region: zz", service.linkFrontiers("a", "a:1", "zz").getFailureReason());
        }

        @Test
        @DisplayName("should refuse a source node that is not a frontier")
        void shouldRefuseNonFrontierSource() {
            when(regionRepository.findById("a")).thenReturn(Optional.of(region("a")));
            when(regionRepository.findById("b")).thenReturn(Optional.of(region("b")));
            when(nodeRepository.findById("a:0")).thenReturn(Optional.of(mapper.toEntity(triangle("a").entry(), 0)));

            LinkResult result = service.linkFrontiers("a", "a:0", "b");

            assertFalse(result.isLinked());
            assertEquals("Node a:0 is not a frontier", result.getFailureReason());
        }

        @Test
        @DisplayName("should fail when the target region has no frontier left")
        void shouldFailWithoutTargetFrontier() {
            when(regionRepository.findById("a")).thenReturn(Optional.of(region("a")));
            when(regionRepository.findById("b")).thenReturn(Optional.of(region("b")));
            when(nodeRepository.findById("a:1"))
                    .thenReturn(Optional.of(mapper.toEntity(triangle("a").node("a:1").orElseThrow(), 1)));
            when(nodeRepository.findByRegionAndType("b", NodeType.FRONTIER)).thenReturn(List.of());

            LinkResult result = service.linkFrontiers("a", "a:1", "b");

            assertFalse(result.isLinked());
            assertTrue(result.getFailureReason().contains("no frontier available"));
        }
    }
}
