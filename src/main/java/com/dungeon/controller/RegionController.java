package com.dungeon.controller;

import com.dungeon.config.RegionTemplateLoader;
import com.dungeon.dto.GenerateRegionRequest;
import com.dungeon.dto.LinkRequest;
import com.dungeon.dto.MoveRequest;
import com.dungeon.dto.MoveResponse;
import com.dungeon.dto.NodeDTO;
import com.dungeon.dto.PlayerStateDTO;
import com.dungeon.dto.RegionDTO;
import com.dungeon.dto.RegionTemplateDTO;
import com.dungeon.model.GraphNode;
import com.dungeon.model.PlayerNavigationState;
import com.dungeon.model.PlayerSnapshot;
import com.dungeon.model.RegionGraph;
import com.dungeon.navigation.MoveOutcome;
import com.dungeon.service.LinkResult;
import com.dungeon.service.NavigationService;
import com.dungeon.service.RegionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for region generation and navigation.
 */
@RestController
@RequestMapping("/api/regions")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class RegionController {

    private final RegionService regionService;
    private final NavigationService navigationService;
    private final RegionTemplateLoader templateLoader;

    /**
     * List available region templates.
     */
    @GetMapping("/templates")
    public ResponseEntity<List<RegionTemplateDTO>> getTemplates() {
        List<RegionTemplateDTO> templates = templateLoader.getAvailableTemplates().stream()
                .map(RegionTemplateDTO::fromTemplate)
                .toList();
        return ResponseEntity.ok(templates);
    }

    /**
     * Generate a new region.
     */
    @PostMapping
    public ResponseEntity<RegionDTO> generateRegion(@Valid @RequestBody GenerateRegionRequest request) {
        log.info("Generating region from template {} / theme {}", request.getTemplateId(), request.getTheme());
        RegionGraph graph = regionService.generateRegion(request);
        return ResponseEntity.ok(RegionDTO.fromRegion(regionService.getRegion(graph.getRegionId()), graph));
    }

    /**
     * List generated regions, newest first.
     */
    @GetMapping
    public ResponseEntity<List<RegionDTO>> getRegions() {
        return ResponseEntity.ok(regionService.getRegions().stream().map(RegionDTO::fromRegion).toList());
    }

    /**
     * Get a region with its full graph.
     */
    @GetMapping("/{regionId}")
    public ResponseEntity<RegionDTO> getRegion(@PathVariable String regionId) {
        return ResponseEntity.ok(RegionDTO.fromRegion(regionService.getRegion(regionId), regionService.loadRegion(regionId)));
    }

    /**
     * Get one node with its description, if materialized.
     */
    @GetMapping("/{regionId}/nodes/{nodeId}")
    public ResponseEntity<NodeDTO> getNode(@PathVariable String regionId, @PathVariable String nodeId) {
        GraphNode node = regionService.loadRegion(regionId).node(nodeId)
                .orElseThrow(() -> new IllegalArgumentException("Node " + nodeId + " is not part of region " + regionId));
        NodeDTO dto = NodeDTO.fromNode(node);
        dto.setDescription(regionService.describeNode(nodeId).orElse(null));
        return ResponseEntity.ok(dto);
    }

    /**
     * Place a player at the region entry.
     */
    @PostMapping("/{regionId}/enter")
    public ResponseEntity<PlayerStateDTO> enterRegion(@PathVariable String regionId, @RequestParam String playerId) {
        return ResponseEntity.ok(PlayerStateDTO.fromState(navigationService.enterRegion(regionId, playerId)));
    }

    /**
     * Move a player by exit label or free text.
     */
    @PostMapping("/{regionId}/move")
    public ResponseEntity<MoveResponse> move(@PathVariable String regionId, @Valid @RequestBody MoveRequest request) {
        if (!request.hasDirection() && !request.hasIntent()) {
            throw new IllegalArgumentException("Either direction or intent is required");
        }
        PlayerNavigationState state = request.getPlayer().toState();
        PlayerSnapshot snapshot = request.getSnapshot().toSnapshot();

        MoveOutcome outcome = request.hasDirection()
                ? navigationService.move(regionId, state, snapshot, request.getDirection())
                : navigationService.moveByIntent(regionId, state, snapshot, request.getIntent());

        String currentRegion = outcome.getRegionId() != null ? outcome.getRegionId() : regionId;
        PlayerNavigationState after = outcome.getState();
        List<String> exits = navigationService.visibleExits(currentRegion, after, snapshot);
        String description = regionService.describeNode(after.getCurrentNodeId()).orElse(null);
        return ResponseEntity.ok(MoveResponse.fromOutcome(outcome, currentRegion, exits, description));
    }

    /**
     * Link a frontier node of this region to another region.
     */
    @PostMapping("/{regionId}/link")
    public ResponseEntity<LinkResult> linkFrontiers(@PathVariable String regionId, @Valid @RequestBody LinkRequest request) {
        LinkResult result = regionService.linkFrontiers(regionId, request.getSourceNodeId(), request.getTargetRegionId());
        if (!result.isLinked()) {
            log.info("Link from {} failed: {}", request.getSourceNodeId(), result.getFailureReason());
        }
        return ResponseEntity.ok(result);
    }
}
