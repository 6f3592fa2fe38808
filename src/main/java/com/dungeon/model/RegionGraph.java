package com.dungeon.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a region's nodes. The first node is the region entry.
 */
@Getter
public final class RegionGraph {

    private final String regionId;
    private final List<GraphNode> nodes;
    @Getter(AccessLevel.NONE)
    private final Map<String, GraphNode> index;

    public RegionGraph(String regionId, List<GraphNode> nodes) {
        this.regionId = regionId;
        this.nodes = List.copyOf(nodes);
        Map<String, GraphNode> byId = new LinkedHashMap<>();
        for (GraphNode node : this.nodes) {
            if (byId.put(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id in region " + regionId + ": " + node.getId());
            }
        }
        this.index = byId;
    }

    public GraphNode entry() {
        if (nodes.isEmpty()) {
            throw new IllegalStateException("Region " + regionId + " has no nodes");
        }
        return nodes.get(0);
    }

    public Optional<GraphNode> node(String nodeId) {
        return Optional.ofNullable(index.get(nodeId));
    }

    public boolean contains(String nodeId) {
        return index.containsKey(nodeId);
    }

    public int size() {
        return nodes.size();
    }

    /** Number of directed edge references. */
    public int edgeCount() {
        return nodes.stream().mapToInt(GraphNode::degree).sum();
    }

    public double averageDegree() {
        return nodes.isEmpty() ? 0.0 : (double) edgeCount() / nodes.size();
    }

    public List<GraphNode> nodesOfType(NodeType type) {
        return nodes.stream().filter(n -> n.getType() == type).toList();
    }

    /**
     * Copy of this graph that also knows about nodes owned by other regions,
     * used when an edge crosses a region boundary.
     */
    public RegionGraph withExtraNodes(Collection<GraphNode> extra) {
        List<GraphNode> merged = new ArrayList<>(nodes);
        extra.stream().filter(n -> !index.containsKey(n.getId())).forEach(merged::add);
        return new RegionGraph(regionId, merged);
    }
}
