package com.dungeon.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored form of a {@link GraphNode}. Outgoing edges are kept as a JSON document.
 */
@Entity
@Table(name = "graph_nodes", indexes = @Index(name = "idx_graph_nodes_region", columnList = "regionId"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GraphNodeEntity {

    @Id
    private String id;

    @Column(nullable = false)
    private String regionId;

    /** Generation order; ordinal 0 is the region entry. */
    @Column(nullable = false)
    private int ordinal;

    @Column
    private Integer x;

    @Column
    private Integer y;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private NodeType type;

    @Column(nullable = false, length = 65535)
    private String edgesJson;
}
