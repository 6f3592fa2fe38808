package com.dungeon.model;

import com.dungeon.layout.LayoutType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted metadata of a generated region. Nodes are stored separately in {@link GraphNodeEntity}.
 */
@Entity
@Table(name = "regions")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegionEntity {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @Column
    private String templateId;

    @Column(nullable = false)
    private String theme;

    @Column(length = 2000)
    private String lore;

    @Column(nullable = false)
    private int difficulty;

    @Column(nullable = false)
    private long seed;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LayoutType layoutType;

    @Column(nullable = false)
    private String entryNodeId;

    @Column(nullable = false)
    private int nodeCount;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
