package com.dungeon.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Descriptive content generated for a node. A node is materialized once this row exists.
 */
@Entity
@Table(name = "node_contents")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NodeContentEntity {

    @Id
    private String nodeId;

    @Column(nullable = false)
    private String regionId;

    @Column(nullable = false, length = 4000)
    private String description;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
