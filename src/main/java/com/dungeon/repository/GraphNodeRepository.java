package com.dungeon.repository;

import com.dungeon.model.GraphNodeEntity;
import com.dungeon.model.NodeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for region nodes, keyed by node id.
 */
@Repository
public interface GraphNodeRepository extends JpaRepository<GraphNodeEntity, String> {

    List<GraphNodeEntity> findByRegionIdOrderByOrdinalAsc(String regionId);

    @Query("SELECT n FROM GraphNodeEntity n WHERE n.regionId = :regionId AND n.type = :type ORDER BY n.ordinal ASC")
    List<GraphNodeEntity> findByRegionAndType(String regionId, NodeType type);
}
