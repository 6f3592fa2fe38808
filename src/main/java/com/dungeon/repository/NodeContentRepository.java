package com.dungeon.repository;

import com.dungeon.model.NodeContentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for generated node descriptions.
 */
@Repository
public interface NodeContentRepository extends JpaRepository<NodeContentEntity, String> {
}
