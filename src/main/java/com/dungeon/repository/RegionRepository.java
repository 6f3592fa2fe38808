package com.dungeon.repository;

import com.dungeon.model.RegionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for generated regions.
 */
@Repository
public interface RegionRepository extends JpaRepository<RegionEntity, String> {

    List<RegionEntity> findAllByOrderByCreatedAtDesc();
}
