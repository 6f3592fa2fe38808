package com.dungeon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the dungeon graph service.
 *
 * Features:
 * - Seeded procedural region topology (grid, BSP and flood-fill layouts)
 * - Region templates loaded from JSON
 * - Movement with hidden exits and skill-gated passages
 * - Free-text exit resolution
 */
@SpringBootApplication
public class DungeonGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(DungeonGraphApplication.class, args);
    }
}
