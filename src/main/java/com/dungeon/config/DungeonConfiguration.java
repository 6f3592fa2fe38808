package com.dungeon.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Generation tunables and the executor that bounds exit interpreter calls.
 */
@Configuration
@Slf4j
public class DungeonConfiguration {

    @Bean
    public GenerationSettings generationSettings(
            @Value("${dungeon.generation.hidden.base-difficulty:10}") int baseDifficulty,
            @Value("${dungeon.generation.hidden.difficulty-step:5}") int difficultyStep,
            @Value("${dungeon.generation.hidden.jitter:10}") int jitter,
            @Value("${dungeon.generation.hidden.min-difficulty:10}") int minDifficulty,
            @Value("${dungeon.generation.hidden.max-difficulty:30}") int maxDifficulty,
            @Value("${dungeon.generation.dead-end-fraction:0.2}") double deadEndFraction,
            @Value("${dungeon.generation.min-frontiers:2}") int minFrontiers) {
        GenerationSettings settings = new GenerationSettings(baseDifficulty, difficultyStep, jitter,
                minDifficulty, maxDifficulty, deadEndFraction, minFrontiers);
        log.info("Generation settings: {}", settings);
        return settings;
    }

    @Bean(name = "exitIntentExecutor")
    public ThreadPoolTaskExecutor exitIntentExecutor(
            @Value("${dungeon.navigation.llm-threads:2}") int threads,
            @Value("${dungeon.navigation.llm-queue-capacity:16}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("exit-intent-");
        executor.initialize();
        return executor;
    }
}
