package com.dungeon.config;

import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads the region templates at startup.
 * <p>
 * Templates come from two locations, in order:
 * <ol>
 *   <li>{@code classpath:regions/*.json}, shipped with the service</li>
 *   <li>{@code ./regions/} next to the running jar, for custom templates</li>
 * </ol>
 * A custom template replaces a built-in one with the same {@code id}.
 */
@Component
@Slf4j
public class RegionTemplateLoader {

    private final ObjectMapper objectMapper;
    private final Path externalDir;

    /** All loaded templates keyed by their id. */
    @Getter
    private final Map<String, RegionTemplate> templates = new LinkedHashMap<>();

    @Autowired
    public RegionTemplateLoader(ObjectMapper objectMapper) {
        this(objectMapper, Paths.get("regions"));
    }

    RegionTemplateLoader(ObjectMapper objectMapper, Path externalDir) {
        this.objectMapper = objectMapper;
        this.externalDir = externalDir;
    }

    @PostConstruct
    public void loadTemplates() {
        loadClasspathTemplates();
        loadExternalTemplates();

        if (templates.isEmpty()) {
            log.warn("No region templates found; regions can only be generated from an explicit theme or layout.");
        } else {
            log.info("Loaded {} region template(s): {}", templates.size(), templates.keySet());
        }
    }

    public List<RegionTemplate> getAvailableTemplates() {
        return List.copyOf(templates.values());
    }

    /**
     * @throws IllegalArgumentException if the template id is unknown
     */
    public RegionTemplate getTemplate(String templateId) {
        RegionTemplate template = templates.get(templateId);
        if (template == null) {
            throw new IllegalArgumentException("Unknown region template: " + templateId
                    + ". Available templates: " + templates.keySet());
        }
        return template;
    }

    // ── classpath templates ─────────────────────────────────────────────

    private void loadClasspathTemplates() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:regions/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    register(objectMapper.readValue(is, RegionTemplate.class), resource.getFilename());
                } catch (Exception e) {
                    log.error("Failed to load classpath template: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for region templates: {}", e.getMessage());
        }
    }

    // ── external templates (./regions/ folder) ──────────────────────────

    private void loadExternalTemplates() {
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external region directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalTemplate);
        } catch (IOException e) {
            log.error("Error reading external region directory", e);
        }
    }

    private void loadExternalTemplate(Path path) {
        try {
            register(objectMapper.readValue(path.toFile(), RegionTemplate.class), path.toString());
        } catch (Exception e) {
            log.error("Failed to load custom template: {}", path, e);
        }
    }

    private void register(RegionTemplate template, String source) {
        if (template.id() == null || template.id().isBlank()) {
            throw new IllegalArgumentException("Region template in " + source + " has no id");
        }
        template.resolveLayout();
        templates.put(template.id(), template);
        log.info("Loaded region template '{}' ({}) from {}", template.name(), template.id(), source);
    }
}
