package com.dungeon.service;

/**
 * Produces descriptive text for a node. The graph never depends on the text.
 */
public interface ContentGenerator {

    String generate(ContentContext context);
}
