package com.dungeon.service;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of joining frontier nodes of two regions. Failures are reported
 * here instead of being thrown.
 */
@Value
@Builder
public class LinkResult {

    boolean linked;
    String sourceNodeId;
    String targetNodeId;
    String label;
    String reverseLabel;
    String failureReason;

    public static LinkResult linked(String sourceNodeId, String targetNodeId, String label, String reverseLabel) {
        return LinkResult.builder()
                .linked(true)
                .sourceNodeId(sourceNodeId)
                .targetNodeId(targetNodeId)
                .label(label)
                .reverseLabel(reverseLabel)
                .build();
    }

    public static LinkResult failed(String reason) {
        return LinkResult.builder()
                .linked(false)
                .failureReason(reason)
                .build();
    }
}
