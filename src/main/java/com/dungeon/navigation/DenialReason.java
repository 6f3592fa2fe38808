package com.dungeon.navigation;

/**
 * Why a movement request was refused.
 */
public enum DenialReason {
    UNKNOWN_LOCATION,
    NO_EXIT,
    CONDITION_UNMET,
    HIDDEN_UNREVEALED,
    UNKNOWN_TARGET,
    CONTENT_NOT_GENERATED
}
