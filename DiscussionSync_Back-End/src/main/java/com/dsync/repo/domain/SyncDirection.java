package com.dsync.repo.domain;

/**
 * Which side is behind in a sync pass and receives the pushed messages.
 */
public enum SyncDirection {
    NONE,
    GITHUB_TO_DISCORD,
    DISCORD_TO_GITHUB
}
