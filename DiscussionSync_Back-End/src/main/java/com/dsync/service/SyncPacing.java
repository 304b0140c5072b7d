package com.dsync.service;

/**
 * Rate limiting of mutating calls to GitHub and Discord.
 * Implementations may delay the caller but must not reorder calls.
 */
public interface SyncPacing {

    SyncPacing NONE = () -> { };

    /**
     * Blocks until the next mutating call is allowed.
     */
    void awaitPermit();
}
