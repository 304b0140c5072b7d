package com.dsync.repo.domain;

/**
 * Outcome of one sync entry point invocation.
 */
public class SyncResult {

    public enum Status {
        SKIPPED,
        UP_TO_DATE,
        SYNCED,
        DRY_RUN
    }

    private final Status status;

    private final boolean counterpartCreated;

    private final SyncDirection direction;

    private final int pushedCount;

    public SyncResult(Status status, boolean counterpartCreated, SyncDirection direction, int pushedCount) {
        this.status = status;
        this.counterpartCreated = counterpartCreated;
        this.direction = direction;
        this.pushedCount = pushedCount;
    }

    public static SyncResult skipped() {
        return new SyncResult(Status.SKIPPED, false, SyncDirection.NONE, 0);
    }

    public static SyncResult dryRun(SyncDirection direction) {
        return new SyncResult(Status.DRY_RUN, false, direction, 0);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isCounterpartCreated() {
        return counterpartCreated;
    }

    public SyncDirection getDirection() {
        return direction;
    }

    public int getPushedCount() {
        return pushedCount;
    }

    @Override
    public String toString() {
        return "SyncResult{" +
                "status=" + status +
                ", counterpartCreated=" + counterpartCreated +
                ", direction=" + direction +
                ", pushedCount=" + pushedCount +
                '}';
    }
}
