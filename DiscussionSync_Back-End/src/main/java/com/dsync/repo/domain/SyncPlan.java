package com.dsync.repo.domain;

import java.util.Collections;
import java.util.List;

/**
 * Result of comparing the message sequences of a linked pair:
 * the direction to push in and the messages to push, oldest first.
 */
public class SyncPlan {

    private static final SyncPlan NOOP = new SyncPlan(SyncDirection.NONE, Collections.emptyList());

    private final SyncDirection direction;

    private final List<SyncMessage> surplus;

    public SyncPlan(SyncDirection direction, List<SyncMessage> surplus) {
        this.direction = direction;
        this.surplus = Collections.unmodifiableList(surplus);
    }

    public static SyncPlan noop() {
        return NOOP;
    }

    public SyncDirection getDirection() {
        return direction;
    }

    public List<SyncMessage> getSurplus() {
        return surplus;
    }

    public boolean isNoop() {
        return surplus.isEmpty();
    }

    @Override
    public String toString() {
        return "SyncPlan{direction=" + direction + ", surplus=" + surplus.size() + '}';
    }
}
