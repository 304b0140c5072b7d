package com.dsync.service;

import com.dsync.repo.domain.ForumThread;
import org.springframework.context.ApplicationEvent;

/**
 * A THREAD_CREATE dispatch received from the Discord gateway.
 */
public class ThreadCreatedEvent extends ApplicationEvent {

    private final ForumThread thread;

    private final String ownerId;

    private final boolean newlyCreated;

    public ThreadCreatedEvent(Object source, ForumThread thread, String ownerId, boolean newlyCreated) {
        super(source);
        this.thread = thread;
        this.ownerId = ownerId;
        this.newlyCreated = newlyCreated;
    }

    public ForumThread getThread() {
        return thread;
    }

    public String getOwnerId() {
        return ownerId;
    }

    /**
     * False when Discord re-sends the thread because the bot was added to it.
     */
    public boolean isNewlyCreated() {
        return newlyCreated;
    }
}
