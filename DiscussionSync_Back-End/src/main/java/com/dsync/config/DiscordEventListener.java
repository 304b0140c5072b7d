package com.dsync.config;

import com.dsync.repo.ThreadRepository;
import com.dsync.repo.domain.ForumThread;
import com.dsync.repo.domain.SyncResult;
import com.dsync.service.MessageTransformer;
import com.dsync.service.SyncContext;
import com.dsync.service.SyncOrchestrator;
import com.dsync.service.SyncStatisticsService;
import com.dsync.service.ThreadCreatedEvent;
import com.dsync.service.ThreadMessageCreatedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns Discord gateway events into thread-side syncs.
 * <p>
 * Events caused by the service itself (bot authors, mirrored text, threads it created) are
 * dropped here so that a mirrored message never triggers a sync back to its origin. The sync
 * runs on the sync executor, never on the gateway thread. Channel lookups are remembered, so a
 * busy channel outside the forum costs one REST call.
 */
@Component
public class DiscordEventListener {

    private static final Logger log = LoggerFactory.getLogger(DiscordEventListener.class);

    static final int MAX_KNOWN_CHANNELS = 10_000;

    private final SyncOrchestrator orchestrator;

    private final ThreadRepository threadRepository;

    private final SyncContext syncContext;

    private final MessageTransformer transformer;

    private final SyncStatisticsService statistics;

    private final Executor syncExecutor;

    private final Map<String, Optional<ForumThread>> channels = new LinkedHashMap<>(256, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Optional<ForumThread>> eldest) {
            return size() > MAX_KNOWN_CHANNELS;
        }
    };

    public DiscordEventListener(SyncOrchestrator orchestrator,
                                ThreadRepository threadRepository,
                                SyncContext syncContext,
                                MessageTransformer transformer,
                                SyncStatisticsService statistics,
                                @Qualifier("syncTaskExecutor") Executor syncExecutor) {
        this.orchestrator = orchestrator;
        this.threadRepository = threadRepository;
        this.syncContext = syncContext;
        this.transformer = transformer;
        this.statistics = statistics;
        this.syncExecutor = syncExecutor;
    }

    @EventListener
    public void handleThreadCreated(ThreadCreatedEvent event) {
        ForumThread thread = event.getThread();
        remember(thread.getId(), Optional.of(thread));
        if (!syncContext.getForumChannelId().equals(thread.getParentId())) {
            log.debug("Ignoring thread {} outside of the forum channel", thread.getId());
            return;
        }
        if (isSelf(event.getOwnerId())) {
            log.debug("Ignoring thread {} created by this service", thread.getId());
            return;
        }
        log.info("New thread {} in forum: {}", thread.getId(), thread.getName());
        submit(thread.getId(), () -> syncThread(thread, "thread-created"));
    }

    @EventListener
    public void handleMessageCreated(ThreadMessageCreatedEvent event) {
        if (event.isAuthorBot() || isSelf(event.getAuthorId())) {
            log.debug("Ignoring message {} from a bot", event.getMessageId());
            return;
        }
        if (transformer.hasAttributionHeader(event.getContent())) {
            log.debug("Ignoring mirrored message {}", event.getMessageId());
            return;
        }
        Optional<ForumThread> known = cached(event.getChannelId());
        if (known != null && !isForumThread(known)) {
            log.trace("Ignoring message {} outside of the forum channel", event.getMessageId());
            return;
        }
        submit(event.getChannelId(), () -> {
            Optional<ForumThread> thread;
            try {
                thread = lookupChannel(event.getChannelId());
            } catch (RuntimeException e) {
                log.error("Could not look up channel {}: {}", event.getChannelId(), e.getMessage());
                statistics.recordFailure("message-created", "channel " + event.getChannelId(), e);
                return;
            }
            if (!isForumThread(thread)) {
                log.debug("Ignoring message {} outside of the forum channel", event.getMessageId());
                return;
            }
            log.info("New message {} in thread {}", event.getMessageId(), thread.get().getId());
            syncThread(thread.get(), "message-created");
        });
    }

    /**
     * Thread of the channel, empty when the channel is not a thread. The parent of a thread never
     * changes, so the answer is kept.
     */
    Optional<ForumThread> lookupChannel(String channelId) {
        Optional<ForumThread> known = cached(channelId);
        if (known != null) {
            return known;
        }
        Optional<ForumThread> thread = threadRepository.findThread(channelId);
        remember(channelId, thread);
        return thread;
    }

    private Optional<ForumThread> cached(String channelId) {
        synchronized (channels) {
            return channels.get(channelId);
        }
    }

    private void remember(String channelId, Optional<ForumThread> thread) {
        synchronized (channels) {
            channels.put(channelId, thread);
        }
    }

    private boolean isForumThread(Optional<ForumThread> thread) {
        return thread.isPresent() && syncContext.getForumChannelId().equals(thread.get().getParentId());
    }

    private void submit(String channelId, Runnable task) {
        try {
            syncExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.error("Sync queue is full, dropping event of channel {}", channelId);
            statistics.recordFailure("gateway", "channel " + channelId, e);
        }
    }

    private void syncThread(ForumThread thread, String trigger) {
        try {
            SyncResult result = orchestrator.syncThreadSide(thread);
            log.info("Thread {} synced: {}", thread.getId(), result);
        } catch (RuntimeException e) {
            log.error("Failed to sync thread {}: {}", thread.getId(), e.getMessage(), e);
            statistics.recordFailure(trigger, "thread " + thread.getId(), e);
            replyFailure(thread, e);
        }
    }

    private void replyFailure(ForumThread thread, RuntimeException cause) {
        if (syncContext.isDryRun()) {
            return;
        }
        try {
            threadRepository.sendThreadMessage(thread.getId(), "Failed to sync to GitHub: " + cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not post the failure notice in thread {}: {}", thread.getId(), e.getMessage());
        }
    }

    private boolean isSelf(String userId) {
        if (userId == null) {
            return false;
        }
        try {
            return userId.equals(threadRepository.currentUserId());
        } catch (RuntimeException e) {
            log.warn("Could not resolve the bot user id: {}", e.getMessage());
            return false;
        }
    }
}
