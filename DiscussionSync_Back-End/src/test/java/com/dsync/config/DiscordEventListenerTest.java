package com.dsync.config;

import com.dsync.repo.CollaboratorException;
import com.dsync.repo.ThreadRepository;
import com.dsync.repo.domain.ForumThread;
import com.dsync.repo.domain.SyncDirection;
import com.dsync.repo.domain.SyncResult;
import com.dsync.service.MessageTransformer;
import com.dsync.service.SyncContext;
import com.dsync.service.SyncOrchestrator;
import com.dsync.service.SyncStatisticsService;
import com.dsync.service.ThreadCreatedEvent;
import com.dsync.service.ThreadMessageCreatedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DiscordEventListenerTest {

    private static final String BOT_ID = "42";

    private final MessageTransformer transformer = new MessageTransformer();

    private SyncOrchestrator orchestrator;
    private ThreadRepository threadRepository;
    private SyncStatisticsService statistics;

    private final ForumThread thread = new ForumThread("1000", "Help", "900", "7");

    @BeforeEach
    void setUp() {
        orchestrator = mock(SyncOrchestrator.class);
        threadRepository = mock(ThreadRepository.class);
        statistics = new SyncStatisticsService(10);
        when(threadRepository.currentUserId()).thenReturn(BOT_ID);
        when(threadRepository.findThread("1000")).thenReturn(Optional.of(thread));
    }

    private DiscordEventListener listener(boolean dryRun) {
        return new DiscordEventListener(orchestrator, threadRepository, new SyncContext("900", "General", dryRun),
                transformer, statistics, Runnable::run);
    }

    private static ThreadMessageCreatedEvent message(String authorId, boolean bot, String content) {
        return new ThreadMessageCreatedEvent(new Object(), "1000", "1001", authorId, bot, content);
    }

    @Test
    void shouldSyncThreadOfNewUserMessage() {
        when(orchestrator.syncThreadSide(thread))
                .thenReturn(new SyncResult(SyncResult.Status.SYNCED, false, SyncDirection.DISCORD_TO_GITHUB, 1));

        listener(false).handleMessageCreated(message("55", false, "hello"));

        verify(orchestrator).syncThreadSide(thread);
    }

    @Test
    void shouldIgnoreBotAndOwnMessages() {
        DiscordEventListener listener = listener(false);

        listener.handleMessageCreated(message("77", true, "from another bot"));
        listener.handleMessageCreated(message(BOT_ID, false, "from us"));

        verifyNoInteractions(orchestrator);
        verify(threadRepository, never()).findThread(anyString());
    }

    @Test
    void shouldIgnoreMirroredMessage() {
        String mirrored = transformer.attributionHeader(SyncDirection.GITHUB_TO_DISCORD, "octocat", "https://x") + "hi";

        listener(false).handleMessageCreated(message("55", false, mirrored));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldIgnoreMessageOutsideForum() {
        when(threadRepository.findThread("1000")).thenReturn(Optional.of(new ForumThread("1000", "x", "901", "7")));

        listener(false).handleMessageCreated(message("55", false, "hello"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldSyncThreadCreatedByUserOnly() {
        DiscordEventListener listener = listener(false);

        listener.handleThreadCreated(new ThreadCreatedEvent(new Object(), thread, BOT_ID, true));
        listener.handleThreadCreated(new ThreadCreatedEvent(new Object(),
                new ForumThread("2000", "Elsewhere", "901", "7"), "55", true));
        verifyNoInteractions(orchestrator);

        listener.handleThreadCreated(new ThreadCreatedEvent(new Object(), thread, "55", true));
        verify(orchestrator).syncThreadSide(thread);
    }

    @Test
    void shouldReplyInThreadWhenSyncFails() {
        when(orchestrator.syncThreadSide(thread))
                .thenThrow(new CollaboratorException(CollaboratorException.Kind.TRANSIENT, "GitHub is down"));

        listener(false).handleMessageCreated(message("55", false, "hello"));

        verify(threadRepository).sendThreadMessage("1000", "Failed to sync to GitHub: GitHub is down");
        assertEquals(1, statistics.getFailures());
    }

    @Test
    void shouldNotReplyInDryRun() {
        when(orchestrator.syncThreadSide(thread))
                .thenThrow(new CollaboratorException(CollaboratorException.Kind.TRANSIENT, "GitHub is down"));

        listener(true).handleMessageCreated(message("55", false, "hello"));

        verify(threadRepository, never()).sendThreadMessage(anyString(), any());
        assertEquals(1, statistics.getFailures());
    }

    @Test
    void shouldLookUpEachChannelOnce() {
        when(orchestrator.syncThreadSide(thread))
                .thenReturn(new SyncResult(SyncResult.Status.UP_TO_DATE, false, SyncDirection.NONE, 0));
        when(threadRepository.findThread("555")).thenReturn(Optional.empty());
        DiscordEventListener listener = listener(false);

        listener.handleMessageCreated(message("55", false, "hello"));
        listener.handleMessageCreated(message("55", false, "hello again"));
        listener.handleMessageCreated(new ThreadMessageCreatedEvent(new Object(), "555", "1", "55", false, "chat"));
        listener.handleMessageCreated(new ThreadMessageCreatedEvent(new Object(), "555", "2", "55", false, "chat"));

        verify(threadRepository, times(1)).findThread("1000");
        verify(threadRepository, times(1)).findThread("555");
        verify(orchestrator, times(2)).syncThreadSide(thread);
    }

    @Test
    void shouldNotLookUpThreadAnnouncedByGateway() {
        DiscordEventListener listener = listener(false);
        listener.handleThreadCreated(new ThreadCreatedEvent(new Object(), thread, BOT_ID, true));

        listener.handleMessageCreated(message("55", false, "hello"));

        verify(threadRepository, never()).findThread(anyString());
        verify(orchestrator).syncThreadSide(thread);
    }

    @Test
    void shouldRecordFailedChannelLookup() {
        when(threadRepository.findThread("1000"))
                .thenThrow(new CollaboratorException(CollaboratorException.Kind.TRANSIENT, "Discord is down"));

        listener(false).handleMessageCreated(message("55", false, "hello"));

        verifyNoInteractions(orchestrator);
        assertEquals(1, statistics.getFailures());
        assertEquals("message-created", statistics.getRecentFailures().get(0).getTrigger());
    }

    @Test
    void shouldRecordEventDroppedByFullQueue() {
        DiscordEventListener listener = new DiscordEventListener(orchestrator, threadRepository,
                new SyncContext("900", "General", false), transformer, statistics, task -> {
                    throw new TaskRejectedException("queue full");
                });

        listener.handleMessageCreated(message("55", false, "hello"));

        verifyNoInteractions(orchestrator);
        assertEquals(1, statistics.getFailures());
    }
}
