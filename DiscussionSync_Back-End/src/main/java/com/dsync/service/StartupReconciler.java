package com.dsync.service;

import com.dsync.config.SyncConfigurationException;
import com.dsync.repo.CollaboratorException;
import com.dsync.repo.DiscussionRepository;
import com.dsync.repo.ThreadRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Validates the configuration against both platforms before the application accepts any
 * trigger, and runs the full reconciliation pass.
 */
@Service
public class StartupReconciler {

    private static final Logger log = LoggerFactory.getLogger(StartupReconciler.class);

    private final DiscussionRepository discussionRepository;

    private final ThreadRepository threadRepository;

    private final SyncOrchestrator orchestrator;

    private final SyncContext syncContext;

    private final SyncStatisticsService statistics;

    private final Executor syncExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Value("${github.token:}")
    private String githubToken;

    @Value("${github.owner:}")
    private String githubOwner;

    @Value("${github.repo:}")
    private String githubRepo;

    @Value("${discord.token:}")
    private String discordToken;

    public StartupReconciler(DiscussionRepository discussionRepository,
                             ThreadRepository threadRepository,
                             SyncOrchestrator orchestrator,
                             SyncContext syncContext,
                             SyncStatisticsService statistics,
                             @Qualifier("syncTaskExecutor") Executor syncExecutor) {
        this.discussionRepository = discussionRepository;
        this.threadRepository = threadRepository;
        this.orchestrator = orchestrator;
        this.syncContext = syncContext;
        this.statistics = statistics;
        this.syncExecutor = syncExecutor;
    }

    /**
     * Any failure here stops the application.
     */
    @PostConstruct
    public void validateConfiguration() {
        require(githubToken, "github.token");
        require(githubOwner, "github.owner");
        require(githubRepo, "github.repo");
        require(discordToken, "discord.token");
        require(syncContext.getForumChannelId(), "discord.forum-channel-id");

        try {
            String categoryId = discussionRepository.resolveCategoryId(syncContext.getCategoryName());
            syncContext.setCategoryId(categoryId);
        } catch (CollaboratorException e) {
            throw new SyncConfigurationException("Cannot access discussions of " + githubOwner + "/" + githubRepo
                    + ": " + e.getMessage(), e);
        }

        try {
            String botId = threadRepository.currentUserId();
            int threads = threadRepository.listThreads(syncContext.getForumChannelId()).size();
            log.info("Discord bot {} sees {} active threads in forum {}", botId, threads,
                    syncContext.getForumChannelId());
        } catch (CollaboratorException e) {
            throw new SyncConfigurationException("Cannot access Discord forum channel "
                    + syncContext.getForumChannelId() + ": " + e.getMessage(), e);
        }

        if (syncContext.isDryRun()) {
            log.warn("DRY RUN mode: nothing will be written to GitHub or Discord");
        }
        log.info("Configuration validated: {}/{} category '{}' <-> forum {}", githubOwner, githubRepo,
                syncContext.getCategoryName(), syncContext.getForumChannelId());
    }

    /**
     * Runs the reconciliation on the calling thread.
     *
     * @return number of failed pairs, or -1 when a reconciliation was already running
     */
    public int reconcile() {
        if (!running.compareAndSet(false, true)) {
            log.info("A reconciliation is already running");
            return -1;
        }
        try {
            return runReconciliation();
        } finally {
            running.set(false);
        }
    }

    /**
     * Runs the reconciliation on the sync executor.
     *
     * @return false when a reconciliation was already running
     */
    public boolean reconcileInBackground() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        try {
            syncExecutor.execute(() -> {
                try {
                    runReconciliation();
                } finally {
                    running.set(false);
                }
            });
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    private int runReconciliation() {
        log.info("Starting reconciliation of forum {} with category '{}'",
                syncContext.getForumChannelId(), syncContext.getCategoryName());
        try {
            return orchestrator.reconcileAll();
        } catch (RuntimeException e) {
            log.error("Reconciliation aborted: {}", e.getMessage(), e);
            statistics.recordFailure("reconcile", "listing", e);
            return -1;
        }
    }

    private static void require(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new SyncConfigurationException("Missing required configuration: " + property);
        }
    }
}
