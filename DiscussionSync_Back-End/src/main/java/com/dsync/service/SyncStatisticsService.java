package com.dsync.service;

import com.dsync.repo.domain.SyncDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the sync activity since startup, and the most recent sync failures.
 */
@Service
public class SyncStatisticsService {

    private static final Logger log = LoggerFactory.getLogger(SyncStatisticsService.class);

    private final AtomicLong githubDiscussionsFound = new AtomicLong();
    private final AtomicLong discordThreadsFound = new AtomicLong();
    private final AtomicLong threadsCreated = new AtomicLong();
    private final AtomicLong discussionsCreated = new AtomicLong();
    private final AtomicLong syncedToDiscord = new AtomicLong();
    private final AtomicLong syncedToGitHub = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    // Bounded so a flapping collaborator cannot grow it forever
    private final Deque<FailureInfo> recentFailures = new ArrayDeque<>();

    private final int maxFailureEntries;

    public SyncStatisticsService(@Value("${sync.failures.max-entries:200}") int maxFailureEntries) {
        this.maxFailureEntries = Math.max(1, maxFailureEntries);
    }

    public void recordStartupListing(int discussions, int threads) {
        githubDiscussionsFound.set(discussions);
        discordThreadsFound.set(threads);
    }

    public void recordThreadCreated() {
        threadsCreated.incrementAndGet();
    }

    public void recordDiscussionCreated() {
        discussionsCreated.incrementAndGet();
    }

    public void recordPushed(SyncDirection direction) {
        if (direction == SyncDirection.GITHUB_TO_DISCORD) {
            syncedToDiscord.incrementAndGet();
        } else if (direction == SyncDirection.DISCORD_TO_GITHUB) {
            syncedToGitHub.incrementAndGet();
        }
    }

    /**
     * Store a failed sync of one pair.
     */
    public void recordFailure(String trigger, String subject, Throwable error) {
        failures.incrementAndGet();
        FailureInfo info = new FailureInfo(LocalDateTime.now(), trigger, subject,
                error.getClass().getSimpleName(), error.getMessage());
        synchronized (recentFailures) {
            recentFailures.addLast(info);
            while (recentFailures.size() > maxFailureEntries) {
                recentFailures.removeFirst();
            }
        }
        log.debug("Failure tracked for {} ({}): {}", subject, trigger, error.getMessage());
    }

    public List<FailureInfo> getRecentFailures() {
        synchronized (recentFailures) {
            return new ArrayList<>(recentFailures);
        }
    }

    public Map<String, Object> getCounters() {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("githubDiscussionsFound", githubDiscussionsFound.get());
        counters.put("discordThreadsFound", discordThreadsFound.get());
        counters.put("threadsCreated", threadsCreated.get());
        counters.put("discussionsCreated", discussionsCreated.get());
        counters.put("syncedToDiscord", syncedToDiscord.get());
        counters.put("syncedToGitHub", syncedToGitHub.get());
        counters.put("failures", failures.get());
        return counters;
    }

    public long getSyncedToDiscord() {
        return syncedToDiscord.get();
    }

    public long getSyncedToGitHub() {
        return syncedToGitHub.get();
    }

    public long getFailures() {
        return failures.get();
    }

    public static class FailureInfo {
        private final LocalDateTime timestamp;
        private final String trigger;
        private final String subject;
        private final String exceptionType;
        private final String message;

        public FailureInfo(LocalDateTime timestamp, String trigger, String subject, String exceptionType, String message) {
            this.timestamp = timestamp;
            this.trigger = trigger;
            this.subject = subject;
            this.exceptionType = exceptionType;
            this.message = message;
        }

        public LocalDateTime getTimestamp() {
            return timestamp;
        }

        public String getTrigger() {
            return trigger;
        }

        public String getSubject() {
            return subject;
        }

        public String getExceptionType() {
            return exceptionType;
        }

        public String getMessage() {
            return message;
        }
    }
}
