package com.dsync.service;

import com.dsync.repo.DiscussionRepository;
import com.dsync.repo.ThreadRepository;
import com.dsync.repo.domain.Discussion;
import com.dsync.repo.domain.ForumThread;
import com.dsync.repo.domain.SyncDirection;
import com.dsync.repo.domain.SyncMessage;
import com.dsync.repo.domain.SyncPlan;
import com.dsync.repo.domain.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry points of the synchronization: one per side, plus the startup reconciliation.
 * <p>
 * Each entry point finds (or creates) the counterpart, then pushes the messages the behind side
 * is missing, oldest first, one write per message. The first failing write stops the pass; the
 * next trigger recomputes the difference and resumes.
 */
@Service
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final DiscussionRepository discussionRepository;
    private final ThreadRepository threadRepository;
    private final EntityLinker entityLinker;
    private final MessageDiffEngine diffEngine;
    private final MessageTransformer transformer;
    private final DiscussionListingCache discussionListingCache;
    private final PairLockRegistry pairLocks;
    private final SyncPacing pacing;
    private final SyncContext syncContext;
    private final SyncStatisticsService statistics;

    private final int discordMaxLength;

    private final int githubMaxLength;

    public SyncOrchestrator(DiscussionRepository discussionRepository,
                            ThreadRepository threadRepository,
                            EntityLinker entityLinker,
                            MessageDiffEngine diffEngine,
                            MessageTransformer transformer,
                            DiscussionListingCache discussionListingCache,
                            PairLockRegistry pairLocks,
                            SyncPacing pacing,
                            SyncContext syncContext,
                            SyncStatisticsService statistics,
                            @Value("${discord.message.max-length:2000}") int discordMaxLength,
                            @Value("${github.comment.max-length:65536}") int githubMaxLength) {
        this.discussionRepository = discussionRepository;
        this.threadRepository = threadRepository;
        this.entityLinker = entityLinker;
        this.diffEngine = diffEngine;
        this.transformer = transformer;
        this.discussionListingCache = discussionListingCache;
        this.pairLocks = pairLocks;
        this.pacing = pacing;
        this.syncContext = syncContext;
        this.statistics = statistics;
        this.discordMaxLength = discordMaxLength;
        this.githubMaxLength = githubMaxLength;
    }

    /**
     * Sync a discussion from GitHub to Discord, creating its thread when needed.
     */
    public SyncResult syncDiscussionSide(Discussion discussion) {
        String category = discussion.getCategoryName();
        if (category != null && !category.equals(syncContext.getCategoryName())) {
            log.info("Skipping discussion #{}: category '{}' is not '{}'",
                    discussion.getNumber(), category, syncContext.getCategoryName());
            return SyncResult.skipped();
        }
        return pairLocks.withLock(PairLockRegistry.discussionKey(discussion.getId()),
                () -> syncDiscussionLocked(discussion));
    }

    /**
     * Sync a thread from Discord to GitHub, creating its discussion when needed.
     */
    public SyncResult syncThreadSide(ForumThread thread) {
        if (thread.getParentId() != null && !thread.getParentId().equals(syncContext.getForumChannelId())) {
            log.info("Skipping thread {}: not in forum channel {}", thread.getId(), syncContext.getForumChannelId());
            return SyncResult.skipped();
        }
        return pairLocks.withLock(PairLockRegistry.threadKey(thread.getId()),
                () -> syncThreadLocked(thread));
    }

    /**
     * Startup pass over every known thread and discussion. A failing pair is logged and the pass
     * goes on with the next one.
     *
     * @return number of pairs whose sync failed
     */
    public int reconcileAll() {
        List<ForumThread> threads = threadRepository.listThreads(syncContext.getForumChannelId());
        statistics.recordStartupListing(discussionListingCache.getDiscussions().size(), threads.size());

        int failed = 0;
        log.info("Syncing {} existing Discord threads to GitHub", threads.size());
        for (ForumThread thread : threads) {
            log.info("Syncing thread {} ({})", thread.getId(), thread.getName());
            if (!runGuarded("startup", "thread " + thread.getId(), () -> syncThreadSide(thread))) {
                failed++;
            }
        }

        List<Discussion> discussions = new ArrayList<>(discussionListingCache.getDiscussions());
        log.info("Syncing {} existing GitHub discussions to Discord", discussions.size());
        for (Discussion discussion : discussions) {
            log.info("Syncing discussion #{}", discussion.getNumber());
            if (!runGuarded("startup", "discussion #" + discussion.getNumber(), () -> syncDiscussionSide(discussion))) {
                failed++;
            }
        }
        log.info("Startup reconciliation finished, {} pair(s) failed", failed);
        return failed;
    }

    private boolean runGuarded(String trigger, String subject, Supplier<SyncResult> sync) {
        try {
            SyncResult result = sync.get();
            log.debug("Sync of {} finished: {}", subject, result);
            return true;
        } catch (RuntimeException e) {
            log.error("Sync of {} failed: {}", subject, e.getMessage(), e);
            statistics.recordFailure(trigger, subject, e);
            return false;
        }
    }

    private SyncResult syncDiscussionLocked(Discussion discussion) {
        Optional<ForumThread> linked = entityLinker.resolveThreadFor(discussion);
        if (linked.isPresent()) {
            ForumThread thread = linked.get();
            return pairLocks.withLock(PairLockRegistry.threadKey(thread.getId()),
                    () -> catchUp(discussion, thread, false));
        }

        log.info("Discussion #{} has no Discord thread yet", discussion.getNumber());
        if (syncContext.isDryRun()) {
            log.info("DRY RUN - would create Discord thread '{}' in forum {} and link it to discussion #{}",
                    discussion.getTitle(), syncContext.getForumChannelId(), discussion.getNumber());
            return SyncResult.dryRun(SyncDirection.GITHUB_TO_DISCORD);
        }

        ForumThread thread = createThreadFor(discussion);
        return pairLocks.withLock(PairLockRegistry.threadKey(thread.getId()), () -> {
            Discussion linkedDiscussion = linkDiscussion(discussion, thread);
            return catchUp(linkedDiscussion, thread, true);
        });
    }

    private SyncResult syncThreadLocked(ForumThread thread) {
        Optional<Discussion> linked = entityLinker.resolveDiscussionFor(thread);
        if (linked.isPresent()) {
            return catchUp(linked.get(), thread, false);
        }

        log.info("Thread {} has no GitHub discussion yet", thread.getId());
        Optional<SyncMessage> seed = threadRepository.findSeedMessage(thread.getId());
        if (seed.isEmpty()) {
            log.warn("Thread {} has no starter message, cannot create its discussion", thread.getId());
            return SyncResult.skipped();
        }
        if (syncContext.isDryRun()) {
            log.info("DRY RUN - would create discussion '{}' in category '{}' for thread {}",
                    thread.getName(), syncContext.getCategoryName(), thread.getId());
            return SyncResult.dryRun(SyncDirection.DISCORD_TO_GITHUB);
        }

        Discussion created = createDiscussionFor(thread, seed.get());
        return catchUp(created, thread, true);
    }

    private ForumThread createThreadFor(Discussion discussion) {
        String header = transformer.attributionHeader(SyncDirection.GITHUB_TO_DISCORD,
                discussion.getAuthorLogin(), discussionUrl(discussion));
        String body = transformer.imageNormalize(SyncDirection.GITHUB_TO_DISCORD,
                EntityLinker.stripMarker(discussion.getBody()));
        String seed = transformer.lengthClamp(header, body, discordMaxLength);

        log.info("Creating Discord thread for discussion #{}: {}", discussion.getNumber(), discussion.getTitle());
        pacing.awaitPermit();
        ForumThread thread = threadRepository.createThread(syncContext.getForumChannelId(), discussion.getTitle(), seed);
        statistics.recordThreadCreated();
        return thread;
    }

    // Not atomic with the thread creation: a crash in between leaves an unlinked discussion and
    // the next trigger creates a second thread.
    private Discussion linkDiscussion(Discussion discussion, ForumThread thread) {
        String suffix = "\n\n" + EntityLinker.marker(thread.getId());
        String stripped = EntityLinker.stripMarker(discussion.getBody());
        String newBody = stripped.length() + suffix.length() <= githubMaxLength
                ? EntityLinker.embedMarker(stripped, thread.getId())
                : transformer.lengthClamp("", stripped, githubMaxLength - suffix.length()) + suffix;

        log.info("Linking discussion #{} to thread {}", discussion.getNumber(), thread.getId());
        pacing.awaitPermit();
        discussionRepository.updateDiscussionBody(discussion.getId(), newBody);

        Discussion linked = discussion.withBody(newBody);
        discussionListingCache.put(linked);
        return linked;
    }

    private Discussion createDiscussionFor(ForumThread thread, SyncMessage seed) {
        String header = transformer.attributionHeader(SyncDirection.DISCORD_TO_GITHUB,
                seed.getAuthor(), threadRepository.messageUrl(thread, seed.getId()));
        String body = transformer.imageNormalize(SyncDirection.DISCORD_TO_GITHUB, seed.getText());
        String suffix = "\n\n" + EntityLinker.marker(thread.getId());
        String content = transformer.lengthClamp(header, body, githubMaxLength - suffix.length()) + suffix;

        log.info("Creating discussion in category '{}' for thread {}: {}",
                syncContext.getCategoryName(), thread.getId(), thread.getName());
        pacing.awaitPermit();
        Discussion created = discussionRepository.createDiscussion(syncContext.getCategoryId(), thread.getName(), content);
        if (created.getBody() == null) {
            created.setBody(content);
        }
        if (created.getCategoryName() == null) {
            created.setCategoryName(syncContext.getCategoryName());
        }
        statistics.recordDiscussionCreated();
        discussionListingCache.put(created);
        log.info("Created discussion #{} for thread {}", created.getNumber(), thread.getId());
        return created;
    }

    private SyncResult catchUp(Discussion discussion, ForumThread thread, boolean counterpartCreated) {
        log.info("Loading messages from thread {} & discussion #{}", thread.getId(), discussion.getNumber());
        List<SyncMessage> discussionMessages = discussionRepository.listComments(discussion.getNumber());
        List<SyncMessage> threadMessages = threadRepository.listThreadMessages(thread.getId());

        SyncPlan plan = diffEngine.diff(discussionMessages, threadMessages);
        if (plan.isNoop()) {
            log.info("No new messages to sync between thread {} & discussion #{}", thread.getId(), discussion.getNumber());
            return new SyncResult(counterpartCreated ? SyncResult.Status.SYNCED : SyncResult.Status.UP_TO_DATE,
                    counterpartCreated, SyncDirection.NONE, 0);
        }

        SyncDirection direction = plan.getDirection();
        if (syncContext.isDryRun()) {
            for (SyncMessage message : plan.getSurplus()) {
                log.info("DRY RUN - would push message {} by {} ({}) for thread {} & discussion #{}",
                        message.getId(), message.getAuthor(), direction, thread.getId(), discussion.getNumber());
            }
            return SyncResult.dryRun(direction);
        }

        log.info("Syncing {} message(s) {} for thread {} & discussion #{}",
                plan.getSurplus().size(), direction, thread.getId(), discussion.getNumber());
        int pushed = 0;
        for (SyncMessage message : plan.getSurplus()) {
            if (message.isMirrored()) {
                log.warn("Message {} at position {} was itself mirrored; thread {} and discussion #{} may have diverged",
                        message.getId(), message.getPosition(), thread.getId(), discussion.getNumber());
            }
            if (direction == SyncDirection.GITHUB_TO_DISCORD) {
                pushToDiscord(message, discussion, thread);
            } else {
                pushToGithub(message, discussion, thread);
            }
            pushed++;
            statistics.recordPushed(direction);
        }
        return new SyncResult(SyncResult.Status.SYNCED, counterpartCreated, direction, pushed);
    }

    private void pushToDiscord(SyncMessage comment, Discussion discussion, ForumThread thread) {
        String backLink = comment.getUrl() != null ? comment.getUrl() : discussionUrl(discussion);
        String header = transformer.attributionHeader(SyncDirection.GITHUB_TO_DISCORD, comment.getAuthor(), backLink);
        String body = transformer.imageNormalize(SyncDirection.GITHUB_TO_DISCORD, comment.getText());
        String content = transformer.lengthClamp(header, body, discordMaxLength);

        log.info("Sending comment {} of discussion #{} to Discord thread {}", comment.getId(), discussion.getNumber(), thread.getId());
        pacing.awaitPermit();
        threadRepository.sendThreadMessage(thread.getId(), content);
    }

    private void pushToGithub(SyncMessage message, Discussion discussion, ForumThread thread) {
        String header = transformer.attributionHeader(SyncDirection.DISCORD_TO_GITHUB,
                message.getAuthor(), threadRepository.messageUrl(thread, message.getId()));
        String body = transformer.imageNormalize(SyncDirection.DISCORD_TO_GITHUB, message.getText());
        String content = transformer.lengthClamp(header, body, githubMaxLength);

        log.info("Sending message {} of thread {} to GitHub discussion #{}", message.getId(), thread.getId(), discussion.getNumber());
        pacing.awaitPermit();
        discussionRepository.addComment(discussion.getId(), content);
    }

    private String discussionUrl(Discussion discussion) {
        return discussion.getUrl() != null ? discussion.getUrl() : discussionRepository.discussionUrl(discussion.getNumber());
    }
}
