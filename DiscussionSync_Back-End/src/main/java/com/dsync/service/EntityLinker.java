package com.dsync.service;

import com.dsync.repo.ThreadRepository;
import com.dsync.repo.domain.Discussion;
import com.dsync.repo.domain.ForumThread;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the counterpart of a discussion or thread through the link marker stored in the
 * discussion body.
 * <p>
 * Lookups are linear scans over the active threads of the forum channel and over the cached
 * discussion listing. A marker naming a thread outside the active listing is checked directly,
 * since archived threads are not listed. A missing, malformed or dangling marker resolves to
 * empty; only collaborator failures propagate.
 */
@Component
public class EntityLinker {

    private static final Logger log = LoggerFactory.getLogger(EntityLinker.class);

    private static final Pattern MARKER = Pattern.compile("<!-- Discord:(\\d+) -->");

    // any marker-looking comment, well-formed or not, so that embedding never leaves two behind
    private static final Pattern ANY_MARKER = Pattern.compile("\\n*<!-- Discord:[^>]*-->");

    private final ThreadRepository threadRepository;

    private final DiscussionListingCache discussionListingCache;

    private final SyncContext syncContext;

    public EntityLinker(ThreadRepository threadRepository,
                        DiscussionListingCache discussionListingCache,
                        SyncContext syncContext) {
        this.threadRepository = threadRepository;
        this.discussionListingCache = discussionListingCache;
        this.syncContext = syncContext;
    }

    public static String marker(String threadId) {
        return "<!-- Discord:" + threadId + " -->";
    }

    /**
     * Thread id referenced by the marker of the body, empty when there is no well-formed marker.
     */
    public static Optional<String> extractThreadId(String body) {
        if (body == null) {
            return Optional.empty();
        }
        Matcher matcher = MARKER.matcher(body);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String threadId = matcher.group(1);
        if (matcher.find() && !matcher.group(1).equals(threadId)) {
            log.warn("Body contains several link markers, using the first one ({})", threadId);
        }
        return Optional.of(threadId);
    }

    /**
     * Body with a single marker for the given thread, replacing any marker already present.
     */
    public static String embedMarker(String body, String threadId) {
        String stripped = stripMarker(body);
        if (stripped.isEmpty()) {
            return marker(threadId);
        }
        return stripped + "\n\n" + marker(threadId);
    }

    public static String stripMarker(String body) {
        if (body == null) {
            return "";
        }
        return ANY_MARKER.matcher(body).replaceAll("").stripTrailing();
    }

    public Optional<ForumThread> resolveThreadFor(Discussion discussion) {
        Optional<String> threadId = extractThreadId(discussion.getBody());
        if (threadId.isEmpty()) {
            return Optional.empty();
        }
        List<ForumThread> threads = threadRepository.listThreads(syncContext.getForumChannelId());
        for (ForumThread thread : threads) {
            if (threadId.get().equals(thread.getId())) {
                return Optional.of(thread);
            }
        }
        // archived threads are not part of the active listing but still exist
        Optional<ForumThread> archived = threadRepository.findThread(threadId.get());
        if (archived.isPresent() && syncContext.getForumChannelId().equals(archived.get().getParentId())) {
            log.debug("Discussion #{} references thread {} outside of the active listing", discussion.getNumber(),
                    threadId.get());
            return archived;
        }
        log.warn("Discussion #{} references thread {} which does not exist in forum {}, treating it as unlinked",
                discussion.getNumber(), threadId.get(), syncContext.getForumChannelId());
        return Optional.empty();
    }

    public Optional<Discussion> resolveDiscussionFor(ForumThread thread) {
        for (Discussion discussion : discussionListingCache.getDiscussions()) {
            Optional<String> threadId = extractThreadId(discussion.getBody());
            if (threadId.isPresent() && threadId.get().equals(thread.getId())) {
                return Optional.of(discussion);
            }
        }
        return Optional.empty();
    }
}
