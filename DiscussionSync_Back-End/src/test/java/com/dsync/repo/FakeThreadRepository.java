package com.dsync.repo;

import com.dsync.repo.domain.ForumThread;
import com.dsync.repo.domain.SyncMessage;
import com.dsync.service.MessageTransformer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory Discord forum for sync tests. Records every write it receives.
 */
public class FakeThreadRepository implements ThreadRepository {

    public static final String BOT_ID = "42";
    public static final String GUILD_ID = "7";

    private final MessageTransformer transformer = new MessageTransformer();

    private final Map<String, ForumThread> threads = new LinkedHashMap<>();
    private final Map<String, SyncMessage> seeds = new LinkedHashMap<>();
    private final Map<String, List<SyncMessage>> messages = new LinkedHashMap<>();

    private final Set<String> archived = new HashSet<>();

    private final List<ForumThread> createdThreads = new ArrayList<>();
    private final List<String> sentMessages = new ArrayList<>();

    private long nextId = 1000;

    // remaining successful sendThreadMessage calls before a failure, negative for never
    private int sendsBeforeFailure = -1;

    public ForumThread addThread(String forumId, String name, String author, String seedText) {
        ForumThread thread = new ForumThread(String.valueOf(nextId++), name, forumId, GUILD_ID);
        threads.put(thread.getId(), thread);
        messages.put(thread.getId(), new ArrayList<>());
        if (seedText != null) {
            seeds.put(thread.getId(), new SyncMessage(thread.getId(), author, seedText,
                    transformer.hasAttributionHeader(seedText), -1));
        }
        return thread;
    }

    public void addNativeMessage(ForumThread thread, String author, String text) {
        appendMessage(thread.getId(), author, text);
    }

    /**
     * Hides the thread from {@link #listThreads}, like Discord does once a thread is archived.
     */
    public void archive(ForumThread thread) {
        archived.add(thread.getId());
    }

    public void failSendAfter(int successfulCalls) {
        this.sendsBeforeFailure = successfulCalls;
    }

    public SyncMessage getSeed(String threadId) {
        return seeds.get(threadId);
    }

    public List<SyncMessage> getMessages(String threadId) {
        return messages.get(threadId);
    }

    public List<ForumThread> getCreatedThreads() {
        return createdThreads;
    }

    public List<String> getSentMessages() {
        return sentMessages;
    }

    public int writeCount() {
        return createdThreads.size() + sentMessages.size();
    }

    @Override
    public List<ForumThread> listThreads(String forumChannelId) {
        List<ForumThread> result = new ArrayList<>();
        for (ForumThread thread : threads.values()) {
            if (forumChannelId.equals(thread.getParentId()) && !archived.contains(thread.getId())) {
                result.add(thread);
            }
        }
        return result;
    }

    @Override
    public Optional<ForumThread> findThread(String threadId) {
        return Optional.ofNullable(threads.get(threadId));
    }

    @Override
    public List<SyncMessage> listThreadMessages(String threadId) {
        List<SyncMessage> list = messages.get(threadId);
        if (list == null) {
            throw new CollaboratorException(CollaboratorException.Kind.NOT_FOUND, "No thread " + threadId);
        }
        return new ArrayList<>(list);
    }

    @Override
    public Optional<SyncMessage> findSeedMessage(String threadId) {
        return Optional.ofNullable(seeds.get(threadId));
    }

    @Override
    public ForumThread createThread(String forumChannelId, String title, String seedBody) {
        ForumThread thread = addThread(forumChannelId, title, "sync-bot", seedBody);
        createdThreads.add(thread);
        return thread;
    }

    @Override
    public SyncMessage sendThreadMessage(String threadId, String body) {
        if (!messages.containsKey(threadId)) {
            throw new CollaboratorException(CollaboratorException.Kind.NOT_FOUND, "No thread " + threadId);
        }
        if (sendsBeforeFailure == 0) {
            throw new CollaboratorException(CollaboratorException.Kind.TRANSIENT, "Discord is down");
        }
        if (sendsBeforeFailure > 0) {
            sendsBeforeFailure--;
        }
        sentMessages.add(body);
        return appendMessage(threadId, "sync-bot", body);
    }

    @Override
    public String currentUserId() {
        return BOT_ID;
    }

    @Override
    public String messageUrl(ForumThread thread, String messageId) {
        return "https://discord.com/channels/" + GUILD_ID + "/" + thread.getId() + "/" + messageId;
    }

    private SyncMessage appendMessage(String threadId, String author, String text) {
        List<SyncMessage> list = messages.get(threadId);
        SyncMessage message = new SyncMessage(String.valueOf(nextId++), author, text,
                transformer.hasAttributionHeader(text), list.size());
        list.add(message);
        return message;
    }
}
