package com.dsync.repo;

import com.dsync.repo.domain.ForumThread;
import com.dsync.repo.domain.SyncMessage;

import java.util.List;
import java.util.Optional;

/**
 * Access to the threads of a Discord forum channel.
 * Every method throws {@link CollaboratorException} when the remote call fails.
 */
public interface ThreadRepository {

    List<ForumThread> listThreads(String forumChannelId);

    /**
     * Returns the channel as a thread, or empty when it does not exist or is not a thread.
     */
    Optional<ForumThread> findThread(String threadId);

    /**
     * Messages of a thread, oldest first, without the starter (seed) message.
     */
    List<SyncMessage> listThreadMessages(String threadId);

    /**
     * Starter message of a forum thread, empty when it was deleted.
     */
    Optional<SyncMessage> findSeedMessage(String threadId);

    ForumThread createThread(String forumChannelId, String title, String seedBody);

    SyncMessage sendThreadMessage(String threadId, String body);

    /**
     * Id of the bot user the service is logged in as.
     */
    String currentUserId();

    /**
     * Link to a message of a thread, used in attribution headers.
     */
    String messageUrl(ForumThread thread, String messageId);
}
