package com.dsync.repo;

import com.dsync.repo.domain.Discussion;
import com.dsync.repo.domain.SyncMessage;

import java.util.List;

/**
 * Access to the discussions of a GitHub repository.
 * Every method throws {@link CollaboratorException} when the remote call fails.
 */
public interface DiscussionRepository {

    /**
     * Id of the discussion category with the given name.
     */
    String resolveCategoryId(String categoryName);

    List<Discussion> listDiscussions(String categoryId);

    /**
     * Comments of a discussion, oldest first, all pages.
     * The discussion body is the seed of the sequence and is not part of the result.
     */
    List<SyncMessage> listComments(int discussionNumber);

    Discussion createDiscussion(String categoryId, String title, String body);

    SyncMessage addComment(String discussionId, String body);

    void updateDiscussionBody(String discussionId, String newBody);

    /**
     * Web URL of a discussion, used in attribution headers.
     */
    String discussionUrl(int discussionNumber);
}
