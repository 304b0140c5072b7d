package com.dsync.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Settings and startup-resolved identifiers shared by every sync routine.
 * The category id is written once during startup and only read afterwards.
 */
@Component
public class SyncContext {

    private final String forumChannelId;

    private final String categoryName;

    private final boolean dryRun;

    private volatile String categoryId;

    public SyncContext(@Value("${discord.forum-channel-id:}") String forumChannelId,
                       @Value("${github.category-name:General}") String categoryName,
                       @Value("${sync.dry-run:false}") boolean dryRun) {
        this.forumChannelId = forumChannelId;
        this.categoryName = categoryName;
        this.dryRun = dryRun;
    }

    public String getForumChannelId() {
        return forumChannelId;
    }

    public String getCategoryName() {
        return categoryName;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public String getCategoryId() {
        String id = categoryId;
        if (id == null) {
            throw new IllegalStateException("Discussion category '" + categoryName + "' has not been resolved yet");
        }
        return id;
    }

    public boolean isCategoryResolved() {
        return categoryId != null;
    }

    public synchronized void setCategoryId(String categoryId) {
        if (this.categoryId != null && !this.categoryId.equals(categoryId)) {
            throw new IllegalStateException("Discussion category id is already set to " + this.categoryId);
        }
        this.categoryId = categoryId;
    }
}
