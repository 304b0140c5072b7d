package com.dsync.service;

import com.dsync.repo.DiscussionRepository;
import com.dsync.repo.domain.Discussion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Snapshot of the discussions of the synchronized category, loaded on first read and kept for
 * the lifetime of the process.
 * <p>
 * The snapshot is never reloaded. Discussions created or linked by this process are written
 * through with {@link #put(Discussion)} so that thread-side lookups can find them.
 */
@Component
public class DiscussionListingCache {

    private static final Logger log = LoggerFactory.getLogger(DiscussionListingCache.class);

    private final DiscussionRepository discussionRepository;

    private final SyncContext syncContext;

    private final Object loadLock = new Object();

    private volatile List<Discussion> discussions;

    public DiscussionListingCache(DiscussionRepository discussionRepository, SyncContext syncContext) {
        this.discussionRepository = discussionRepository;
        this.syncContext = syncContext;
    }

    public List<Discussion> getDiscussions() {
        return Collections.unmodifiableList(loaded());
    }

    /**
     * Adds a discussion to the snapshot, or replaces the entry with the same id.
     */
    public void put(Discussion discussion) {
        List<Discussion> current = loaded();
        synchronized (loadLock) {
            for (int i = 0; i < current.size(); i++) {
                if (current.get(i).getId().equals(discussion.getId())) {
                    current.set(i, discussion);
                    return;
                }
            }
            current.add(discussion);
        }
    }

    public boolean isLoaded() {
        return discussions != null;
    }

    private List<Discussion> loaded() {
        List<Discussion> snapshot = discussions;
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (loadLock) {
            if (discussions == null) {
                List<Discussion> fetched = discussionRepository.listDiscussions(syncContext.getCategoryId());
                log.info("Loaded {} discussions of category '{}'", fetched.size(), syncContext.getCategoryName());
                discussions = new CopyOnWriteArrayList<>(fetched);
            }
            return discussions;
        }
    }
}
