package com.dsync.service;

import com.dsync.repo.domain.SyncDirection;
import com.dsync.repo.domain.SyncMessage;
import com.dsync.repo.domain.SyncPlan;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which side of a linked pair is behind and which messages it is missing.
 * <p>
 * The comparison is purely positional: both sequences are assumed append-only, and the messages
 * pushed on an earlier pass are assumed to still occupy the front of the shorter sequence.
 * A message deleted on one side therefore shifts the window and the next pass re-pushes or
 * skips messages. Both inputs must already exclude their seed message.
 */
@Component
public class MessageDiffEngine {

    public SyncPlan diff(List<SyncMessage> discussionMessages, List<SyncMessage> threadMessages) {
        int discussionCount = discussionMessages.size();
        int threadCount = threadMessages.size();

        if (discussionCount == threadCount) {
            return SyncPlan.noop();
        }
        if (threadCount < discussionCount) {
            return new SyncPlan(SyncDirection.GITHUB_TO_DISCORD, tail(discussionMessages, threadCount));
        }
        return new SyncPlan(SyncDirection.DISCORD_TO_GITHUB, tail(threadMessages, discussionCount));
    }

    private static List<SyncMessage> tail(List<SyncMessage> longer, int fromIndex) {
        return new ArrayList<>(longer.subList(fromIndex, longer.size()));
    }
}
