package com.dsync.service;

import org.springframework.context.ApplicationEvent;

/**
 * A MESSAGE_CREATE dispatch received from the Discord gateway, in any channel.
 */
public class ThreadMessageCreatedEvent extends ApplicationEvent {

    private final String channelId;

    private final String messageId;

    private final String authorId;

    private final boolean authorBot;

    private final String content;

    public ThreadMessageCreatedEvent(Object source, String channelId, String messageId,
                                     String authorId, boolean authorBot, String content) {
        super(source);
        this.channelId = channelId;
        this.messageId = messageId;
        this.authorId = authorId;
        this.authorBot = authorBot;
        this.content = content;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getAuthorId() {
        return authorId;
    }

    public boolean isAuthorBot() {
        return authorBot;
    }

    public String getContent() {
        return content;
    }
}
