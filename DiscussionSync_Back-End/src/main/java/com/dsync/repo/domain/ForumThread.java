package com.dsync.repo.domain;

/**
 * A thread of the Discord forum channel.
 */
public class ForumThread {

    private String id;

    private String name;

    private String parentId; // forum channel the thread belongs to

    private String guildId;

    public ForumThread() {
    }

    public ForumThread(String id, String name, String parentId, String guildId) {
        this.id = id;
        this.name = name;
        this.parentId = parentId;
        this.guildId = guildId;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public String getGuildId() {
        return guildId;
    }

    public void setGuildId(String guildId) {
        this.guildId = guildId;
    }

    @Override
    public String toString() {
        return "ForumThread{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", parentId='" + parentId + '\'' +
                '}';
    }
}
