package com.dsync.repo.domain;

/**
 * One message of a discussion or of a thread, as seen by the diff and transform layer.
 * Discussion comments and Discord thread messages are both mapped to this type.
 */
public class SyncMessage {

    private String id;

    private String author;

    private String text;

    private boolean mirrored; // produced by this service rather than written natively

    private int position; // index in the seed-excluded sequence

    private String url; // link back to the message on its own platform, may be null

    public SyncMessage() {
    }

    public SyncMessage(String id, String author, String text, boolean mirrored, int position) {
        this.id = id;
        this.author = author;
        this.text = text;
        this.mirrored = mirrored;
        this.position = position;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public boolean isMirrored() {
        return mirrored;
    }

    public void setMirrored(boolean mirrored) {
        this.mirrored = mirrored;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    @Override
    public String toString() {
        return "SyncMessage{" +
                "id='" + id + '\'' +
                ", author=" + author +
                ", position=" + position +
                ", mirrored=" + mirrored +
                '}';
    }
}
