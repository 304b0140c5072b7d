package com.dsync.repo.domain;

/**
 * A GitHub discussion of the synchronized category.
 * The body is the only field that carries the link to the Discord thread.
 */
public class Discussion {

    private String id; // GraphQL node id

    private int number;

    private String title;

    private String body;

    private String authorLogin;

    private String categoryName;

    private String url;

    // Constructors
    public Discussion() {
    }

    public Discussion(String id, int number, String title, String body, String authorLogin, String categoryName) {
        this.id = id;
        this.number = number;
        this.title = title;
        this.body = body;
        this.authorLogin = authorLogin;
        this.categoryName = categoryName;
    }

    /**
     * Copy of this discussion with another body, used once the link marker has been written.
     */
    public Discussion withBody(String newBody) {
        Discussion copy = new Discussion(id, number, title, newBody, authorLogin, categoryName);
        copy.setUrl(url);
        return copy;
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public int getNumber() {
        return number;
    }

    public void setNumber(int number) {
        this.number = number;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getAuthorLogin() {
        return authorLogin;
    }

    public void setAuthorLogin(String authorLogin) {
        this.authorLogin = authorLogin;
    }

    public String getCategoryName() {
        return categoryName;
    }

    public void setCategoryName(String categoryName) {
        this.categoryName = categoryName;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    @Override
    public String toString() {
        return "Discussion{" +
                "id='" + id + '\'' +
                ", number=" + number +
                ", title='" + title + '\'' +
                ", author=" + authorLogin +
                ", category=" + categoryName +
                '}';
    }
}
