package com.radarloop.model;

/**
 * User-facing message posted on the event bus. Errors may carry a link to a page explaining
 * the problem (e.g. a radar outage notice).
 */
public class AppMessage {
    protected String message;

    public enum Type {ERROR,INFO,PROGRESS};

    protected Type type;
    protected String site;
    protected String link;

    public AppMessage(String message, Type type) {
        this.message = message;
        this.type = type;
    }

    public AppMessage(String site, String message, Type type, String link) {
        this.site = site;
        this.message = message;
        this.type = type;
        this.link = link;
    }

    public String getMessage() {
        return message;
    }

    public Type getType() {
        return type;
    }

    public String getSite() {
        return site;
    }

    public String getLink() {
        return link;
    }

    @Override
    public String toString() {
        return "AppMessage{" + type + ": " + message + (link == null ? "" : " (" + link + ")") + '}';
    }
}
