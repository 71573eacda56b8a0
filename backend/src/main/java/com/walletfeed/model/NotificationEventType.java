package com.walletfeed.model;

/**
 * Discriminant of {@link NotificationEvent}. Each kind fixes which payload
 * references are populated.
 */
public enum NotificationEventType {
    COMMENT_ON_POST(true, true),
    MENTIONED_IN_POST(true, false),
    MENTIONED_IN_COMMENT(false, true),
    FOLLOWED(false, false),
    LIKED_POST(true, false),
    LIKED_COMMENT(false, true),
    REPOST(true, false);

    private final boolean carriesPost;
    private final boolean carriesComment;

    NotificationEventType(boolean carriesPost, boolean carriesComment) {
        this.carriesPost = carriesPost;
        this.carriesComment = carriesComment;
    }

    public boolean carriesPost() {
        return carriesPost;
    }

    public boolean carriesComment() {
        return carriesComment;
    }
}
