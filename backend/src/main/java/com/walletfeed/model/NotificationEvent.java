package com.walletfeed.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.util.Objects;

/**
 * Typed event owned by exactly one {@link Notification}.
 * <p>
 * Stored as a tag plus the references the tag requires. For {@code REPOST}
 * the post reference is the share itself, not the original.
 * Instances are built only through the static factories so the payload
 * always matches its tag.
 */
@Embeddable
public class NotificationEvent {

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 32)
    private NotificationEventType type;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "actor_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private WalletUser actor;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "post_id", updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Post post;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "comment_id", updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Comment comment;

    protected NotificationEvent() {
    }

    private NotificationEvent(NotificationEventType type, WalletUser actor, Post post, Comment comment) {
        this.type = Objects.requireNonNull(type, "type is required");
        this.actor = Objects.requireNonNull(actor, "actor is required");
        if (type.carriesPost() != (post != null)) {
            throw new IllegalArgumentException(type + " event " + (type.carriesPost() ? "requires" : "does not take") + " a post");
        }
        if (type.carriesComment() != (comment != null)) {
            throw new IllegalArgumentException(type + " event " + (type.carriesComment() ? "requires" : "does not take") + " a comment");
        }
        this.post = post;
        this.comment = comment;
    }

    public static NotificationEvent commentOnPost(WalletUser commentor, Post post, Comment comment) {
        return new NotificationEvent(NotificationEventType.COMMENT_ON_POST, commentor, post, comment);
    }

    public static NotificationEvent mentionedInPost(WalletUser mentionedBy, Post post) {
        return new NotificationEvent(NotificationEventType.MENTIONED_IN_POST, mentionedBy, post, null);
    }

    public static NotificationEvent mentionedInComment(WalletUser mentionedBy, Comment comment) {
        return new NotificationEvent(NotificationEventType.MENTIONED_IN_COMMENT, mentionedBy, null, comment);
    }

    public static NotificationEvent followed(WalletUser followedBy) {
        return new NotificationEvent(NotificationEventType.FOLLOWED, followedBy, null, null);
    }

    public static NotificationEvent likedPost(WalletUser likedBy, Post post) {
        return new NotificationEvent(NotificationEventType.LIKED_POST, likedBy, post, null);
    }

    public static NotificationEvent likedComment(WalletUser likedBy, Comment comment) {
        return new NotificationEvent(NotificationEventType.LIKED_COMMENT, likedBy, null, comment);
    }

    public static NotificationEvent repost(WalletUser repostedBy, Post repost) {
        return new NotificationEvent(NotificationEventType.REPOST, repostedBy, repost, null);
    }

    public NotificationEventType getType() {
        return type;
    }

    public WalletUser getActor() {
        return actor;
    }

    public Post getPost() {
        return post;
    }

    public Comment getComment() {
        return comment;
    }
}
