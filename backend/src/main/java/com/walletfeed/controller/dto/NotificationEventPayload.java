package com.walletfeed.controller.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Wire form of a notification event. The {@code type} property carries the
 * event kind; the remaining fields depend on it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NotificationEventPayload.CommentOnPostEvent.class, name = "COMMENT_ON_POST"),
        @JsonSubTypes.Type(value = NotificationEventPayload.MentionedInPostEvent.class, name = "MENTIONED_IN_POST"),
        @JsonSubTypes.Type(value = NotificationEventPayload.MentionedInCommentEvent.class, name = "MENTIONED_IN_COMMENT"),
        @JsonSubTypes.Type(value = NotificationEventPayload.FollowedEvent.class, name = "FOLLOWED"),
        @JsonSubTypes.Type(value = NotificationEventPayload.LikedPostEvent.class, name = "LIKED_POST"),
        @JsonSubTypes.Type(value = NotificationEventPayload.LikedCommentEvent.class, name = "LIKED_COMMENT"),
        @JsonSubTypes.Type(value = NotificationEventPayload.RepostEvent.class, name = "REPOST")
})
public interface NotificationEventPayload {

    record CommentOnPostEvent(String commentor, Long postId, Long commentId, String commentText)
            implements NotificationEventPayload {
    }

    record MentionedInPostEvent(String mentionedBy, Long postId) implements NotificationEventPayload {
    }

    record MentionedInCommentEvent(String mentionedBy, Long postId, Long commentId)
            implements NotificationEventPayload {
    }

    record FollowedEvent(String followedBy) implements NotificationEventPayload {
    }

    record LikedPostEvent(String likedBy, Long postId) implements NotificationEventPayload {
    }

    record LikedCommentEvent(String likedBy, Long postId, Long commentId) implements NotificationEventPayload {
    }

    record RepostEvent(String repostedBy, Long repostId, Long originalPostId) implements NotificationEventPayload {
    }
}
