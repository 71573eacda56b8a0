package com.walletfeed.notification;

import com.walletfeed.model.Comment;
import com.walletfeed.model.CommentLike;
import com.walletfeed.model.Follow;
import com.walletfeed.model.Notification;
import com.walletfeed.model.NotificationEvent;
import com.walletfeed.model.Post;
import com.walletfeed.model.PostLike;
import com.walletfeed.model.WalletUser;
import com.walletfeed.repository.NotificationRepository;
import com.walletfeed.wallet.WalletUserService;
import com.walletfeed.web.PermissionDeniedException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fans social actions out into per-recipient notifications.
 * <p>
 * Each policy method is called explicitly by the service that performed the
 * action, inside the same transaction. Nobody is notified about their own
 * action, and events are never coalesced.
 */
@Service
@RequiredArgsConstructor
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);
    static final int MAX_PAGE_SIZE = 100;

    private final NotificationRepository notificationRepository;
    private final WalletUserService walletUserService;

    @Transactional
    public Notification notify(WalletUser recipient, NotificationEvent event) {
        Notification notification = new Notification();
        notification.setRecipient(Objects.requireNonNull(recipient, "recipient is required"));
        notification.setEvent(Objects.requireNonNull(event, "event is required"));
        notification.setViewed(false);
        Notification saved = notificationRepository.save(notification);
        log.debug("Notified {} of {} by {}", recipient.getWallet(), event.getType(), event.getActor().getWallet());
        return saved;
    }

    /**
     * Notifies the post author, unless they wrote the comment.
     */
    @Transactional
    public int notifyCommentOnPost(Comment comment) {
        Post post = comment.getPost();
        if (isSameUser(post.getAuthor(), comment.getAuthor())) {
            return 0;
        }
        notify(post.getAuthor(), NotificationEvent.commentOnPost(comment.getAuthor(), post, comment));
        return 1;
    }

    @Transactional
    public int notifyMentionedInPost(Post post) {
        int sent = 0;
        for (WalletUser tagged : mentionRecipients(post.getTaggedUsers(), post.getAuthor())) {
            notify(tagged, NotificationEvent.mentionedInPost(post.getAuthor(), post));
            sent++;
        }
        return sent;
    }

    @Transactional
    public int notifyMentionedInComment(Comment comment) {
        int sent = 0;
        for (WalletUser tagged : mentionRecipients(comment.getTaggedUsers(), comment.getAuthor())) {
            notify(tagged, NotificationEvent.mentionedInComment(comment.getAuthor(), comment));
            sent++;
        }
        return sent;
    }

    @Transactional
    public int notifyFollowed(Follow follow) {
        notify(follow.getDest(), NotificationEvent.followed(follow.getSrc()));
        return 1;
    }

    @Transactional
    public int notifyLikedPost(PostLike like) {
        Post post = like.getPost();
        if (isSameUser(post.getAuthor(), like.getLiker())) {
            return 0;
        }
        notify(post.getAuthor(), NotificationEvent.likedPost(like.getLiker(), post));
        return 1;
    }

    @Transactional
    public int notifyLikedComment(CommentLike like) {
        Comment comment = like.getComment();
        if (isSameUser(comment.getAuthor(), like.getLiker())) {
            return 0;
        }
        notify(comment.getAuthor(), NotificationEvent.likedComment(like.getLiker(), comment));
        return 1;
    }

    /**
     * Notifies the author of the reposted post. Self-reposts are rejected before this point.
     */
    @Transactional
    public int notifyReposted(Post repost) {
        Post original = repost.getRefPost();
        if (original == null || isSameUser(original.getAuthor(), repost.getAuthor())) {
            return 0;
        }
        notify(original.getAuthor(), NotificationEvent.repost(repost.getAuthor(), repost));
        return 1;
    }

    @Transactional(readOnly = true)
    public Page<Notification> listNotifications(String wallet, int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_PAGE_SIZE);
        }
        WalletUser recipient = walletUserService.require(wallet);
        return notificationRepository.findByRecipientIdOrderByCreatedAtDescIdDesc(
                recipient.getId(), PageRequest.of(page, size));
    }

    @Transactional(readOnly = true)
    public long countUnviewed(String wallet) {
        WalletUser recipient = walletUserService.require(wallet);
        return notificationRepository.countByRecipientIdAndViewedFalse(recipient.getId());
    }

    /**
     * Marks the caller's notifications as viewed. Either every id exists and
     * belongs to the caller, or nothing is updated.
     *
     * @return number of notifications updated
     * @throws PermissionDeniedException when any id is unknown or owned by someone else
     */
    @Transactional
    public int markViewed(String wallet, List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("ids must not be empty");
        }
        WalletUser recipient = walletUserService.require(wallet);
        Set<Long> requested = new LinkedHashSet<>(ids);
        if (requested.contains(null)) {
            throw new IllegalArgumentException("ids must not contain null");
        }

        List<Notification> found = notificationRepository.findByIdIn(requested);
        long owned = found.stream()
                .filter(notification -> isSameUser(notification.getRecipient(), recipient))
                .count();
        if (found.size() != requested.size() || owned != requested.size()) {
            log.info("Wallet {} tried to mark notifications it does not own: {}", recipient.getWallet(), requested);
            throw new PermissionDeniedException("Notifications must exist and belong to the caller");
        }
        return notificationRepository.markViewed(recipient.getId(), requested);
    }

    private static Set<WalletUser> mentionRecipients(Set<WalletUser> tagged, WalletUser actor) {
        Set<WalletUser> recipients = new LinkedHashSet<>();
        if (tagged == null) {
            return recipients;
        }
        for (WalletUser user : tagged) {
            if (!isSameUser(user, actor)) {
                recipients.add(user);
            }
        }
        return recipients;
    }

    static boolean isSameUser(WalletUser left, WalletUser right) {
        if (left == null || right == null) {
            return false;
        }
        if (left.getId() != null && right.getId() != null) {
            return left.getId().equals(right.getId());
        }
        return left.getWallet() != null && left.getWallet().equalsIgnoreCase(right.getWallet());
    }
}
