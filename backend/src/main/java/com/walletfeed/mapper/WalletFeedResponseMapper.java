package com.walletfeed.mapper;

import com.walletfeed.controller.dto.NotificationEventPayload;
import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.model.Comment;
import com.walletfeed.model.CommentLike;
import com.walletfeed.model.Erc20Transfer;
import com.walletfeed.model.Erc721Transfer;
import com.walletfeed.model.Follow;
import com.walletfeed.model.Notification;
import com.walletfeed.model.NotificationEvent;
import com.walletfeed.model.Post;
import com.walletfeed.model.PostLike;
import com.walletfeed.model.Transaction;
import com.walletfeed.model.WalletUser;
import com.walletfeed.repository.CommentRepository;
import com.walletfeed.repository.PostLikeRepository;
import com.walletfeed.repository.PostRepository;
import com.walletfeed.social.FollowService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;

@Component
@RequiredArgsConstructor
public class WalletFeedResponseMapper {

    private final CommentRepository commentRepository;
    private final PostLikeRepository postLikeRepository;
    private final PostRepository postRepository;

    public WalletFeedResponses.PostResponse toPostResponse(Post post) {
        return new WalletFeedResponses.PostResponse(
                post.getId(),
                post.getAuthor().getWallet(),
                post.getText(),
                post.getImageUrl(),
                Boolean.TRUE.equals(post.getIsShare()),
                Boolean.TRUE.equals(post.getIsQuote()),
                post.getRefPost() != null ? post.getRefPost().getId() : null,
                toTransactionResponse(post.getRefTx()),
                wallets(post.getTaggedUsers()),
                commentRepository.countByPostId(post.getId()),
                postLikeRepository.countByPostId(post.getId()),
                postRepository.countShares(post.getId()),
                post.getCreatedAt(),
                post.getUpdatedAt()
        );
    }

    public WalletFeedResponses.TransactionResponse toTransactionResponse(Transaction transaction) {
        if (transaction == null) {
            return null;
        }
        return new WalletFeedResponses.TransactionResponse(
                transaction.getChainId(),
                transaction.getTxHash(),
                transaction.getBlockSignedAt(),
                transaction.getTxOffset(),
                transaction.getSuccessful(),
                transaction.getFromAddress(),
                transaction.getToAddress(),
                transaction.getValue(),
                transaction.getErc20Transfers().stream().map(this::toErc20Response).toList(),
                transaction.getErc721Transfers().stream().map(this::toErc721Response).toList()
        );
    }

    public WalletFeedResponses.CommentResponse toCommentResponse(Comment comment) {
        return new WalletFeedResponses.CommentResponse(
                comment.getId(),
                comment.getPost().getId(),
                comment.getAuthor().getWallet(),
                comment.getText(),
                wallets(comment.getTaggedUsers()),
                comment.getCreatedAt()
        );
    }

    public List<WalletFeedResponses.CommentResponse> toCommentResponses(Collection<Comment> comments) {
        return comments.stream()
                .map(this::toCommentResponse)
                .toList();
    }

    public WalletFeedResponses.LikeResponse toLikeResponse(PostLike like) {
        return new WalletFeedResponses.LikeResponse(
                like.getLiker().getWallet(), like.getPost().getId(), null, like.getCreatedAt());
    }

    public WalletFeedResponses.LikeResponse toLikeResponse(CommentLike like) {
        return new WalletFeedResponses.LikeResponse(
                like.getLiker().getWallet(), null, like.getComment().getId(), like.getCreatedAt());
    }

    public WalletFeedResponses.FollowResponse toFollowResponse(Follow follow) {
        return new WalletFeedResponses.FollowResponse(
                follow.getSrc().getWallet(), follow.getDest().getWallet(), follow.getCreatedAt());
    }

    public WalletFeedResponses.WalletProfile toWalletProfile(FollowService.FollowStats stats) {
        return new WalletFeedResponses.WalletProfile(
                stats.wallet(), stats.followers(), stats.following(), stats.followedByViewer());
    }

    public WalletFeedResponses.NotificationResponse toNotificationResponse(Notification notification) {
        return new WalletFeedResponses.NotificationResponse(
                notification.getId(),
                Boolean.TRUE.equals(notification.getViewed()),
                notification.getCreatedAt(),
                toEventPayload(notification.getEvent())
        );
    }

    public NotificationEventPayload toEventPayload(NotificationEvent event) {
        String actor = event.getActor().getWallet();
        return switch (event.getType()) {
            case COMMENT_ON_POST -> new NotificationEventPayload.CommentOnPostEvent(
                    actor, event.getPost().getId(), event.getComment().getId(), event.getComment().getText());
            case MENTIONED_IN_POST -> new NotificationEventPayload.MentionedInPostEvent(actor, event.getPost().getId());
            case MENTIONED_IN_COMMENT -> new NotificationEventPayload.MentionedInCommentEvent(
                    actor, event.getComment().getPost().getId(), event.getComment().getId());
            case FOLLOWED -> new NotificationEventPayload.FollowedEvent(actor);
            case LIKED_POST -> new NotificationEventPayload.LikedPostEvent(actor, event.getPost().getId());
            case LIKED_COMMENT -> new NotificationEventPayload.LikedCommentEvent(
                    actor, event.getComment().getPost().getId(), event.getComment().getId());
            case REPOST -> new NotificationEventPayload.RepostEvent(
                    actor,
                    event.getPost().getId(),
                    event.getPost().getRefPost() != null ? event.getPost().getRefPost().getId() : null);
        };
    }

    public <E, R> WalletFeedResponses.PageResponse<R> toPageResponse(Page<E> page, Function<E, R> mapper) {
        return new WalletFeedResponses.PageResponse<>(
                page.getContent().stream().map(mapper).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }

    private WalletFeedResponses.Erc20TransferResponse toErc20Response(Erc20Transfer transfer) {
        return new WalletFeedResponses.Erc20TransferResponse(
                transfer.getContractAddress(),
                transfer.getContractName(),
                transfer.getContractTicker(),
                transfer.getLogoUrl(),
                transfer.getFromAddress(),
                transfer.getToAddress(),
                transfer.getAmount(),
                transfer.getDecimals()
        );
    }

    private WalletFeedResponses.Erc721TransferResponse toErc721Response(Erc721Transfer transfer) {
        return new WalletFeedResponses.Erc721TransferResponse(
                transfer.getContractAddress(),
                transfer.getContractName(),
                transfer.getContractTicker(),
                transfer.getLogoUrl(),
                transfer.getFromAddress(),
                transfer.getToAddress(),
                transfer.getTokenId()
        );
    }

    private static List<String> wallets(Collection<WalletUser> users) {
        if (users == null) {
            return List.of();
        }
        return users.stream()
                .map(WalletUser::getWallet)
                .sorted()
                .toList();
    }
}
