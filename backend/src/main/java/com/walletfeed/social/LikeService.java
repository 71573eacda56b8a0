package com.walletfeed.social;

import com.walletfeed.model.Comment;
import com.walletfeed.model.CommentLike;
import com.walletfeed.model.Post;
import com.walletfeed.model.PostLike;
import com.walletfeed.model.WalletUser;
import com.walletfeed.notification.NotificationService;
import com.walletfeed.repository.CommentLikeRepository;
import com.walletfeed.repository.CommentRepository;
import com.walletfeed.repository.PostLikeRepository;
import com.walletfeed.repository.PostRepository;
import com.walletfeed.wallet.WalletUserService;
import com.walletfeed.web.DuplicateActionException;
import com.walletfeed.web.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Likes on posts and comments. A wallet likes a target at most once; unliking
 * removes the row so the target can be liked again.
 */
@Service
@RequiredArgsConstructor
public class LikeService {

    private final PostLikeRepository postLikeRepository;
    private final CommentLikeRepository commentLikeRepository;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final WalletUserService walletUserService;
    private final NotificationService notificationService;

    @Transactional
    public PostLike likePost(String wallet, Long postId) {
        WalletUser liker = walletUserService.require(wallet);
        Post post = postRepository.findById(postId)
                .orElseThrow(() -> NotFoundException.post(postId));
        if (postLikeRepository.existsByLikerIdAndPostId(liker.getId(), postId)) {
            throw DuplicateActionException.alreadyLiked("Post " + postId + " already liked");
        }

        PostLike like = new PostLike();
        like.setLiker(liker);
        like.setPost(post);
        PostLike saved;
        try {
            saved = postLikeRepository.saveAndFlush(like);
        } catch (DataIntegrityViolationException ex) {
            throw DuplicateActionException.alreadyLiked("Post " + postId + " already liked");
        }
        notificationService.notifyLikedPost(saved);
        return saved;
    }

    @Transactional
    public void unlikePost(String wallet, Long postId) {
        WalletUser liker = walletUserService.require(wallet);
        PostLike like = postLikeRepository.findByLikerIdAndPostId(liker.getId(), postId)
                .orElseThrow(() -> new NotFoundException("Like not found for post " + postId));
        postLikeRepository.delete(like);
        // Hibernate orders inserts before deletes; a re-like in the same transaction needs the row gone.
        postLikeRepository.flush();
    }

    @Transactional
    public CommentLike likeComment(String wallet, Long commentId) {
        WalletUser liker = walletUserService.require(wallet);
        Comment comment = commentRepository.findById(commentId)
                .orElseThrow(() -> NotFoundException.comment(commentId));
        if (commentLikeRepository.existsByLikerIdAndCommentId(liker.getId(), commentId)) {
            throw DuplicateActionException.alreadyLiked("Comment " + commentId + " already liked");
        }

        CommentLike like = new CommentLike();
        like.setLiker(liker);
        like.setComment(comment);
        CommentLike saved;
        try {
            saved = commentLikeRepository.saveAndFlush(like);
        } catch (DataIntegrityViolationException ex) {
            throw DuplicateActionException.alreadyLiked("Comment " + commentId + " already liked");
        }
        notificationService.notifyLikedComment(saved);
        return saved;
    }

    @Transactional
    public void unlikeComment(String wallet, Long commentId) {
        WalletUser liker = walletUserService.require(wallet);
        CommentLike like = commentLikeRepository.findByLikerIdAndCommentId(liker.getId(), commentId)
                .orElseThrow(() -> new NotFoundException("Like not found for comment " + commentId));
        commentLikeRepository.delete(like);
        commentLikeRepository.flush();
    }
}
