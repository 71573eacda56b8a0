package com.walletfeed.social;

import com.walletfeed.model.Comment;
import com.walletfeed.model.Post;
import com.walletfeed.model.WalletUser;
import com.walletfeed.notification.NotificationService;
import com.walletfeed.repository.CommentRepository;
import com.walletfeed.repository.PostRepository;
import com.walletfeed.wallet.WalletUserService;
import com.walletfeed.web.NotFoundException;
import com.walletfeed.web.PermissionDeniedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Service
@RequiredArgsConstructor
public class CommentService {

    private final CommentRepository commentRepository;
    private final PostRepository postRepository;
    private final WalletUserService walletUserService;
    private final NotificationService notificationService;

    /**
     * Adds a comment and notifies the post author and every tagged wallet.
     */
    @Transactional
    public Comment createComment(String wallet, Long postId, String text, Collection<String> taggedWallets) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Comment text is required");
        }
        WalletUser author = walletUserService.require(wallet);
        Post post = postRepository.findById(postId)
                .orElseThrow(() -> NotFoundException.post(postId));

        Comment comment = new Comment();
        comment.setAuthor(author);
        comment.setPost(post);
        comment.setText(text);
        comment.getTaggedUsers().addAll(walletUserService.requireAll(taggedWallets));

        Comment saved = commentRepository.save(comment);
        notificationService.notifyCommentOnPost(saved);
        notificationService.notifyMentionedInComment(saved);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Comment> listComments(Long postId) {
        if (!postRepository.existsById(postId)) {
            throw NotFoundException.post(postId);
        }
        return commentRepository.findByPostIdOrderByCreatedAtAsc(postId);
    }

    @Transactional(readOnly = true)
    public Comment getComment(Long commentId) {
        return commentRepository.findById(commentId)
                .orElseThrow(() -> NotFoundException.comment(commentId));
    }

    @Transactional
    public void deleteComment(String wallet, Long commentId) {
        WalletUser caller = walletUserService.require(wallet);
        Comment comment = getComment(commentId);
        if (!comment.getAuthor().getId().equals(caller.getId())) {
            throw new PermissionDeniedException("Only the author can delete comment " + commentId);
        }
        commentRepository.delete(comment);
    }
}
