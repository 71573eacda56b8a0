package com.walletfeed.social;

import com.walletfeed.model.Post;
import com.walletfeed.model.WalletUser;
import com.walletfeed.notification.NotificationService;
import com.walletfeed.repository.PostRepository;
import com.walletfeed.wallet.WalletAddresses;
import com.walletfeed.wallet.WalletUserService;
import com.walletfeed.web.DuplicateActionException;
import com.walletfeed.web.NotFoundException;
import com.walletfeed.web.PermissionDeniedException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;

@Service
@RequiredArgsConstructor
public class PostService {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    public static final int AUTHOR_PAGE_SIZE = 20;
    static final int MAX_FEED_PAGE_SIZE = 100;

    private final PostRepository postRepository;
    private final WalletUserService walletUserService;
    private final NotificationService notificationService;

    /**
     * Creates an original post, or a quote when {@code quotedPostId} is set.
     * Tagged wallets must already be registered and are notified.
     */
    @Transactional
    public Post createPost(String wallet, String text, String imageUrl, Long quotedPostId, Collection<String> taggedWallets) {
        WalletUser author = walletUserService.require(wallet);
        if (isBlank(text) && isBlank(imageUrl) && quotedPostId == null) {
            throw new IllegalArgumentException("A post needs text, an image or a quoted post");
        }

        Post post = new Post();
        post.setAuthor(author);
        post.setText(text);
        post.setImageUrl(imageUrl);
        if (quotedPostId != null) {
            Post quoted = getPost(quotedPostId);
            post.setIsQuote(true);
            post.setRefPost(Boolean.TRUE.equals(quoted.getIsShare()) ? quoted.getRefPost() : quoted);
        }
        post.getTaggedUsers().addAll(walletUserService.requireAll(taggedWallets));

        Post saved = postRepository.save(post);
        notificationService.notifyMentionedInPost(saved);
        log.debug("Post {} created by {}", saved.getId(), author.getWallet());
        return saved;
    }

    @Transactional(readOnly = true)
    public Post getPost(Long postId) {
        return postRepository.findById(postId)
                .orElseThrow(() -> NotFoundException.post(postId));
    }

    /**
     * Newest-first posts by one wallet, {@value #AUTHOR_PAGE_SIZE} per page.
     */
    @Transactional(readOnly = true)
    public Page<Post> listPostsByAuthor(String address, int page) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        String wallet = WalletAddresses.toChecksum(address);
        return postRepository.findByAuthorWalletOrderByCreatedAtDesc(wallet, PageRequest.of(page, AUTHOR_PAGE_SIZE));
    }

    /**
     * Newest-first posts by the caller and every wallet they follow.
     */
    @Transactional(readOnly = true)
    public Page<Post> getFeed(String wallet, int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size < 1 || size > MAX_FEED_PAGE_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_FEED_PAGE_SIZE);
        }
        WalletUser viewer = walletUserService.require(wallet);
        return postRepository.findFeedForUser(viewer.getId(), PageRequest.of(page, size));
    }

    @Transactional
    public Post updatePost(String wallet, Long postId, String text, String imageUrl) {
        Post post = requireOwnPost(wallet, postId);
        if (Boolean.TRUE.equals(post.getIsShare())) {
            throw new IllegalArgumentException("Reposts cannot be edited");
        }
        post.setText(text);
        post.setImageUrl(imageUrl);
        post.setUpdatedAt(OffsetDateTime.now());
        return postRepository.save(post);
    }

    @Transactional
    public void deletePost(String wallet, Long postId) {
        Post post = requireOwnPost(wallet, postId);
        postRepository.delete(post);
        log.debug("Post {} deleted by {}", postId, wallet);
    }

    /**
     * Shares another wallet's post. A wallet shares a given post at most once,
     * cannot share its own posts and cannot share a share.
     */
    @Transactional
    public Post repost(String wallet, Long postId) {
        WalletUser reposter = walletUserService.require(wallet);
        Post original = getPost(postId);
        if (Boolean.TRUE.equals(original.getIsShare())) {
            throw DuplicateActionException.repostOfRepost("Cannot repost a repost; repost the original post instead");
        }
        if (original.getAuthor().getId().equals(reposter.getId())) {
            throw DuplicateActionException.ownPostRepost("Cannot repost your own post");
        }
        if (postRepository.existsShareByAuthor(reposter.getId(), original.getId())) {
            throw DuplicateActionException.alreadyReposted("Post " + postId + " already reposted");
        }

        Post share = new Post();
        share.setAuthor(reposter);
        share.setIsShare(true);
        share.setRefPost(original);
        Post saved;
        try {
            saved = postRepository.saveAndFlush(share);
        } catch (DataIntegrityViolationException ex) {
            throw DuplicateActionException.alreadyReposted("Post " + postId + " already reposted");
        }
        notificationService.notifyReposted(saved);
        log.debug("Post {} reposted by {} as {}", postId, reposter.getWallet(), saved.getId());
        return saved;
    }

    private Post requireOwnPost(String wallet, Long postId) {
        WalletUser caller = walletUserService.require(wallet);
        Post post = getPost(postId);
        if (!post.getAuthor().getId().equals(caller.getId())) {
            throw new PermissionDeniedException("Only the author can modify post " + postId);
        }
        return post;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
