package com.walletfeed.controller;

import com.walletfeed.mapper.WalletFeedResponseMapper;
import com.walletfeed.model.Post;
import com.walletfeed.model.WalletUser;
import com.walletfeed.repository.CommentRepository;
import com.walletfeed.repository.PostLikeRepository;
import com.walletfeed.repository.PostRepository;
import com.walletfeed.social.PostService;
import com.walletfeed.wallet.HeaderWalletAuthenticator;
import com.walletfeed.web.DuplicateActionException;
import com.walletfeed.web.PermissionDeniedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PostController.class)
@Import({WalletFeedResponseMapper.class, HeaderWalletAuthenticator.class})
class PostControllerTest {

    private static final String ALICE = "0x5555555555555555555555555555555555555555";
    private static final String BOB = "0x6666666666666666666666666666666666666666";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PostService postService;

    @MockitoBean
    private PostRepository postRepository;

    @MockitoBean
    private CommentRepository commentRepository;

    @MockitoBean
    private PostLikeRepository postLikeRepository;

    @Test
    void createPostReturnsCreatedPost() throws Exception {
        Post post = postEntity(10L, ALICE, "gm");
        when(postService.createPost(eq(ALICE), eq("gm"), isNull(), isNull(), eq(List.of(BOB)))).thenReturn(post);
        when(postLikeRepository.countByPostId(10L)).thenReturn(4L);

        mockMvc.perform(post("/api/posts")
                        .header(HeaderWalletAuthenticator.WALLET_HEADER, ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"gm","taggedWallets":["%s"]}
                                """.formatted(BOB)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(10))
                .andExpect(jsonPath("$.author").value(ALICE))
                .andExpect(jsonPath("$.text").value("gm"))
                .andExpect(jsonPath("$.numLikes").value(4))
                .andExpect(jsonPath("$.refTx").isEmpty());
    }

    @Test
    void createPostWithoutWalletHeaderIsUnauthenticated() throws Exception {
        mockMvc.perform(post("/api/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"gm\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthenticated"));

        verifyNoInteractions(postService);
    }

    @Test
    void createPostRejectsOversizedText() throws Exception {
        mockMvc.perform(post("/api/posts")
                        .header(HeaderWalletAuthenticator.WALLET_HEADER, ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"" + "x".repeat(5001) + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.fieldErrors.text").exists());
    }

    @Test
    void lowercaseWalletHeaderIsChecksummed() throws Exception {
        String lowercase = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
        String checksummed = "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48";
        when(postService.repost(checksummed, 10L)).thenReturn(share(11L, checksummed, postEntity(10L, BOB, "gm")));

        mockMvc.perform(post("/api/posts/10/repost").header(HeaderWalletAuthenticator.WALLET_HEADER, lowercase))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.author").value(checksummed))
                .andExpect(jsonPath("$.refPostId").value(10));
    }

    @Test
    void duplicateRepostIsBadRequest() throws Exception {
        when(postService.repost(ALICE, 10L)).thenThrow(DuplicateActionException.alreadyReposted("Post 10 already reposted"));

        mockMvc.perform(post("/api/posts/10/repost").header(HeaderWalletAuthenticator.WALLET_HEADER, ALICE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("already_reposted"));
    }

    @Test
    void deletingSomeoneElsesPostIsForbidden() throws Exception {
        doThrow(new PermissionDeniedException("Only the author can modify post 10"))
                .when(postService).deletePost(BOB, 10L);

        mockMvc.perform(delete("/api/posts/10").header(HeaderWalletAuthenticator.WALLET_HEADER, BOB))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("permission_denied"));
    }

    @Test
    void feedReturnsPagedPosts() throws Exception {
        PageRequest pageable = PageRequest.of(0, 2);
        when(postService.getFeed(ALICE, 0, 2)).thenReturn(new PageImpl<>(
                List.of(postEntity(12L, BOB, "second"), postEntity(11L, ALICE, "first")), pageable, 3));

        mockMvc.perform(get("/api/feed")
                        .header(HeaderWalletAuthenticator.WALLET_HEADER, ALICE)
                        .param("size", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.items[0].id").value(12))
                .andExpect(jsonPath("$.totalElements").value(3))
                .andExpect(jsonPath("$.totalPages").value(2));
    }

    @Test
    void authorListingIsPublic() throws Exception {
        when(postService.listPostsByAuthor(BOB, 1)).thenReturn(new PageImpl<>(
                List.of(postEntity(3L, BOB, "old")), PageRequest.of(1, PostService.AUTHOR_PAGE_SIZE), 21));

        mockMvc.perform(get("/api/wallets/" + BOB + "/posts").param("page", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page").value(1))
                .andExpect(jsonPath("$.items[0].author").value(BOB));
    }

    private static Post postEntity(Long id, String wallet, String text) {
        WalletUser author = new WalletUser(wallet);
        Post post = new Post();
        post.setId(id);
        post.setAuthor(author);
        post.setText(text);
        return post;
    }

    private static Post share(Long id, String wallet, Post original) {
        Post share = postEntity(id, wallet, null);
        share.setIsShare(true);
        share.setRefPost(original);
        return share;
    }
}
