package com.walletfeed.controller;

import com.walletfeed.mapper.WalletFeedResponseMapper;
import com.walletfeed.repository.CommentRepository;
import com.walletfeed.repository.PostLikeRepository;
import com.walletfeed.repository.PostRepository;
import com.walletfeed.social.FollowService;
import com.walletfeed.wallet.HeaderWalletAuthenticator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExploreController.class)
@Import({WalletFeedResponseMapper.class, HeaderWalletAuthenticator.class})
class ExploreControllerTest {

    private static final String ALICE = "0x5555555555555555555555555555555555555555";
    private static final String BOB = "0x6666666666666666666666666666666666666666";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private FollowService followService;

    @MockitoBean
    private PostRepository postRepository;

    @MockitoBean
    private CommentRepository commentRepository;

    @MockitoBean
    private PostLikeRepository postLikeRepository;

    @Test
    void anonymousExploreListsMostFollowedFirst() throws Exception {
        when(followService.explore(null)).thenReturn(List.of(
                new FollowService.FollowStats(BOB, 9, 0, false),
                new FollowService.FollowStats(ALICE, 2, 1, false)));

        mockMvc.perform(get("/api/explore"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].wallet").value(BOB))
                .andExpect(jsonPath("$[0].followers").value(9))
                .andExpect(jsonPath("$[1].wallet").value(ALICE));
    }

    @Test
    void authenticatedExplorePassesViewer() throws Exception {
        when(followService.explore(ALICE)).thenReturn(List.of(new FollowService.FollowStats(BOB, 9, 0, true)));

        mockMvc.perform(get("/api/explore").header(HeaderWalletAuthenticator.WALLET_HEADER, ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].followedByViewer").value(true));
    }
}
