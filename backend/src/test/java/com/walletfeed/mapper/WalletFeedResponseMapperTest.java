package com.walletfeed.mapper;

import com.walletfeed.controller.dto.NotificationEventPayload;
import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.model.Comment;
import com.walletfeed.model.Erc20Transfer;
import com.walletfeed.model.Erc721Transfer;
import com.walletfeed.model.NotificationEvent;
import com.walletfeed.model.Post;
import com.walletfeed.model.Transaction;
import com.walletfeed.model.WalletUser;
import com.walletfeed.repository.CommentRepository;
import com.walletfeed.repository.PostLikeRepository;
import com.walletfeed.repository.PostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletFeedResponseMapperTest {

    private static final String ALICE = "0x5555555555555555555555555555555555555555";
    private static final String BOB = "0x6666666666666666666666666666666666666666";
    private static final String CAROL = "0x7777777777777777777777777777777777777777";

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private PostLikeRepository postLikeRepository;

    @Mock
    private PostRepository postRepository;

    private WalletFeedResponseMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new WalletFeedResponseMapper(commentRepository, postLikeRepository, postRepository);
    }

    @Test
    void transactionPostCarriesTransfersAndCounts() {
        Transaction tx = new Transaction();
        tx.setChainId(1);
        tx.setTxHash("0xabc");
        tx.setBlockSignedAt(OffsetDateTime.of(2024, 3, 1, 8, 0, 0, 0, ZoneOffset.UTC));
        tx.setTxOffset(4);
        tx.setSuccessful(true);
        tx.setFromAddress(ALICE);
        tx.setValue(BigInteger.TEN);
        Erc20Transfer erc20 = new Erc20Transfer();
        erc20.setContractTicker("USDC");
        erc20.setAmount(new BigInteger("1000000"));
        erc20.setDecimals(6);
        tx.addErc20Transfer(erc20);
        Erc721Transfer erc721 = new Erc721Transfer();
        erc721.setTokenId(BigInteger.valueOf(101));
        tx.addErc721Transfer(erc721);

        Post post = post(10L, ALICE);
        post.setRefTx(tx);
        post.setTaggedUsers(new LinkedHashSet<>(List.of(new WalletUser(CAROL), new WalletUser(BOB))));
        when(commentRepository.countByPostId(10L)).thenReturn(2L);
        when(postLikeRepository.countByPostId(10L)).thenReturn(5L);
        when(postRepository.countShares(10L)).thenReturn(1L);

        WalletFeedResponses.PostResponse response = mapper.toPostResponse(post);

        assertEquals(List.of(BOB, CAROL), response.taggedWallets());
        assertEquals(2L, response.numComments());
        assertEquals(5L, response.numLikes());
        assertEquals(1L, response.numReposts());
        assertNull(response.refPostId());
        assertEquals("0xabc", response.refTx().txHash());
        assertEquals("USDC", response.refTx().erc20Transfers().get(0).contractTicker());
        assertEquals(6, response.refTx().erc20Transfers().get(0).decimals());
        assertEquals(BigInteger.valueOf(101), response.refTx().erc721Transfers().get(0).tokenId());
    }

    @Test
    void shareReferencesOriginal() {
        Post share = post(11L, BOB);
        share.setIsShare(true);
        share.setRefPost(post(10L, ALICE));

        WalletFeedResponses.PostResponse response = mapper.toPostResponse(share);

        assertTrue(response.isShare());
        assertEquals(10L, response.refPostId());
        assertNull(response.refTx());
    }

    @Test
    void repostPayloadNamesShareAndOriginal() {
        Post share = post(11L, BOB);
        share.setIsShare(true);
        share.setRefPost(post(10L, ALICE));

        NotificationEventPayload payload = mapper.toEventPayload(NotificationEvent.repost(new WalletUser(BOB), share));

        NotificationEventPayload.RepostEvent repost = assertInstanceOf(NotificationEventPayload.RepostEvent.class, payload);
        assertEquals(BOB, repost.repostedBy());
        assertEquals(11L, repost.repostId());
        assertEquals(10L, repost.originalPostId());
    }

    @Test
    void commentLikePayloadResolvesPostThroughComment() {
        Comment comment = new Comment();
        comment.setId(20L);
        comment.setPost(post(10L, ALICE));
        comment.setAuthor(new WalletUser(ALICE));

        NotificationEventPayload payload = mapper.toEventPayload(NotificationEvent.likedComment(new WalletUser(BOB), comment));

        assertEquals(new NotificationEventPayload.LikedCommentEvent(BOB, 10L, 20L), payload);
    }

    private static Post post(Long id, String wallet) {
        Post post = new Post();
        post.setId(id);
        post.setAuthor(new WalletUser(wallet));
        return post;
    }
}
