package com.walletfeed.controller.dto;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.List;

public final class WalletFeedResponses {

    private WalletFeedResponses() {
    }

    public record LoginResponse(
            String wallet,
            boolean ingestionQueued
    ) {
    }

    public record IngestTriggerResponse(
            String address,
            boolean queued
    ) {
    }

    public record WalletProfile(
            String wallet,
            long followers,
            long following,
            boolean followedByViewer
    ) {
    }

    public record FollowResponse(
            String follower,
            String followed,
            OffsetDateTime createdAt
    ) {
    }

    public record Erc20TransferResponse(
            String contractAddress,
            String contractName,
            String contractTicker,
            String logoUrl,
            String fromAddress,
            String toAddress,
            BigInteger amount,
            Integer decimals
    ) {
    }

    public record Erc721TransferResponse(
            String contractAddress,
            String contractName,
            String contractTicker,
            String logoUrl,
            String fromAddress,
            String toAddress,
            BigInteger tokenId
    ) {
    }

    public record TransactionResponse(
            Integer chainId,
            String txHash,
            OffsetDateTime blockSignedAt,
            Integer txOffset,
            Boolean successful,
            String fromAddress,
            String toAddress,
            BigInteger value,
            List<Erc20TransferResponse> erc20Transfers,
            List<Erc721TransferResponse> erc721Transfers
    ) {
    }

    public record PostResponse(
            Long id,
            String author,
            String text,
            String imageUrl,
            boolean isShare,
            boolean isQuote,
            Long refPostId,
            TransactionResponse refTx,
            List<String> taggedWallets,
            long numComments,
            long numLikes,
            long numReposts,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record CommentResponse(
            Long id,
            Long postId,
            String author,
            String text,
            List<String> taggedWallets,
            OffsetDateTime createdAt
    ) {
    }

    public record LikeResponse(
            String liker,
            Long postId,
            Long commentId,
            OffsetDateTime createdAt
    ) {
    }

    public record NotificationResponse(
            Long id,
            boolean viewed,
            OffsetDateTime createdAt,
            NotificationEventPayload event
    ) {
    }

    public record UnviewedCountResponse(
            long count
    ) {
    }

    public record MarkViewedResponse(
            int updated
    ) {
    }

    public record PageResponse<T>(
            List<T> items,
            int page,
            int size,
            long totalElements,
            int totalPages
    ) {
    }
}
