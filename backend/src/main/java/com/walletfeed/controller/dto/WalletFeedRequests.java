package com.walletfeed.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class WalletFeedRequests {

    private WalletFeedRequests() {
    }

    public record IngestTriggerRequest(
            @NotBlank(message = "address is required")
            String address
    ) {
    }

    public record CreatePostRequest(
            @Size(max = 5000, message = "text must be at most 5000 characters")
            String text,

            @Size(max = 1024, message = "imageUrl must be at most 1024 characters")
            String imageUrl,

            Long quotedPostId,

            @Size(max = 50, message = "at most 50 wallets can be tagged")
            List<String> taggedWallets
    ) {
    }

    public record UpdatePostRequest(
            @Size(max = 5000, message = "text must be at most 5000 characters")
            String text,

            @Size(max = 1024, message = "imageUrl must be at most 1024 characters")
            String imageUrl
    ) {
    }

    public record CreateCommentRequest(
            @NotBlank(message = "text is required")
            @Size(max = 2000, message = "text must be at most 2000 characters")
            String text,

            @Size(max = 50, message = "at most 50 wallets can be tagged")
            List<String> taggedWallets
    ) {
    }

    public record MarkViewedRequest(
            @NotEmpty(message = "ids is required")
            List<Long> ids
    ) {
    }
}
