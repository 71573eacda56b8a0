package com.walletfeed.controller;

import com.walletfeed.controller.dto.WalletFeedRequests;
import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.ingestion.WalletIngestionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Internal trigger for ingesting one wallet. Returns once the job is queued.
 */
@RestController
@RequestMapping("/api")
public class IngestionController {

    private final WalletIngestionService walletIngestionService;

    public IngestionController(WalletIngestionService walletIngestionService) {
        this.walletIngestionService = walletIngestionService;
    }

    @PostMapping("/ingest-trigger")
    public ResponseEntity<WalletFeedResponses.IngestTriggerResponse> trigger(
            @Valid @RequestBody WalletFeedRequests.IngestTriggerRequest request
    ) {
        String wallet = walletIngestionService.requestIngestion(request.address().trim());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new WalletFeedResponses.IngestTriggerResponse(wallet, true));
    }
}
