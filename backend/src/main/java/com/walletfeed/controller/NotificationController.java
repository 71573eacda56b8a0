package com.walletfeed.controller;

import com.walletfeed.controller.dto.WalletFeedRequests;
import com.walletfeed.controller.dto.WalletFeedResponses;
import com.walletfeed.mapper.WalletFeedResponseMapper;
import com.walletfeed.model.Notification;
import com.walletfeed.notification.NotificationService;
import com.walletfeed.wallet.WalletAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationService notificationService;
    private final WalletAuthenticator walletAuthenticator;
    private final WalletFeedResponseMapper responseMapper;

    public NotificationController(
            NotificationService notificationService,
            WalletAuthenticator walletAuthenticator,
            WalletFeedResponseMapper responseMapper) {
        this.notificationService = notificationService;
        this.walletAuthenticator = walletAuthenticator;
        this.responseMapper = responseMapper;
    }

    /**
     * Caller's notifications, newest first.
     */
    @GetMapping
    public ResponseEntity<WalletFeedResponses.PageResponse<WalletFeedResponses.NotificationResponse>> list(
            HttpServletRequest request,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        Page<Notification> notifications = notificationService.listNotifications(wallet, page, size);
        return ResponseEntity.ok(responseMapper.toPageResponse(notifications, responseMapper::toNotificationResponse));
    }

    @GetMapping("/unviewed-count")
    public ResponseEntity<WalletFeedResponses.UnviewedCountResponse> unviewedCount(HttpServletRequest request) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        return ResponseEntity.ok(new WalletFeedResponses.UnviewedCountResponse(notificationService.countUnviewed(wallet)));
    }

    @PostMapping("/viewed")
    public ResponseEntity<WalletFeedResponses.MarkViewedResponse> markViewed(
            HttpServletRequest request,
            @Valid @RequestBody WalletFeedRequests.MarkViewedRequest body) {
        String wallet = walletAuthenticator.authenticatedWallet(request);
        int updated = notificationService.markViewed(wallet, body.ids());
        return ResponseEntity.ok(new WalletFeedResponses.MarkViewedResponse(updated));
    }
}
