package com.walletfeed.social;

import com.walletfeed.model.Follow;
import com.walletfeed.model.WalletUser;
import com.walletfeed.notification.NotificationService;
import com.walletfeed.repository.FollowRepository;
import com.walletfeed.wallet.WalletUserService;
import com.walletfeed.web.DuplicateActionException;
import com.walletfeed.web.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class FollowService {

    private static final Logger log = LoggerFactory.getLogger(FollowService.class);

    public static final int EXPLORE_LIMIT = 8;

    private final FollowRepository followRepository;
    private final WalletUserService walletUserService;
    private final NotificationService notificationService;

    /**
     * Follows {@code destAddress}, registering it if it has never logged in.
     */
    @Transactional
    public Follow follow(String wallet, String destAddress) {
        WalletUser dest = walletUserService.getOrCreate(destAddress);
        WalletUser src = walletUserService.require(wallet);
        if (src.getId().equals(dest.getId())) {
            throw DuplicateActionException.selfFollow("Cannot follow yourself");
        }
        if (followRepository.existsBySrcIdAndDestId(src.getId(), dest.getId())) {
            throw DuplicateActionException.alreadyFollowing("Already following " + dest.getWallet());
        }

        Follow follow = new Follow();
        follow.setSrc(src);
        follow.setDest(dest);
        Follow saved;
        try {
            saved = followRepository.saveAndFlush(follow);
        } catch (DataIntegrityViolationException ex) {
            throw DuplicateActionException.alreadyFollowing("Already following " + dest.getWallet());
        }
        notificationService.notifyFollowed(saved);
        log.debug("{} followed {}", src.getWallet(), dest.getWallet());
        return saved;
    }

    @Transactional
    public void unfollow(String wallet, String destAddress) {
        WalletUser src = walletUserService.require(wallet);
        WalletUser dest = walletUserService.require(destAddress);
        Follow follow = followRepository.findBySrcIdAndDestId(src.getId(), dest.getId())
                .orElseThrow(() -> new NotFoundException("Not following " + dest.getWallet()));
        followRepository.delete(follow);
    }

    @Transactional(readOnly = true)
    public FollowStats stats(String address, String viewerWallet) {
        WalletUser user = walletUserService.require(address);
        WalletUser viewer = viewerWallet == null ? null : walletUserService.require(viewerWallet);
        return statsFor(user, viewer);
    }

    /**
     * The {@value #EXPLORE_LIMIT} most followed wallets.
     */
    @Transactional(readOnly = true)
    public List<FollowStats> explore(String viewerWallet) {
        WalletUser viewer = viewerWallet == null ? null : walletUserService.require(viewerWallet);
        return followRepository.findMostFollowed(PageRequest.of(0, EXPLORE_LIMIT)).stream()
                .map(user -> statsFor(user, viewer))
                .toList();
    }

    private FollowStats statsFor(WalletUser user, WalletUser viewer) {
        boolean followedByViewer = viewer != null
                && followRepository.existsBySrcIdAndDestId(viewer.getId(), user.getId());
        return new FollowStats(
                user.getWallet(),
                followRepository.countByDestId(user.getId()),
                followRepository.countBySrcId(user.getId()),
                followedByViewer
        );
    }

    public record FollowStats(String wallet, long followers, long following, boolean followedByViewer) {
    }
}
