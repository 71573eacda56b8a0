package com.walletfeed.web;

import org.springframework.http.HttpStatus;

public class DuplicateActionException extends WalletFeedException {

    public DuplicateActionException(String code, String message) {
        super(HttpStatus.BAD_REQUEST, code, message);
    }

    public static DuplicateActionException alreadyLiked(String detail) {
        return new DuplicateActionException("already_liked", detail);
    }

    public static DuplicateActionException alreadyReposted(String detail) {
        return new DuplicateActionException("already_reposted", detail);
    }

    public static DuplicateActionException ownPostRepost(String detail) {
        return new DuplicateActionException("own_post_repost", detail);
    }

    public static DuplicateActionException repostOfRepost(String detail) {
        return new DuplicateActionException("repost_of_repost", detail);
    }

    public static DuplicateActionException alreadyFollowing(String detail) {
        return new DuplicateActionException("already_following", detail);
    }

    public static DuplicateActionException selfFollow(String detail) {
        return new DuplicateActionException("self_follow", detail);
    }
}
