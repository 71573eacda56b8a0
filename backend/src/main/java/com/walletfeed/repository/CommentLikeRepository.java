package com.walletfeed.repository;

import com.walletfeed.model.CommentLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CommentLikeRepository extends JpaRepository<CommentLike, Long> {
    Optional<CommentLike> findByLikerIdAndCommentId(Long likerId, Long commentId);

    boolean existsByLikerIdAndCommentId(Long likerId, Long commentId);
}
