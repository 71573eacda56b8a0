package com.walletfeed.repository;

import com.walletfeed.model.PostLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PostLikeRepository extends JpaRepository<PostLike, Long> {
    Optional<PostLike> findByLikerIdAndPostId(Long likerId, Long postId);

    boolean existsByLikerIdAndPostId(Long likerId, Long postId);

    long countByPostId(Long postId);
}
