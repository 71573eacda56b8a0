package com.walletfeed.repository;

import com.walletfeed.model.Post;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PostRepository extends JpaRepository<Post, Long> {

    @Query("""
            SELECT COUNT(p) > 0 FROM Post p
            WHERE p.author.id = :authorId AND p.refTx.id = :refTxId AND p.isShare = false
            """)
    boolean existsOriginalPostForTransaction(@Param("authorId") Long authorId, @Param("refTxId") Long refTxId);

    @Query("""
            SELECT COUNT(p) > 0 FROM Post p
            WHERE p.author.id = :authorId AND p.refPost.id = :refPostId AND p.isShare = true
            """)
    boolean existsShareByAuthor(@Param("authorId") Long authorId, @Param("refPostId") Long refPostId);

    @Query("SELECT COUNT(p) FROM Post p WHERE p.refPost.id = :refPostId AND p.isShare = true")
    long countShares(@Param("refPostId") Long refPostId);

    Page<Post> findByAuthorWalletOrderByCreatedAtDesc(String wallet, Pageable pageable);

    @Query(value = """
            SELECT p FROM Post p
            WHERE p.author.id = :userId
               OR p.author.id IN (SELECT f.dest.id FROM Follow f WHERE f.src.id = :userId)
            ORDER BY p.createdAt DESC
            """,
            countQuery = """
            SELECT COUNT(p) FROM Post p
            WHERE p.author.id = :userId
               OR p.author.id IN (SELECT f.dest.id FROM Follow f WHERE f.src.id = :userId)
            """)
    Page<Post> findFeedForUser(@Param("userId") Long userId, Pageable pageable);
}
