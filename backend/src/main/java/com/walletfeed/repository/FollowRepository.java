package com.walletfeed.repository;

import com.walletfeed.model.Follow;
import com.walletfeed.model.WalletUser;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FollowRepository extends JpaRepository<Follow, Long> {
    Optional<Follow> findBySrcIdAndDestId(Long srcId, Long destId);

    boolean existsBySrcIdAndDestId(Long srcId, Long destId);

    long countByDestId(Long destId);

    long countBySrcId(Long srcId);

    /**
     * Wallets ordered by follower count, most followed first; ties by address.
     */
    @Query("""
            SELECT u FROM WalletUser u LEFT JOIN Follow f ON f.dest = u
            GROUP BY u
            ORDER BY COUNT(f) DESC, u.wallet ASC
            """)
    List<WalletUser> findMostFollowed(Pageable pageable);
}
