package com.walletfeed.repository;

import com.walletfeed.model.WalletUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface WalletUserRepository extends JpaRepository<WalletUser, Long> {
    Optional<WalletUser> findByWallet(String wallet);

    List<WalletUser> findByWalletIn(Collection<String> wallets);

    @Query("SELECT DISTINCT u.wallet FROM WalletUser u ORDER BY u.wallet")
    List<String> findAllWallets();
}
