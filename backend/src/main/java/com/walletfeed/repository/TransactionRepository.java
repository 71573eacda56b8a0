package com.walletfeed.repository;

import com.walletfeed.model.Transaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {
    Optional<Transaction> findByChainIdAndTxHash(Integer chainId, String txHash);
}
