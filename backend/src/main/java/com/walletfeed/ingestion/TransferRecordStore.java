package com.walletfeed.ingestion;

import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderErc20Transfer;
import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderErc721Transfer;
import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderTransaction;
import com.walletfeed.ingestion.provider.HistoryProviderClient.TokenContract;
import com.walletfeed.model.Erc20Transfer;
import com.walletfeed.model.Erc721Transfer;
import com.walletfeed.model.TokenTransfer;
import com.walletfeed.model.Transaction;
import com.walletfeed.repository.TransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Append-only store for chain transactions and their token transfers.
 * <p>
 * Each call commits on its own, so a failure later in a history walk never
 * rolls back transactions that were already stored. Records are keyed by
 * {@code (chain_id, tx_hash)} and never modified once written.
 */
@Service
public class TransferRecordStore {

    private static final Logger log = LoggerFactory.getLogger(TransferRecordStore.class);

    private final TransactionRepository transactionRepository;
    private final TransactionTemplate transactionTemplate;

    public TransferRecordStore(
            TransactionRepository transactionRepository,
            PlatformTransactionManager transactionManager) {
        this.transactionRepository = transactionRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Stores a provider transaction unless one with the same chain and hash exists.
     *
     * @return the stored row and whether this call created it
     */
    public StoredTransaction store(ProviderTransaction source) {
        Optional<Transaction> existing = transactionRepository.findByChainIdAndTxHash(source.chainId(), source.txHash());
        if (existing.isPresent()) {
            log.debug("Skipping known transaction {} on chain {}", source.txHash(), source.chainId());
            return new StoredTransaction(existing.get(), false, 0);
        }

        try {
            Transaction saved = transactionTemplate.execute(status -> transactionRepository.save(toEntity(source)));
            int transfers = source.erc20Transfers().size() + source.erc721Transfers().size();
            log.debug("Stored transaction {} on chain {} with {} transfer(s)", source.txHash(), source.chainId(), transfers);
            return new StoredTransaction(saved, true, transfers);
        } catch (DataIntegrityViolationException ex) {
            // Another ingestion stored the same transaction first.
            Transaction winner = transactionRepository.findByChainIdAndTxHash(source.chainId(), source.txHash())
                    .orElseThrow(() -> ex);
            log.debug("Transaction {} on chain {} stored concurrently; using existing row", source.txHash(), source.chainId());
            return new StoredTransaction(winner, false, 0);
        }
    }

    static Transaction toEntity(ProviderTransaction source) {
        Transaction transaction = new Transaction();
        transaction.setChainId(source.chainId());
        transaction.setTxHash(source.txHash());
        transaction.setBlockSignedAt(source.blockSignedAt());
        transaction.setTxOffset(source.txOffset());
        transaction.setSuccessful(source.successful());
        transaction.setFromAddress(source.fromAddress());
        transaction.setToAddress(source.toAddress());
        transaction.setValue(source.value());

        for (ProviderErc20Transfer transfer : source.erc20Transfers()) {
            Erc20Transfer entity = new Erc20Transfer();
            copyContract(entity, transfer.contract(), transfer.fromAddress(), transfer.toAddress());
            entity.setAmount(transfer.amount());
            entity.setDecimals(transfer.decimals());
            transaction.addErc20Transfer(entity);
        }
        for (ProviderErc721Transfer transfer : source.erc721Transfers()) {
            Erc721Transfer entity = new Erc721Transfer();
            copyContract(entity, transfer.contract(), transfer.fromAddress(), transfer.toAddress());
            entity.setTokenId(transfer.tokenId());
            transaction.addErc721Transfer(entity);
        }
        return transaction;
    }

    private static void copyContract(TokenTransfer entity, TokenContract contract, String from, String to) {
        entity.setContractAddress(contract.address());
        entity.setContractName(contract.name());
        entity.setContractTicker(contract.ticker());
        entity.setLogoUrl(contract.logoUrl());
        entity.setFromAddress(from);
        entity.setToAddress(to);
    }

    public record StoredTransaction(Transaction transaction, boolean created, int transfersCreated) {
    }
}
