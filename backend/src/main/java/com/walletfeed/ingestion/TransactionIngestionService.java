package com.walletfeed.ingestion;

import com.walletfeed.ingestion.TransferRecordStore.StoredTransaction;
import com.walletfeed.ingestion.provider.HistoryProviderClient;
import com.walletfeed.ingestion.provider.HistoryProviderClient.HistoryPage;
import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderTransaction;
import com.walletfeed.ingestion.provider.ProviderException;
import com.walletfeed.model.Post;
import com.walletfeed.model.Transaction;
import com.walletfeed.model.WalletUser;
import com.walletfeed.repository.PostRepository;
import com.walletfeed.wallet.WalletAddresses;
import com.walletfeed.wallet.WalletUserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.function.Consumer;

/**
 * Walks a wallet's transaction history page by page, stores every new
 * transaction and derives one post per transaction the wallet sent.
 * <p>
 * Pages are fetched sequentially. Transactions stored before a provider
 * failure stay committed; a later run skips them by key.
 */
@Service
public class TransactionIngestionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionIngestionService.class);

    private final HistoryProviderClient historyProviderClient;
    private final TransferRecordStore transferRecordStore;
    private final PostRepository postRepository;
    private final WalletUserService walletUserService;
    private final TransactionTemplate transactionTemplate;

    public TransactionIngestionService(
            HistoryProviderClient historyProviderClient,
            TransferRecordStore transferRecordStore,
            PostRepository postRepository,
            WalletUserService walletUserService,
            PlatformTransactionManager transactionManager) {
        this.historyProviderClient = historyProviderClient;
        this.transferRecordStore = transferRecordStore;
        this.postRepository = postRepository;
        this.walletUserService = walletUserService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Ingests the history of one wallet.
     *
     * @param address wallet address, any case
     * @param limit maximum transactions to process, {@code null} to follow pagination to the end
     * @param hintListener receives each fetched page's next-update hint, possibly {@code null},
     *                     before the page's transactions are stored
     * @return counts for this run and the most recent non-null refresh hint
     * @throws ProviderException when a page fetch fails; earlier pages remain stored
     */
    public IngestionResult ingest(String address, Integer limit, Consumer<OffsetDateTime> hintListener) {
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit must be positive when set");
        }
        String wallet = WalletAddresses.toChecksum(address);
        WalletUser author = walletUserService.getOrCreate(wallet);

        int pagesFetched = 0;
        int transactionsSeen = 0;
        int transactionsCreated = 0;
        int transfersCreated = 0;
        int postsCreated = 0;
        OffsetDateTime nextUpdateAt = null;

        int pageNumber = 0;
        boolean hasMore = true;
        while (hasMore && (limit == null || transactionsSeen < limit)) {
            HistoryPage page;
            try {
                page = historyProviderClient.fetchPage(wallet, pageNumber);
            } catch (ProviderException ex) {
                log.warn("History fetch for {} failed on page {} after storing {} new transaction(s): {}",
                        wallet, pageNumber, transactionsCreated, ex.getMessage());
                throw ex;
            }
            pagesFetched++;
            if (page.nextUpdateAt() != null) {
                nextUpdateAt = page.nextUpdateAt();
            }
            hintListener.accept(page.nextUpdateAt());

            List<ProviderTransaction> items = page.transactions();
            if (limit != null && items.size() > limit - transactionsSeen) {
                items = items.subList(0, limit - transactionsSeen);
            }
            for (ProviderTransaction item : items) {
                transactionsSeen++;
                StoredTransaction stored = transferRecordStore.store(item);
                if (stored.created()) {
                    transactionsCreated++;
                    transfersCreated += stored.transfersCreated();
                }
                if (WalletAddresses.sameAddress(item.fromAddress(), wallet)
                        && derivePost(author, stored.transaction())) {
                    postsCreated++;
                }
            }

            hasMore = page.hasMore() && !page.transactions().isEmpty();
            pageNumber++;
        }

        IngestionResult result = new IngestionResult(
                pagesFetched, transactionsSeen, transactionsCreated, transfersCreated, postsCreated, nextUpdateAt);
        log.info("Ingested {}: {} page(s), {} transaction(s) seen, {} new, {} transfer(s), {} post(s), next update {}",
                wallet, pagesFetched, transactionsSeen, transactionsCreated, transfersCreated, postsCreated, nextUpdateAt);
        return result;
    }

    private boolean derivePost(WalletUser author, Transaction transaction) {
        if (postRepository.existsOriginalPostForTransaction(author.getId(), transaction.getId())) {
            log.debug("Post for transaction {} by {} already exists", transaction.getTxHash(), author.getWallet());
            return false;
        }
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Post post = new Post();
                post.setAuthor(author);
                post.setRefTx(transaction);
                postRepository.save(post);
            });
            return true;
        } catch (DataIntegrityViolationException ex) {
            log.debug("Post for transaction {} by {} created concurrently", transaction.getTxHash(), author.getWallet());
            return false;
        }
    }
}
