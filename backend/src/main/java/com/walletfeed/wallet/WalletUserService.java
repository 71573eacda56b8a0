package com.walletfeed.wallet;

import com.walletfeed.model.WalletUser;
import com.walletfeed.repository.WalletUserRepository;
import com.walletfeed.web.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class WalletUserService {

    private static final Logger log = LoggerFactory.getLogger(WalletUserService.class);

    private final WalletUserRepository walletUserRepository;

    /**
     * Returns the user for a wallet, registering it on first sight.
     * Runs outside any caller transaction so a lost insert race can re-read the winner.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public WalletUser getOrCreate(String wallet) {
        String checksummed = WalletAddresses.toChecksum(wallet);
        return walletUserRepository.findByWallet(checksummed)
                .orElseGet(() -> register(checksummed));
    }

    @Transactional(readOnly = true)
    public WalletUser require(String wallet) {
        String checksummed = WalletAddresses.toChecksum(wallet);
        return walletUserRepository.findByWallet(checksummed)
                .orElseThrow(() -> NotFoundException.wallet(checksummed));
    }

    /**
     * Resolves tagged wallets to users. Unknown wallets are rejected.
     */
    @Transactional(readOnly = true)
    public Set<WalletUser> requireAll(Collection<String> wallets) {
        if (wallets == null || wallets.isEmpty()) {
            return new LinkedHashSet<>();
        }
        Set<String> checksummed = new LinkedHashSet<>();
        for (String wallet : wallets) {
            checksummed.add(WalletAddresses.toChecksum(wallet));
        }
        List<WalletUser> found = walletUserRepository.findByWalletIn(checksummed);
        if (found.size() != checksummed.size()) {
            Set<String> missing = new LinkedHashSet<>(checksummed);
            found.forEach(user -> missing.remove(user.getWallet()));
            throw new NotFoundException("Tagged wallets not found: " + String.join(", ", missing));
        }
        return new LinkedHashSet<>(found);
    }

    @Transactional(readOnly = true)
    public List<String> allWallets() {
        return walletUserRepository.findAllWallets();
    }

    private WalletUser register(String wallet) {
        try {
            WalletUser created = walletUserRepository.saveAndFlush(new WalletUser(wallet));
            log.info("Registered wallet {}", wallet);
            return created;
        } catch (DataIntegrityViolationException ex) {
            log.debug("Wallet {} registered concurrently, reloading", wallet);
            return walletUserRepository.findByWallet(wallet).orElseThrow(() -> ex);
        }
    }
}
