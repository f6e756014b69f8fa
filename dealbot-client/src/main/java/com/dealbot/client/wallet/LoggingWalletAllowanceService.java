package com.dealbot.client.wallet;

import com.dealbot.common.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Default allowance collaborator: records the call and relies on an externally funded wallet.
 */
@Service
@ConditionalOnProperty(name = "dealbot.wallet.mode", havingValue = "external", matchIfMissing = true)
@Slf4j
public class LoggingWalletAllowanceService implements WalletAllowanceService {

    private final String walletAddress;

    public LoggingWalletAllowanceService(@Value("${dealbot.wallet-address:}") String walletAddress) {
        this.walletAddress = walletAddress;
    }

    @Override
    public void ensureAllowance() {
        if (walletAddress == null || walletAddress.isBlank()) {
            throw new IllegalStateException("dealbot.wallet-address is not configured");
        }
        log.info("[WALLET] Allowance assumed to be managed externally | wallet={}", LogFormat.abbreviate(walletAddress));
    }

    @Override
    public void topUpIfBelowThreshold() {
        log.debug("[WALLET] Top-up skipped, wallet funded externally | wallet={}", LogFormat.abbreviate(walletAddress));
    }
}
