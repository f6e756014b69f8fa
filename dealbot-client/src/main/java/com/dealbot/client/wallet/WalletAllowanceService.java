package com.dealbot.client.wallet;

/**
 * Keeps the bot's wallet able to pay for deals. Invoked before deal-creation bursts.
 */
public interface WalletAllowanceService {

    /**
     * @throws IllegalStateException if allowances cannot be ensured and deals would fail
     */
    void ensureAllowance();

    void topUpIfBelowThreshold();
}
