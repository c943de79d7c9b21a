package com.flagship.credit_ledger.topup;

import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.credit.CreditException;
import com.flagship.credit_ledger.credit.CreditService;
import com.flagship.credit_ledger.event.CreditEventPublisher;
import com.flagship.credit_ledger.event.TopUpCompletedEvent;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.ledger.TransactionSource;
import com.flagship.credit_ledger.wallet.WalletService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Grants what a confirmed charge paid for. Shared by the inline charge path and
 * the webhook path; both derive the same idempotency key from the charge id, so
 * whichever arrives second is a no-op.
 */
@Component
@Slf4j
public class TopUpFulfillment {

    private final CreditService creditService;
    private final WalletService walletService;
    private final CreditEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;

    public TopUpFulfillment(CreditService creditService,
                            WalletService walletService,
                            CreditEventPublisher eventPublisher,
                            TransactionTemplate transactionTemplate) {
        this.creditService = creditService;
        this.walletService = walletService;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = transactionTemplate;
    }

    public static String grantKey(String key, String chargeId) {
        return WalletService.WALLET_KEY.equals(key) ? "wallet_topup_" + chargeId : "topup_" + chargeId;
    }

    /**
     * Grants {@code amount} credits, or cents when {@code key} is the wallet.
     *
     * @return the balance afterwards (milli-cents for the wallet)
     */
    public long fulfill(String holderId, String key, long amount, String chargeId, boolean automatic,
                        long amountCharged, String currency) {
        TransactionSource source = automatic ? TransactionSource.AUTO_TOPUP : TransactionSource.TOPUP;
        LedgerMutation mutation = LedgerMutation.builder()
                .source(source)
                .sourceId(chargeId)
                .description(automatic ? "Automatic top-up" : "Top-up")
                .idempotencyKey(grantKey(key, chargeId))
                .build();

        try {
            Long newBalance = transactionTemplate.execute(status -> {
                long balance = WalletService.WALLET_KEY.equals(key)
                        ? grantWallet(holderId, amount, currency, mutation)
                        : creditService.grant(holderId, key, amount, mutation);
                eventPublisher.publish(TopUpCompletedEvent.of(holderId, key, amount, amountCharged,
                        currency, balance, chargeId));
                return balance;
            });
            log.info("Top-up fulfilled: holderId={}, key={}, amount={}, chargeId={}, automatic={}",
                    holderId, key, amount, chargeId, automatic);
            return newBalance != null ? newBalance : creditService.getBalance(holderId, key);
        } catch (CreditException e) {
            if (e.is(CreditErrorCode.CURRENCY_MISMATCH)) {
                // paid but not grantable; a redelivery would fail the same way
                log.error("Top-up {} paid in {} does not match the wallet currency of holder {}, needs manual review",
                        chargeId, currency, holderId);
                return creditService.getBalance(holderId, key);
            }
            if (!e.is(CreditErrorCode.IDEMPOTENCY_CONFLICT)) {
                throw e;
            }
            log.info("Top-up {} already granted, skipping", chargeId);
            return creditService.getBalance(holderId, key);
        }
    }

    private long grantWallet(String holderId, long cents, String currency, LedgerMutation mutation) {
        walletService.add(holderId, cents, currency, mutation);
        return walletService.getBalanceMilliCents(holderId);
    }
}
