package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.event.CreditEventPublisher;
import com.flagship.credit_ledger.event.CreditsGrantedEvent;
import com.flagship.credit_ledger.event.CreditsRevokedEvent;
import com.flagship.credit_ledger.ledger.ConsumeResult;
import com.flagship.credit_ledger.ledger.CreditLedgerQueries;
import com.flagship.credit_ledger.ledger.CreditLedgerStore;
import com.flagship.credit_ledger.ledger.LedgerEntry;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.ledger.RevokeResult;
import com.flagship.credit_ledger.ledger.TransactionSource;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Public credit API: grant, consume, revoke, set and read balances.
 *
 * Validates amounts, rejects obvious replays before opening a ledger
 * transaction, and writes the matching credit event to the outbox in the same
 * transaction as the mutation. Callers that may be re-invoked pass a
 * deterministic idempotency key in the {@link LedgerMutation}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditService {

    private final CreditLedgerStore ledgerStore;
    private final CreditLedgerQueries ledgerQueries;
    private final IdempotencyService idempotencyService;
    private final CreditEventPublisher eventPublisher;
    private final CreditMetrics metrics;

    /**
     * Adds credits. Source defaults to {@code manual}.
     *
     * @return the new balance
     * @throws CreditException INVALID_AMOUNT for a non-positive amount,
     *                         IDEMPOTENCY_CONFLICT when the key was already used
     */
    @Transactional
    public long grant(String holderId, String key, long amount, LedgerMutation mutation) {
        requirePositive(amount);
        LedgerMutation effective = withDefaultSource(mutation, TransactionSource.MANUAL);
        idempotencyService.assertNotProcessed(effective.getIdempotencyKey());

        long newBalance = ledgerStore.atomicAdd(holderId, key, amount, effective);
        idempotencyService.remember(effective.getIdempotencyKey());

        eventPublisher.publish(CreditsGrantedEvent.of(holderId, key, amount, newBalance,
                effective.getSource(), effective.getSourceId()));
        metrics.recordMutation("grant", effective.getSource().dbValue());
        log.info("Credits granted: holderId={}, key={}, amount={}, newBalance={}, source={}",
                holderId, key, amount, newBalance, effective.getSource().dbValue());
        return newBalance;
    }

    /**
     * Spends credits if the balance covers them. Insufficient balance is a normal
     * result, not an exception, and leaves no ledger entry.
     */
    @Transactional
    public ConsumeResult consume(String holderId, String key, long amount, LedgerMutation mutation) {
        requirePositive(amount);
        LedgerMutation effective = withDefaultSource(mutation, TransactionSource.USAGE);
        idempotencyService.assertNotProcessed(effective.getIdempotencyKey());

        ConsumeResult result = ledgerStore.atomicConsume(holderId, key, amount, effective);
        metrics.recordConsume(result.isSuccess());
        if (result.isSuccess()) {
            idempotencyService.remember(effective.getIdempotencyKey());
            log.info("Credits consumed: holderId={}, key={}, amount={}, newBalance={}",
                    holderId, key, amount, result.getBalance());
        } else {
            log.info("Insufficient credits: holderId={}, key={}, requested={}, balance={}",
                    holderId, key, amount, result.getBalance());
        }
        return result;
    }

    /**
     * Removes up to {@code amount} credits; never below zero.
     */
    @Transactional
    public RevokeResult revoke(String holderId, String key, long amount, LedgerMutation mutation) {
        requirePositive(amount);
        LedgerMutation effective = withDefaultSource(mutation, TransactionSource.MANUAL);
        idempotencyService.assertNotProcessed(effective.getIdempotencyKey());

        RevokeResult result = ledgerStore.atomicRevoke(holderId, key, amount, effective);
        if (result.getAmountRevoked() > 0) {
            idempotencyService.remember(effective.getIdempotencyKey());
            eventPublisher.publish(CreditsRevokedEvent.of(holderId, key, result.getAmountRevoked(),
                    result.getNewBalance() + result.getAmountRevoked(), result.getNewBalance(),
                    effective.getSource(), effective.getSourceId()));
            metrics.recordMutation("revoke", effective.getSource().dbValue());
            log.info("Credits revoked: holderId={}, key={}, amount={}, newBalance={}, source={}",
                    holderId, key, result.getAmountRevoked(), result.getNewBalance(), effective.getSource().dbValue());
        }
        return result;
    }

    /**
     * Reads the balance, then revokes exactly that much. Not atomic across the
     * read and the revoke; the revoke itself never overdraws.
     */
    @Transactional
    public RevokeAllResult revokeAll(String holderId, String key, LedgerMutation mutation) {
        long currentBalance = ledgerQueries.getBalance(holderId, key);
        if (currentBalance <= 0) {
            return RevokeAllResult.nothing();
        }
        RevokeResult result = revoke(holderId, key, currentBalance, mutation);
        return new RevokeAllResult(currentBalance, result.getAmountRevoked());
    }

    /**
     * {@link #revokeAll} for every key with a positive balance. An idempotency key
     * in {@code mutation} is suffixed with {@code :<key>} per credit type.
     */
    @Transactional
    public Map<String, RevokeAllResult> revokeAllForHolder(String holderId, LedgerMutation mutation) {
        Map<String, RevokeAllResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, Long> balance : ledgerQueries.getAllBalances(holderId).entrySet()) {
            if (balance.getValue() <= 0) {
                continue;
            }
            LedgerMutation perKey = mutation;
            if (mutation != null && mutation.getIdempotencyKey() != null) {
                perKey = mutation.toBuilder()
                        .idempotencyKey(mutation.getIdempotencyKey() + ":" + balance.getKey())
                        .build();
            }
            RevokeResult result = revoke(holderId, balance.getKey(), balance.getValue(), perKey);
            results.put(balance.getKey(), new RevokeAllResult(balance.getValue(), result.getAmountRevoked()));
        }
        return results;
    }

    /**
     * Sets the balance with one signed adjust entry. Zero is a valid target.
     */
    @Transactional
    public SetBalanceResult setBalance(String holderId, String key, long balance, LedgerMutation mutation) {
        if (balance < 0) {
            throw new CreditException(CreditErrorCode.INVALID_AMOUNT, "Balance cannot be negative");
        }
        LedgerMutation effective = withDefaultSource(mutation, TransactionSource.MANUAL);
        idempotencyService.assertNotProcessed(effective.getIdempotencyKey());

        long previousBalance = ledgerStore.atomicSet(holderId, key, balance, effective);
        long adjustment = balance - previousBalance;
        idempotencyService.remember(effective.getIdempotencyKey());
        if (adjustment != 0) {
            if (adjustment > 0) {
                eventPublisher.publish(CreditsGrantedEvent.of(holderId, key, adjustment, balance,
                        effective.getSource(), effective.getSourceId()));
            } else {
                eventPublisher.publish(CreditsRevokedEvent.of(holderId, key, -adjustment, previousBalance,
                        balance, effective.getSource(), effective.getSourceId()));
            }
            metrics.recordMutation("adjust", effective.getSource().dbValue());
        }
        log.info("Balance set: holderId={}, key={}, previousBalance={}, newBalance={}, source={}",
                holderId, key, previousBalance, balance, effective.getSource().dbValue());
        return new SetBalanceResult(balance, previousBalance);
    }

    public long getBalance(String holderId, String key) {
        return ledgerQueries.getBalance(holderId, key);
    }

    public Map<String, Long> getAllBalances(String holderId) {
        return ledgerQueries.getAllBalances(holderId);
    }

    public boolean hasCredits(String holderId, String key, long amount) {
        return ledgerQueries.getBalance(holderId, key) >= amount;
    }

    /**
     * Newest first; {@code key} may be null for every credit type.
     */
    public List<LedgerEntry> getHistory(String holderId, String key, int limit, int offset) {
        return ledgerQueries.getHistory(holderId, key, limit, offset);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new CreditException(CreditErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
    }

    private static LedgerMutation withDefaultSource(LedgerMutation mutation, TransactionSource source) {
        if (mutation == null) {
            return LedgerMutation.of(source);
        }
        return mutation.getSource() != null ? mutation : mutation.toBuilder().source(source).build();
    }
}
