package com.flagship.credit_ledger.wallet;

import com.flagship.credit_ledger.credit.CreditErrorCode;
import com.flagship.credit_ledger.credit.CreditException;
import com.flagship.credit_ledger.credit.CreditService;
import com.flagship.credit_ledger.ledger.BalanceSnapshot;
import com.flagship.credit_ledger.ledger.ConsumeResult;
import com.flagship.credit_ledger.ledger.CreditLedgerQueries;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.ledger.TransactionSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Monetary balance stored under the reserved {@value #WALLET_KEY} key.
 *
 * The API speaks cents; the ledger holds milli-cents so that weekly scaled
 * allocations divide without loss. A wallet has a single currency, fixed by
 * its first funding.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    public static final String WALLET_KEY = "wallet";
    public static final String DEFAULT_CURRENCY = "usd";

    private final CreditService creditService;
    private final CreditLedgerQueries ledgerQueries;

    /**
     * Adds {@code cents}. Source defaults to {@code manual}, currency to usd.
     *
     * @throws CreditException CURRENCY_MISMATCH when the wallet already holds another currency
     */
    @Transactional
    public WalletBalance add(String holderId, long cents, String currency, LedgerMutation mutation) {
        if (cents <= 0) {
            throw new CreditException(CreditErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
        String requested = currency != null ? currency.toLowerCase() : DEFAULT_CURRENCY;
        requireSameCurrency(holderId, requested);

        LedgerMutation withCurrency = (mutation != null ? mutation.toBuilder() : LedgerMutation.builder())
                .currency(requested)
                .build();
        long newBalance = creditService.grant(holderId, WALLET_KEY,
                WalletFormatter.centsToMilliCents(cents), withCurrency);
        return WalletBalance.of(newBalance, requested);
    }

    @Transactional
    public WalletConsumeResult consume(String holderId, long cents, String description, String idempotencyKey) {
        if (cents <= 0) {
            throw new CreditException(CreditErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
        ConsumeResult result = creditService.consume(holderId, WALLET_KEY,
                WalletFormatter.centsToMilliCents(cents),
                LedgerMutation.builder()
                        .source(TransactionSource.USAGE)
                        .description(description)
                        .idempotencyKey(idempotencyKey)
                        .build());
        return new WalletConsumeResult(result.isSuccess(), WalletBalance.of(result.getBalance(), currencyOf(holderId)));
    }

    /**
     * Empty when the holder never had a wallet.
     */
    public Optional<WalletBalance> getBalance(String holderId) {
        return ledgerQueries.findBalance(holderId, WALLET_KEY)
                .filter(snapshot -> snapshot.getBalance() != 0 || snapshot.getCurrency() != null)
                .map(snapshot -> WalletBalance.of(snapshot.getBalance(),
                        snapshot.getCurrency() != null ? snapshot.getCurrency() : DEFAULT_CURRENCY));
    }

    public long getBalanceMilliCents(String holderId) {
        return ledgerQueries.getBalance(holderId, WALLET_KEY);
    }

    public List<WalletEntry> getHistory(String holderId, int limit, int offset) {
        return ledgerQueries.getHistory(holderId, WALLET_KEY, limit, offset).stream()
                .map(WalletEntry::from)
                .collect(Collectors.toList());
    }

    public String currencyOf(String holderId) {
        return ledgerQueries.findBalance(holderId, WALLET_KEY)
                .map(BalanceSnapshot::getCurrency)
                .orElse(DEFAULT_CURRENCY);
    }

    /**
     * True when the wallet is empty of currency or already holds {@code currency}.
     */
    public boolean acceptsCurrency(String holderId, String currency) {
        String requested = currency != null ? currency.toLowerCase() : DEFAULT_CURRENCY;
        return ledgerQueries.findBalance(holderId, WALLET_KEY)
                .map(BalanceSnapshot::getCurrency)
                .map(requested::equals)
                .orElse(true);
    }

    private void requireSameCurrency(String holderId, String requested) {
        Optional<String> existing = ledgerQueries.findBalance(holderId, WALLET_KEY).map(BalanceSnapshot::getCurrency);
        if (existing.isPresent() && !existing.get().equals(requested)) {
            throw new CreditException(CreditErrorCode.CURRENCY_MISMATCH,
                    "Wallet currency is " + existing.get() + ", cannot add " + requested,
                    Map.of("walletCurrency", existing.get(), "requestedCurrency", requested));
        }
    }
}
