package com.flagship.credit_ledger.wallet;

import com.flagship.credit_ledger.ledger.LedgerEntry;
import com.flagship.credit_ledger.ledger.TransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A wallet ledger entry in cents. Grants read as "add".
 */
@Value
public class WalletEntry {
    UUID id;
    BigDecimal cents;
    BigDecimal balanceAfterCents;
    String type;
    String source;
    String sourceId;
    String description;
    Instant createdAt;

    static WalletEntry from(LedgerEntry entry) {
        String type = entry.getTransactionType() == TransactionType.GRANT
                ? "add"
                : entry.getTransactionType().dbValue();
        return new WalletEntry(
                entry.getId(),
                WalletFormatter.milliCentsToCents(entry.getAmount()),
                WalletFormatter.milliCentsToCents(entry.getBalanceAfter()),
                type,
                entry.getSource().dbValue(),
                entry.getSourceId(),
                entry.getDescription(),
                entry.getCreatedAt());
    }
}
