package com.flagship.credit_ledger.wallet.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Amounts are cents of the wallet currency.
 */
@Value
@Builder
@Jacksonized
public class WalletAddRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    Long cents;

    @Pattern(regexp = "^[a-zA-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    String currency;

    String description;
}
