package com.flagship.credit_ledger.wallet.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class WalletConsumeRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    Long cents;

    String description;
}
