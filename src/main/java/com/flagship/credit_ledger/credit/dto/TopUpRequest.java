package com.flagship.credit_ledger.credit.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TopUpRequest {

    @NotBlank(message = "Credit key is required")
    String key;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    Long amount;
}
