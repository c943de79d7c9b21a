package com.flagship.credit_ledger.credit.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request body for revokes. Without an amount the whole balance is revoked.
 */
@Value
@Builder
@Jacksonized
public class RevokeRequest {

    @NotBlank(message = "Credit key is required")
    String key;

    @Positive(message = "Amount must be greater than 0")
    Long amount;

    String description;
}
