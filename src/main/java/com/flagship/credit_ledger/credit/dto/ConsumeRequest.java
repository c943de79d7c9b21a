package com.flagship.credit_ledger.credit.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class ConsumeRequest {

    @NotBlank(message = "Credit key is required")
    String key;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    Long amount;

    String description;

    Map<String, Object> metadata;
}
