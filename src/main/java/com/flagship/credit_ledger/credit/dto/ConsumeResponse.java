package com.flagship.credit_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.credit_ledger.ledger.ConsumeResult;
import com.flagship.credit_ledger.topup.AutoTopUpResult;
import lombok.Value;

/**
 * Consume outcome plus the auto top-up it may have triggered.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsumeResponse {
    boolean success;
    long balance;
    AutoTopUpResult autoTopUp;

    public static ConsumeResponse of(ConsumeResult result, AutoTopUpResult autoTopUp) {
        return new ConsumeResponse(result.isSuccess(), result.getBalance(), autoTopUp);
    }
}
