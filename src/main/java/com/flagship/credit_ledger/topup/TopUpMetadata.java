package com.flagship.credit_ledger.topup;

/**
 * Metadata keys attached to top-up charges and read back by the webhook handlers.
 */
public final class TopUpMetadata {

    public static final String KEY = "top_up_key";
    public static final String AMOUNT = "top_up_amount";
    public static final String HOLDER_ID = "holder_id";
    public static final String AUTO = "top_up_auto";

    private TopUpMetadata() {
    }
}
