package com.flagship.credit_ledger.topup;

import java.util.Set;

/**
 * Maps a provider decline code to hard or soft. Unknown and missing codes are soft.
 */
public final class DeclineClassifier {

    private static final Set<String> HARD_DECLINE_CODES = Set.of(
            "expired_card",
            "stolen_card",
            "lost_card",
            "pickup_card",
            "fraudulent",
            "invalid_account",
            "restricted_card",
            "invalid_cvc",
            "incorrect_cvc",
            "invalid_number",
            "incorrect_number"
    );

    private DeclineClassifier() {
    }

    public static DeclineType classify(String declineCode) {
        if (declineCode == null) {
            return DeclineType.SOFT;
        }
        return HARD_DECLINE_CODES.contains(declineCode) ? DeclineType.HARD : DeclineType.SOFT;
    }
}
