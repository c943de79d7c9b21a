package com.flagship.credit_ledger.seat;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.Map;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SeatResult {
    boolean success;
    /** The holder already occupies a seat of this subscription; nothing was granted. */
    boolean alreadyProcessed;
    Map<String, Long> creditsGranted;
    Map<String, Long> creditsRevoked;
    String error;

    public static SeatResult granted(Map<String, Long> creditsGranted, boolean alreadyProcessed) {
        return new SeatResult(true, alreadyProcessed, creditsGranted, null, null);
    }

    public static SeatResult revoked(Map<String, Long> creditsRevoked) {
        return new SeatResult(true, false, null, creditsRevoked, null);
    }

    public static SeatResult failed(String error) {
        return new SeatResult(false, false, null, null, error);
    }
}
