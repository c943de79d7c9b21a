package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.credit.dto.AutoTopUpStatusResponse;
import com.flagship.credit_ledger.credit.dto.BalanceResponse;
import com.flagship.credit_ledger.credit.dto.ConsumeRequest;
import com.flagship.credit_ledger.credit.dto.ConsumeResponse;
import com.flagship.credit_ledger.credit.dto.GrantRequest;
import com.flagship.credit_ledger.credit.dto.RevokeRequest;
import com.flagship.credit_ledger.credit.dto.SetBalanceRequest;
import com.flagship.credit_ledger.credit.dto.TopUpRequest;
import com.flagship.credit_ledger.ledger.ConsumeResult;
import com.flagship.credit_ledger.ledger.LedgerEntry;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.ledger.RevokeResult;
import com.flagship.credit_ledger.ledger.TransactionSource;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.seat.SeatResult;
import com.flagship.credit_ledger.seat.SeatService;
import com.flagship.credit_ledger.topup.AutoTopUpResult;
import com.flagship.credit_ledger.topup.AutoTopUpService;
import com.flagship.credit_ledger.topup.TopUpResult;
import com.flagship.credit_ledger.topup.TopUpService;
import com.flagship.credit_ledger.wallet.WalletService;
import com.flagship.credit_ledger.wallet.WalletTopUpService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface of the credit ledger.
 *
 * Holder ids and credit keys are opaque strings. Grants and consumes accept an
 * optional Idempotency-Key header; a replayed key answers 409 without touching
 * the balance.
 */
@RestController
@RequestMapping("/api/credits")
@RequiredArgsConstructor
@Validated
@Slf4j
public class CreditController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CreditService creditService;
    private final TopUpService topUpService;
    private final AutoTopUpService autoTopUpService;
    private final WalletTopUpService walletTopUpService;
    private final SeatService seatService;

    @GetMapping("/{holderId}/balances")
    public Map<String, Long> getAllBalances(@PathVariable("holderId") String holderId) {
        return creditService.getAllBalances(holderId);
    }

    @GetMapping("/{holderId}/balances/{key}")
    public BalanceResponse getBalance(@PathVariable("holderId") String holderId,
                                      @PathVariable("key") String key) {
        return new BalanceResponse(holderId, key, creditService.getBalance(holderId, key));
    }

    @GetMapping("/{holderId}/balances/{key}/sufficient")
    public Map<String, Boolean> hasCredits(@PathVariable("holderId") String holderId,
                                           @PathVariable("key") String key,
                                           @RequestParam("amount") @Positive long amount) {
        return Map.of("hasCredits", creditService.hasCredits(holderId, key, amount));
    }

    @GetMapping("/{holderId}/history")
    public List<LedgerEntry> getHistory(@PathVariable("holderId") String holderId,
                                        @RequestParam(value = "key", required = false) String key,
                                        @RequestParam(value = "limit", defaultValue = "50") @Min(1) @Max(500) int limit,
                                        @RequestParam(value = "offset", defaultValue = "0") @Min(0) int offset) {
        return creditService.getHistory(holderId, key, limit, offset);
    }

    @PostMapping("/{holderId}/grant")
    public ResponseEntity<BalanceResponse> grant(
            @PathVariable("holderId") String holderId,
            @Valid @RequestBody GrantRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        MDC.put(CorrelationContext.HOLDER_ID_MDC_KEY, holderId);
        try {
            long balance = creditService.grant(holderId, request.getKey(), request.getAmount(),
                    LedgerMutation.builder()
                            .source(TransactionSource.MANUAL)
                            .description(request.getDescription())
                            .metadata(request.getMetadata())
                            .idempotencyKey(idempotencyKey)
                            .build());
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(new BalanceResponse(holderId, request.getKey(), balance));
        } finally {
            MDC.remove(CorrelationContext.HOLDER_ID_MDC_KEY);
        }
    }

    /**
     * Spends credits, then gives auto top-up a chance when the balance dropped.
     * Insufficient balance answers 200 with {@code success=false}.
     */
    @PostMapping("/{holderId}/consume")
    public ConsumeResponse consume(
            @PathVariable("holderId") String holderId,
            @Valid @RequestBody ConsumeRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        MDC.put(CorrelationContext.HOLDER_ID_MDC_KEY, holderId);
        try {
            ConsumeResult result = creditService.consume(holderId, request.getKey(), request.getAmount(),
                    LedgerMutation.builder()
                            .source(TransactionSource.USAGE)
                            .description(request.getDescription())
                            .metadata(request.getMetadata())
                            .idempotencyKey(idempotencyKey)
                            .build());

            AutoTopUpResult autoTopUp = null;
            if (result.isSuccess()) {
                autoTopUp = triggerAutoTopUp(holderId, request.getKey(), result.getBalance());
            }
            return ConsumeResponse.of(result, autoTopUp);
        } finally {
            MDC.remove(CorrelationContext.HOLDER_ID_MDC_KEY);
        }
    }

    @PostMapping("/{holderId}/revoke")
    public ResponseEntity<?> revoke(@PathVariable("holderId") String holderId,
                                    @Valid @RequestBody RevokeRequest request) {
        LedgerMutation mutation = LedgerMutation.builder()
                .source(TransactionSource.MANUAL)
                .description(request.getDescription())
                .build();
        if (request.getAmount() == null) {
            return ResponseEntity.ok(creditService.revokeAll(holderId, request.getKey(), mutation));
        }
        RevokeResult result = creditService.revoke(holderId, request.getKey(), request.getAmount(), mutation);
        return ResponseEntity.ok(result);
    }

    @DeleteMapping("/{holderId}/balances")
    public Map<String, RevokeAllResult> revokeAllForHolder(@PathVariable("holderId") String holderId) {
        return creditService.revokeAllForHolder(holderId, LedgerMutation.of(TransactionSource.MANUAL));
    }

    @PutMapping("/{holderId}/balance")
    public SetBalanceResult setBalance(@PathVariable("holderId") String holderId,
                                       @Valid @RequestBody SetBalanceRequest request) {
        return creditService.setBalance(holderId, request.getKey(), request.getBalance(),
                LedgerMutation.builder()
                        .source(TransactionSource.MANUAL)
                        .description(request.getDescription())
                        .build());
    }

    @PostMapping("/{holderId}/top-up")
    public ResponseEntity<TopUpResult> topUp(
            @PathVariable("holderId") String holderId,
            @Valid @RequestBody TopUpRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        TopUpResult result = topUpService.topUp(holderId, request.getKey(), request.getAmount(), idempotencyKey);
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    @GetMapping("/{holderId}/auto-top-up/{key}")
    public AutoTopUpStatusResponse getAutoTopUpStatus(@PathVariable("holderId") String holderId,
                                                      @PathVariable("key") String key) {
        return topUpService.getAutoTopUpStatus(holderId, key)
                .map(AutoTopUpStatusResponse::from)
                .orElseGet(() -> AutoTopUpStatusResponse.clear(holderId, key));
    }

    @DeleteMapping("/{holderId}/auto-top-up/{key}/block")
    public Map<String, Boolean> unblockAutoTopUp(@PathVariable("holderId") String holderId,
                                                 @PathVariable("key") String key) {
        return Map.of("unblocked", topUpService.unblockAutoTopUp(holderId, key));
    }

    @DeleteMapping("/{holderId}/auto-top-up/blocks")
    public Map<String, Integer> unblockAllAutoTopUps(@PathVariable("holderId") String holderId) {
        return Map.of("unblocked", topUpService.unblockAllAutoTopUps(holderId));
    }

    @PostMapping("/orgs/{orgId}/seats/{userId}")
    public ResponseEntity<SeatResult> addSeat(@PathVariable("orgId") String orgId,
                                              @PathVariable("userId") String userId,
                                              @RequestParam(value = "key", required = false) String key) {
        SeatResult result = seatService.addSeat(userId, orgId, key);
        return ResponseEntity.status(result.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(result);
    }

    @DeleteMapping("/orgs/{orgId}/seats/{userId}")
    public ResponseEntity<SeatResult> removeSeat(@PathVariable("orgId") String orgId,
                                                 @PathVariable("userId") String userId,
                                                 @RequestParam(value = "key", required = false) String key) {
        SeatResult result = seatService.removeSeat(userId, orgId, key);
        return ResponseEntity.status(result.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(result);
    }

    private AutoTopUpResult triggerAutoTopUp(String holderId, String key, long balance) {
        try {
            if (WalletService.WALLET_KEY.equals(key)) {
                return walletTopUpService.triggerAutoTopUpIfNeeded(holderId);
            }
            return autoTopUpService.triggerAutoTopUpIfNeeded(holderId, key, balance);
        } catch (RuntimeException e) {
            // the consume is committed; the caller still gets its result
            log.error("Auto top-up check failed after consume: holderId={}, key={}", holderId, key, e);
            return AutoTopUpResult.failed("unexpected_error", null, null);
        }
    }

    public static HttpStatus statusOf(TopUpResult result) {
        switch (result.getOutcome()) {
            case SUCCEEDED:
                return HttpStatus.OK;
            case PENDING:
                return HttpStatus.ACCEPTED;
            default:
                break;
        }
        switch (result.getErrorCode()) {
            case INVALID_AMOUNT:
                return HttpStatus.BAD_REQUEST;
            case USER_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CURRENCY_MISMATCH:
                return HttpStatus.CONFLICT;
            case NO_PAYMENT_METHOD:
            case PAYMENT_FAILED:
                return HttpStatus.PAYMENT_REQUIRED;
            default:
                return HttpStatus.UNPROCESSABLE_ENTITY;
        }
    }
}
