package com.flagship.credit_ledger.wallet;

import com.flagship.credit_ledger.credit.CreditController;
import com.flagship.credit_ledger.ledger.LedgerMutation;
import com.flagship.credit_ledger.ledger.TransactionSource;
import com.flagship.credit_ledger.topup.AutoTopUpResult;
import com.flagship.credit_ledger.topup.TopUpResult;
import com.flagship.credit_ledger.wallet.dto.WalletAddRequest;
import com.flagship.credit_ledger.wallet.dto.WalletConsumeRequest;
import com.flagship.credit_ledger.wallet.dto.WalletTopUpRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Wallet endpoints. Everything here is in cents of the wallet currency.
 */
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
@Validated
@Slf4j
public class WalletController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final WalletService walletService;
    private final WalletTopUpService walletTopUpService;

    @GetMapping("/{holderId}")
    public ResponseEntity<WalletBalance> getBalance(@PathVariable("holderId") String holderId) {
        return walletService.getBalance(holderId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{holderId}/history")
    public List<WalletEntry> getHistory(@PathVariable("holderId") String holderId,
                                        @RequestParam(value = "limit", defaultValue = "50") @Min(1) @Max(500) int limit,
                                        @RequestParam(value = "offset", defaultValue = "0") @Min(0) int offset) {
        return walletService.getHistory(holderId, limit, offset);
    }

    @PostMapping("/{holderId}/add")
    public ResponseEntity<WalletBalance> add(
            @PathVariable("holderId") String holderId,
            @Valid @RequestBody WalletAddRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        WalletBalance balance = walletService.add(holderId, request.getCents(), request.getCurrency(),
                LedgerMutation.builder()
                        .source(TransactionSource.MANUAL)
                        .description(request.getDescription())
                        .idempotencyKey(idempotencyKey)
                        .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(balance);
    }

    /**
     * Spends from the wallet, then lets wallet auto top-up run if it is configured.
     */
    @PostMapping("/{holderId}/consume")
    public WalletConsumeResult consume(
            @PathVariable("holderId") String holderId,
            @Valid @RequestBody WalletConsumeRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        WalletConsumeResult result = walletService.consume(holderId, request.getCents(),
                request.getDescription(), idempotencyKey);
        if (result.isSuccess()) {
            try {
                AutoTopUpResult autoTopUp = walletTopUpService.triggerAutoTopUpIfNeeded(holderId);
                log.debug("Wallet auto top-up check: holderId={}, triggered={}, reason={}",
                        holderId, autoTopUp.isTriggered(), autoTopUp.getReason());
            } catch (RuntimeException e) {
                log.error("Wallet auto top-up check failed after consume: holderId={}", holderId, e);
            }
        }
        return result;
    }

    @PostMapping("/{holderId}/top-up")
    public ResponseEntity<TopUpResult> topUp(
            @PathVariable("holderId") String holderId,
            @Valid @RequestBody WalletTopUpRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        TopUpResult result = walletTopUpService.topUp(holderId, request.getCents(), idempotencyKey);
        return ResponseEntity.status(CreditController.statusOf(result)).body(result);
    }
}
