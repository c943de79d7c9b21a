package com.flagship.credit_ledger.wallet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.support.CreditLedgerIntegrationTest;
import com.flagship.credit_ledger.wallet.dto.WalletAddRequest;
import com.flagship.credit_ledger.wallet.dto.WalletConsumeRequest;
import com.flagship.credit_ledger.wallet.dto.WalletTopUpRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class WalletControllerTest extends CreditLedgerIntegrationTest {

    private static final String HOLDER = "user_wallet_api";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private void add(long cents, String currency, int expectedStatus) throws Exception {
        WalletAddRequest request = WalletAddRequest.builder().cents(cents).currency(currency).build();
        mockMvc.perform(post("/api/wallets/{holderId}/add", HOLDER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().is(expectedStatus));
    }

    @Test
    @DisplayName("A holder without wallet gets 404")
    void noWallet() throws Exception {
        mockMvc.perform(get("/api/wallets/{holderId}", HOLDER))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Add then consume updates the formatted balance")
    void addAndConsume() throws Exception {
        printTestHeader("Wallet over HTTP");

        add(1000, "usd", 201);

        mockMvc.perform(post("/api/wallets/{holderId}/consume", HOLDER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(WalletConsumeRequest.builder().cents(250L).build())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.balance.formatted").value("$7.50"));

        mockMvc.perform(get("/api/wallets/{holderId}/history", HOLDER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
        printSuccess("wallet add and consume reflected in balance and history");
    }

    @Test
    @DisplayName("Adding in another currency answers 409")
    void currencyMismatch() throws Exception {
        add(1000, "usd", 201);

        WalletAddRequest request = WalletAddRequest.builder().cents(500L).currency("eur").build();
        mockMvc.perform(post("/api/wallets/{holderId}/add", HOLDER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CURRENCY_MISMATCH"));
    }

    @Test
    @DisplayName("A malformed currency code is rejected by validation")
    void invalidCurrency() throws Exception {
        add(1000, "dollars", 400);
    }

    @Test
    @DisplayName("Topping up a wallet held in another currency answers 409 without charging")
    void topUpCurrencyMismatch() throws Exception {
        givenCustomer(HOLDER, "cus_wallet_api", "pm_card_visa");
        givenSubscription("sub_wallet_api", "cus_wallet_api", "price_pro_monthly", 1);
        add(1000, "eur", 201);

        mockMvc.perform(post("/api/wallets/{holderId}/top-up", HOLDER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(WalletTopUpRequest.builder().cents(2_000L).build())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("CURRENCY_MISMATCH"));
        verify(paymentGateway, never()).createCharge(any());
    }
}
