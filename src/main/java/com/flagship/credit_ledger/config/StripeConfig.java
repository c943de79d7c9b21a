package com.flagship.credit_ledger.config;

import com.stripe.StripeClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Stripe client only when an API key is configured.
 * Without it the gateway reports every charge as failed.
 */
@Configuration
@Slf4j
public class StripeConfig {

    @Bean
    @ConditionalOnExpression("!'${stripe.api-key:}'.isEmpty()")
    public StripeClient stripeClient(@Value("${stripe.api-key}") String apiKey) {
        log.info("Stripe client configured");
        return new StripeClient(apiKey);
    }
}
