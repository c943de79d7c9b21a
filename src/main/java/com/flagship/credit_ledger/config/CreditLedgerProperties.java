package com.flagship.credit_ledger.config;

import com.flagship.credit_ledger.lifecycle.GrantTarget;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code credits.*}.
 */
@ConfigurationProperties(prefix = "credits")
@Getter
@Setter
public class CreditLedgerProperties {

    /** Schema holding every table of the service. */
    private String schema = "billing";

    /** Who receives subscription credits. */
    private GrantTarget grantTo = GrantTarget.SUBSCRIBER;

    /** Return URLs for the recovery checkout offered after a failed top-up. */
    private String successUrl;
    private String cancelUrl;
}
