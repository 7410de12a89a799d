/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A parsed, not yet validated, rule set.
 *
 * <p>Rule order is preserved for auditability and error reporting; it does not change
 * evaluation precedence.
 *
 * @param version format version declared by the document
 * @param rules   rules in document order
 * @param pricing payment terms advertised by generated middleware
 * @param audit   audit output settings for generated middleware
 */
public record Policy(String version, List<Rule> rules, Pricing pricing, Audit audit) {

    public static final String DEFAULT_VERSION = "1.0";

    public Policy {
        Objects.requireNonNull(version, "version must not be null");
        rules = List.copyOf(rules);
        pricing = pricing != null ? pricing : Pricing.DEFAULT;
        audit = audit != null ? audit : Audit.DEFAULT;
    }

    public Policy(List<Rule> rules) {
        this(DEFAULT_VERSION, rules, Pricing.DEFAULT, Audit.DEFAULT);
    }

    public <T extends Rule> List<T> rulesOfType(Class<T> type) {
        return rules.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    /**
     * Price quoted in 402 responses of generated middleware.
     */
    public record Pricing(BigDecimal amount, String currency, String memoPrefix) {
        public static final Pricing DEFAULT = new Pricing(new BigDecimal("0.01"), "USDC", null);

        public Pricing {
            Objects.requireNonNull(amount, "amount must not be null");
            Objects.requireNonNull(currency, "currency must not be null");
            amount = Amounts.normalize(amount);
        }
    }

    /**
     * Audit log settings for generated middleware. {@code format} is {@code json} or {@code csv}.
     */
    public record Audit(boolean enabled, String format, String destination) {
        public static final Audit DEFAULT = new Audit(true, "json", "stdout");

        public Audit {
            Objects.requireNonNull(format, "format must not be null");
            destination = destination != null ? destination : "stdout";
        }
    }
}
