/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class AmountsTest {

    @ParameterizedTest
    @CsvSource({
            "10, 10",
            "10.00, 10",
            "0.0100, 0.01",
            "1500, 1500",
            "0, 0"
    })
    void normalizesWithoutExponent(String input, String expected) {
        assertThat(Amounts.normalize(new BigDecimal(input)).toString()).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"10", "10.0", "10.000"})
    void equivalentCapsAreEqual(String amount) {
        Rule.SpendingCap cap = new Rule.SpendingCap("cap", new BigDecimal(amount), "USDC", 60);

        assertThat(cap).isEqualTo(new Rule.SpendingCap("cap", BigDecimal.TEN, "USDC", 60));
    }
}
