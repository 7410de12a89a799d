/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import java.math.BigDecimal;

/**
 * Monetary amount helpers.
 */
public final class Amounts {

    private Amounts() {
        throw new AssertionError("No instances");
    }

    /**
     * Strips trailing zeros without going to a negative scale, so {@code 10.00} becomes {@code 10}
     * rather than {@code 1E+1}.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        BigDecimal stripped = amount.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
