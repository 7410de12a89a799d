/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Request attributes that allow/deny lists can target and that identify a subject
 * for rate and spending accounting.
 *
 * <p>Declaration order is the subject resolution order: the first attribute present
 * on a request is the one its usage is accounted against.
 */
public enum SubjectField {
    AGENT_ID("agent_id"),
    WALLET_ADDRESS("wallet_address"),
    IP_ADDRESS("ip_address");

    private final String key;

    SubjectField(String key) {
        this.key = key;
    }

    /**
     * Returns the configuration key for this field (e.g. {@code agent_id}).
     */
    public String key() {
        return key;
    }

    public static Optional<SubjectField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (SubjectField field : values()) {
            if (field.key.equals(key)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    public static List<String> keys() {
        return Arrays.stream(values()).map(SubjectField::key).toList();
    }

    @Override
    public String toString() {
        return key;
    }
}
