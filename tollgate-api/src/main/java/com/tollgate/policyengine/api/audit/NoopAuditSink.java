/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.audit;

public final class NoopAuditSink implements AuditSink {
    public static final NoopAuditSink INSTANCE = new NoopAuditSink();

    private NoopAuditSink() {
    }

    @Override
    public void append(AuditRecord record) {
    }
}
