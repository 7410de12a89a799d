/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.api.audit;

/**
 * Destination for audit records produced by enforcement.
 *
 * <p>Implementations must be thread-safe and must not throw back into the request path.
 */
public interface AuditSink {

    void append(AuditRecord record);
}
