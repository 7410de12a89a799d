/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.cli;

/**
 * Process exit codes shared by all subcommands.
 */
final class ExitCodes {

    static final int OK = 0;
    static final int INVALID_POLICY = 1;
    static final int UNSUPPORTED_FRAMEWORK = 2;
    static final int NOT_ALLOWED = 3;

    private ExitCodes() {
    }
}
