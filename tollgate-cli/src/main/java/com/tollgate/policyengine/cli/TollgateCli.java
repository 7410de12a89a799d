/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code tollgate} command.
 *
 * <pre>
 * tollgate validate policy.yaml
 * tollgate generate policy.yaml --framework express --output middleware/
 * tollgate check policy.yaml --agent-id agent-1 --cost 0.25
 * </pre>
 */
@Command(name = "tollgate",
        mixinStandardHelpOptions = true,
        version = "tollgate 1.0.0",
        description = "Validate access policies, generate enforcement middleware and evaluate requests.",
        subcommands = {ValidateCommand.class, GenerateCommand.class, CheckCommand.class})
public class TollgateCli implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new TollgateCli()).execute(args));
    }
}
