/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.cli;

import com.tollgate.policyengine.api.exceptions.PolicyParseException;
import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.compiler.PolicyParser;
import com.tollgate.policyengine.compiler.validation.PolicyValidator;
import com.tollgate.policyengine.compiler.validation.ValidationIssue;
import com.tollgate.policyengine.compiler.validation.ValidationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Reports every validation issue of a policy file. Warnings alone do not fail the command.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Check a policy file and report every error and warning.")
class ValidateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Policy file (YAML or JSON).")
    Path policyFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Policy policy;
        try {
            policy = new PolicyParser().parse(policyFile);
        } catch (IOException e) {
            err.println("Cannot read " + policyFile + ": " + e.getMessage());
            return ExitCodes.INVALID_POLICY;
        } catch (PolicyParseException e) {
            err.println(policyFile + ": " + e.getMessage());
            return ExitCodes.INVALID_POLICY;
        }

        ValidationResult result = new PolicyValidator().validate(policy);
        for (ValidationIssue issue : result.issues()) {
            out.println(issue.format());
        }
        if (result.isValid()) {
            out.printf("%s: valid, %d rule(s), %d warning(s)%n",
                    policyFile, policy.rules().size(), result.warnings().size());
            return ExitCodes.OK;
        }
        out.printf("%s: invalid, %d error(s)%n", policyFile, result.errors().size());
        return ExitCodes.INVALID_POLICY;
    }
}
