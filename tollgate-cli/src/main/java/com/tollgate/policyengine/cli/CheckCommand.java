/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.cli;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tollgate.policyengine.api.exceptions.PolicyParseException;
import com.tollgate.policyengine.api.model.Decision;
import com.tollgate.policyengine.api.model.EvaluationRequest;
import com.tollgate.policyengine.compiler.PolicyCompiler;
import com.tollgate.policyengine.compiler.validation.PolicyValidationException;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.compiler.validation.ValidationIssue;
import com.tollgate.policyengine.runtime.enforcement.PolicyEnforcer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Evaluates a single request against a policy with empty usage state and prints the decision.
 */
@Command(name = "check", mixinStandardHelpOptions = true,
        description = "Evaluate one request against a policy file and print the decision as JSON.")
class CheckCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Policy file (YAML or JSON).")
    Path policyFile;

    @Option(names = "--agent-id", description = "Agent identifier of the caller.")
    String agentId;

    @Option(names = "--wallet-address", description = "Wallet address of the caller.")
    String walletAddress;

    @Option(names = "--ip-address", description = "IP address of the caller.")
    String ipAddress;

    @Option(names = "--cost", defaultValue = "0", description = "Estimated cost of the request (default: ${DEFAULT-VALUE}).")
    BigDecimal cost;

    @Override
    public Integer call() throws JsonProcessingException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ValidatedPolicy policy;
        try {
            policy = new PolicyCompiler().compile(policyFile);
        } catch (IOException e) {
            err.println("Cannot read " + policyFile + ": " + e.getMessage());
            return ExitCodes.INVALID_POLICY;
        } catch (PolicyParseException e) {
            err.println(policyFile + ": " + e.getMessage());
            return ExitCodes.INVALID_POLICY;
        } catch (PolicyValidationException e) {
            for (ValidationIssue issue : e.getErrors()) {
                err.println(issue.format());
            }
            return ExitCodes.INVALID_POLICY;
        }

        EvaluationRequest request;
        try {
            request = EvaluationRequest.builder()
                    .agentId(agentId)
                    .walletAddress(walletAddress)
                    .ipAddress(ipAddress)
                    .estimatedCost(cost)
                    .build();
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        Decision decision = PolicyEnforcer.forPolicy(policy).check(request).decision();
        out.println(MAPPER.writeValueAsString(decision.toReport()));
        return decision.isAllowed() ? ExitCodes.OK : ExitCodes.NOT_ALLOWED;
    }
}
