/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.cli;

import com.tollgate.policyengine.api.exceptions.PolicyParseException;
import com.tollgate.policyengine.api.exceptions.UnsupportedFrameworkException;
import com.tollgate.policyengine.codegen.CodeGenerator;
import com.tollgate.policyengine.codegen.GeneratedSource;
import com.tollgate.policyengine.compiler.PolicyCompiler;
import com.tollgate.policyengine.compiler.validation.PolicyValidationException;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.compiler.validation.ValidationIssue;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Writes enforcement middleware for a policy file, to stdout unless {@code --output} is given.
 */
@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Generate enforcement middleware from a policy file.")
class GenerateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Policy file (YAML or JSON).")
    Path policyFile;

    @Option(names = {"-f", "--framework"}, required = true,
            description = "Target framework, for example express or fastify.")
    String framework;

    @Option(names = {"-o", "--output"},
            description = "Output file, or directory to write the framework's default file name into.")
    Path output;

    @Override
    public Integer call() {
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

        GeneratedSource source;
        try {
            source = new CodeGenerator().generate(policy, framework, policyFile.getFileName().toString());
        } catch (UnsupportedFrameworkException e) {
            err.println(e.getMessage());
            return ExitCodes.UNSUPPORTED_FRAMEWORK;
        }

        if (output == null) {
            out.print(source.content());
            out.flush();
            return ExitCodes.OK;
        }
        try {
            Path written = source.writeTo(output);
            out.println("Wrote " + source.framework() + " middleware to " + written);
            return ExitCodes.OK;
        } catch (IOException e) {
            err.println("Cannot write " + output + ": " + e.getMessage());
            return ExitCodes.INVALID_POLICY;
        }
    }
}
