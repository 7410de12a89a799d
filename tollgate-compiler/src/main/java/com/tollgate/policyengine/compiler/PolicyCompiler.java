/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.compiler;

import com.tollgate.policyengine.api.model.Policy;
import com.tollgate.policyengine.compiler.validation.PolicyValidator;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.compiler.validation.ValidationIssue;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Parse-then-validate pipeline. Warnings are logged; errors abort with an exception.
 */
public class PolicyCompiler implements IPolicyCompiler {
    private static final Logger logger = LoggerFactory.getLogger(PolicyCompiler.class);

    private Tracer tracer;
    private PolicyParser parser;
    private PolicyValidator validator;

    public PolicyCompiler() {
        this(OpenTelemetry.noop().getTracer("tollgate-compiler"));
    }

    public PolicyCompiler(Tracer tracer) {
        setTracer(tracer);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
        this.parser = new PolicyParser(tracer);
        this.validator = new PolicyValidator(tracer);
    }

    @Override
    public ValidatedPolicy compile(Path policyPath) throws IOException {
        Span span = tracer.spanBuilder("compile-policy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("policyFilePath", policyPath.toString());
            return compileText(Files.readString(policyPath), span);
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public ValidatedPolicy compile(String policyText) {
        Span span = tracer.spanBuilder("compile-policy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            return compileText(policyText, span);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private ValidatedPolicy compileText(String text, Span span) {
        long start = System.nanoTime();
        Policy policy = parser.parse(text);
        ValidatedPolicy validated = validator.validateOrThrow(policy);
        for (ValidationIssue warning : validated.warnings()) {
            logger.warn("Policy warning: {}", warning.message());
        }
        long elapsed = System.nanoTime() - start;
        span.setAttribute("ruleCount", validated.rules().size());
        span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(elapsed));
        return validated;
    }
}
