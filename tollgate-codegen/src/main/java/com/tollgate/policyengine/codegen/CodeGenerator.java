/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen;

import com.tollgate.policyengine.api.exceptions.InternalEngineException;
import com.tollgate.policyengine.api.exceptions.UnsupportedFrameworkException;
import com.tollgate.policyengine.codegen.ir.EnforcementPlan;
import com.tollgate.policyengine.codegen.ir.PlanBuilder;
import com.tollgate.policyengine.codegen.render.FrameworkRenderer;
import com.tollgate.policyengine.compiler.validation.PolicyValidator;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.compiler.validation.ValidationIssue;
import com.tollgate.policyengine.compiler.validation.ValidationResult;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Generates enforcement middleware from a validated policy.
 *
 * <p>Generation runs in three steps, each in its own span: re-validation of the policy, lowering
 * to an {@link EnforcementPlan}, and rendering by the {@link FrameworkRenderer} registered under
 * the requested name. The same policy always produces byte-identical output.
 *
 * <pre>{@code
 * ValidatedPolicy policy = new PolicyCompiler().compile(Path.of("policy.yaml"));
 * GeneratedSource source = new CodeGenerator().generate(policy, "express");
 * source.writeTo(Path.of("middleware"));
 * }</pre>
 */
public class CodeGenerator {
    private static final Logger logger = LoggerFactory.getLogger(CodeGenerator.class);

    public static final String DEFAULT_SOURCE_NAME = "policy";

    private final Tracer tracer;
    private final PolicyValidator validator;
    private final PlanBuilder planBuilder;
    private final Map<String, FrameworkRenderer> renderers;

    public CodeGenerator() {
        this(OpenTelemetry.noop().getTracer("tollgate-codegen"));
    }

    public CodeGenerator(Tracer tracer) {
        this(tracer, ServiceLoader.load(FrameworkRenderer.class));
    }

    CodeGenerator(Tracer tracer, Iterable<FrameworkRenderer> renderers) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.validator = new PolicyValidator(tracer);
        this.planBuilder = new PlanBuilder(tracer);
        this.renderers = new TreeMap<>();
        for (FrameworkRenderer renderer : renderers) {
            FrameworkRenderer existing = this.renderers.putIfAbsent(renderer.name(), renderer);
            if (existing != null) {
                logger.warn("Ignoring renderer {} for '{}': already provided by {}",
                        renderer.getClass().getName(), renderer.name(), existing.getClass().getName());
            }
        }
        logger.debug("Registered renderers: {}", this.renderers.keySet());
    }

    /**
     * Supported framework names, sorted.
     */
    public List<String> supportedFrameworks() {
        return List.copyOf(renderers.keySet());
    }

    public GeneratedSource generate(ValidatedPolicy policy, String framework) {
        return generate(policy, framework, DEFAULT_SOURCE_NAME);
    }

    /**
     * @param sourceName name of the policy source, quoted in the generated header
     * @throws UnsupportedFrameworkException if no renderer is registered under {@code framework}
     * @throws InternalEngineException       if the policy no longer validates
     */
    public GeneratedSource generate(ValidatedPolicy policy, String framework, String sourceName) {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(framework, "framework must not be null");
        Objects.requireNonNull(sourceName, "sourceName must not be null");

        Span span = tracer.spanBuilder("generate-code").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("framework", framework);
            revalidate(policy);

            FrameworkRenderer renderer = renderers.get(framework.trim().toLowerCase(Locale.ROOT));
            if (renderer == null) {
                throw new UnsupportedFrameworkException(framework, supportedFrameworks());
            }

            EnforcementPlan plan = planBuilder.build(policy);
            String content = render(renderer, plan, sourceName);
            logger.info("Generated {} middleware from {} ({} rules, {} bytes)",
                    renderer.name(), sourceName, plan.rules().size(), content.length());
            return new GeneratedSource(renderer.name(), renderer.fileName(), content);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void revalidate(ValidatedPolicy policy) {
        ValidationResult result = validator.validate(policy.policy());
        if (!result.isValid()) {
            String errors = result.errors().stream()
                    .map(ValidationIssue::message)
                    .collect(Collectors.joining("; "));
            throw new InternalEngineException("Validated policy failed re-validation: " + errors);
        }
    }

    private String render(FrameworkRenderer renderer, EnforcementPlan plan, String sourceName) {
        Span span = tracer.spanBuilder("render-" + renderer.name()).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return renderer.render(plan, sourceName);
        } finally {
            span.end();
        }
    }
}
