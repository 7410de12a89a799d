/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.management;

import com.tollgate.policyengine.compiler.IPolicyCompiler;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.infra.config.EngineConfig;
import com.tollgate.policyengine.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Owns the active policy for a policy file and hot-reloads it when the file changes.
 *
 * <p>The active policy is held in an {@link AtomicReference}: readers always see a complete,
 * validated snapshot and never block, even during a reload. A reload that fails to parse or
 * validate is logged and discarded; the previous policy stays active.
 *
 * <p>The initial load happens in the constructor and fails fast. {@link #start()} schedules
 * the file check on a single daemon thread.
 */
public class PolicyManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PolicyManager.class);

    private final Path policyPath;
    private final IPolicyCompiler compiler;
    private final Tracer tracer;
    private final long reloadIntervalSeconds;
    private final MetricsRegistry metrics;

    private final AtomicReference<ValidatedPolicy> activePolicy = new AtomicReference<>();
    private final List<Consumer<ValidatedPolicy>> reloadListeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;

    public PolicyManager(Path policyPath, Tracer tracer, IPolicyCompiler compiler) throws IOException {
        this(policyPath, tracer, compiler, EngineConfig.load(), MetricsRegistry.getInstance());
    }

    public PolicyManager(Path policyPath, Tracer tracer, IPolicyCompiler compiler,
                         EngineConfig config, MetricsRegistry metrics) throws IOException {
        this.policyPath = Objects.requireNonNull(policyPath, "policyPath must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.reloadIntervalSeconds = config.getReloadIntervalSeconds();
        this.metrics = metrics;
        this.compiler.setTracer(tracer);
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Policy-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        try {
            reloadPolicyInternal();
        } catch (IOException | RuntimeException e) {
            monitoringExecutor.shutdownNow();
            throw e;
        }
    }

    public ValidatedPolicy getPolicy() {
        return activePolicy.get();
    }

    public Path getPolicyPath() {
        return policyPath;
    }

    /**
     * Registers a callback run after every successful swap, with the new policy.
     * Callback failures are logged and do not undo the swap.
     */
    public void addReloadListener(Consumer<ValidatedPolicy> listener) {
        reloadListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void start() {
        monitoringExecutor.scheduleAtFixedRate(
                this::checkForUpdates, reloadIntervalSeconds, reloadIntervalSeconds, TimeUnit.SECONDS);
        logger.info("Watching {} for changes every {}s", policyPath, reloadIntervalSeconds);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Reloads the policy now, regardless of the file timestamp.
     *
     * @throws IOException if the file cannot be read; the previous policy stays active
     */
    public ValidatedPolicy reload() throws IOException {
        return reloadPolicyInternal();
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-policy-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("policyFile", policyPath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(policyPath).toMillis();
            if (currentModifiedTime != lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in {}. Attempting to reload...", policyPath);
                loadPolicy();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.warn("Could not check policy file {} for modifications", policyPath, e);
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.error("Unexpected error during policy reload check", e);
        } finally {
            span.end();
        }
    }

    private void loadPolicy() {
        try {
            reloadPolicyInternal();
        } catch (IOException | RuntimeException e) {
            logger.warn("Rejected new policy from {}: {}. Previous policy remains active.",
                    policyPath, e.getMessage());
        }
    }

    private ValidatedPolicy reloadPolicyInternal() throws IOException {
        Span span = tracer.spanBuilder("load-policy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(policyPath).toMillis();
            ValidatedPolicy newPolicy = compiler.compile(policyPath);
            ValidatedPolicy previous = activePolicy.getAndSet(newPolicy);
            this.lastModifiedTime = modifiedTime;
            span.setAttribute("ruleCount", newPolicy.rules().size());
            metrics.counter("tollgate_policy_reloads_total", "result", "success").increment();
            logger.info("{} policy from {} ({} rules, {} warnings)",
                    previous == null ? "Loaded" : "Reloaded", policyPath,
                    newPolicy.rules().size(), newPolicy.warnings().size());
            notifyListeners(newPolicy);
            return newPolicy;
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            metrics.counter("tollgate_policy_reloads_total", "result", "failure").increment();
            throw e;
        } finally {
            span.end();
        }
    }

    private void notifyListeners(ValidatedPolicy policy) {
        for (Consumer<ValidatedPolicy> listener : reloadListeners) {
            try {
                listener.accept(policy);
            } catch (RuntimeException e) {
                logger.warn("Policy reload listener failed", e);
            }
        }
    }
}
