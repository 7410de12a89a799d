/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.infra.management;

import com.tollgate.policyengine.api.exceptions.PolicyParseException;
import com.tollgate.policyengine.compiler.IPolicyCompiler;
import com.tollgate.policyengine.compiler.PolicyCompiler;
import com.tollgate.policyengine.compiler.validation.ValidatedPolicy;
import com.tollgate.policyengine.infra.config.EngineConfig;
import com.tollgate.policyengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PolicyManagerTest {

    private static final ValidatedPolicy FIRST = new PolicyCompiler().compile("""
            policies:
              - type: rate_limit
                max_requests: 10
                window_seconds: 60
            """);
    private static final ValidatedPolicy SECOND = new PolicyCompiler().compile("""
            policies:
              - type: rate_limit
                max_requests: 20
                window_seconds: 60
            """);

    @Mock
    private IPolicyCompiler compiler;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @TempDir
    Path tempDir;

    private Path policyPath;
    private InMemoryMetricsRegistry metrics;

    @BeforeEach
    void setUp() throws IOException {
        policyPath = tempDir.resolve("policy.yaml");
        Files.writeString(policyPath, "policies: []");
        metrics = new InMemoryMetricsRegistry();

        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
    }

    private PolicyManager newManager() throws IOException {
        return new PolicyManager(policyPath, tracer, compiler, EngineConfig.defaults(), metrics);
    }

    private void touch() throws IOException {
        FileTime current = Files.getLastModifiedTime(policyPath);
        Files.setLastModifiedTime(policyPath, FileTime.fromMillis(current.toMillis() + 5_000));
    }

    @Test
    @DisplayName("Should load policy on construction")
    void shouldLoadPolicyOnInitialization() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(FIRST);

        PolicyManager manager = newManager();

        assertThat(manager.getPolicy()).isSameAs(FIRST);
        verify(compiler).compile(policyPath);
        verify(compiler).setTracer(tracer);
        assertThat(metrics.getCounterValue("tollgate_policy_reloads_total", "result", "success")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail fast when the initial load fails")
    void shouldThrowIfInitialLoadFails() throws Exception {
        when(compiler.compile(any(Path.class)))
                .thenThrow(new PolicyParseException("bad", PolicyParseException.DOCUMENT_LEVEL, null, "mapping"));

        assertThatThrownBy(this::newManager).isInstanceOf(PolicyParseException.class);
    }

    @Test
    @DisplayName("Should swap policy when the file changes")
    void shouldReloadWhenFileChanges() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(FIRST, SECOND);
        List<ValidatedPolicy> notified = new ArrayList<>();

        PolicyManager manager = newManager();
        manager.addReloadListener(notified::add);
        touch();
        manager.checkForUpdates();

        assertThat(manager.getPolicy()).isSameAs(SECOND);
        assertThat(notified).containsExactly(SECOND);
        verify(compiler, times(2)).compile(policyPath);
    }

    @Test
    @DisplayName("Should not recompile an unchanged file")
    void shouldSkipUnchangedFile() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(FIRST);

        PolicyManager manager = newManager();
        manager.checkForUpdates();

        verify(compiler, times(1)).compile(policyPath);
    }

    @Test
    @DisplayName("Should keep the previous policy if the reload fails")
    void shouldKeepOldPolicyIfReloadFails() throws Exception {
        when(compiler.compile(any(Path.class)))
                .thenReturn(FIRST)
                .thenThrow(new PolicyParseException("broken", 0, "type", "string"));

        PolicyManager manager = newManager();
        touch();
        manager.checkForUpdates();

        assertThat(manager.getPolicy()).isSameAs(FIRST);
        assertThat(metrics.getCounterValue("tollgate_policy_reloads_total", "result", "failure")).isEqualTo(1);
        verify(span).recordException(any(PolicyParseException.class));
    }

    @Test
    void manualReloadSwapsPolicy() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(FIRST, SECOND);

        PolicyManager manager = newManager();

        assertThat(manager.reload()).isSameAs(SECOND);
        assertThat(manager.getPolicy()).isSameAs(SECOND);
    }

    @Test
    void failingListenerDoesNotUndoSwap() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(FIRST, SECOND);

        PolicyManager manager = newManager();
        manager.addReloadListener(p -> {
            throw new IllegalStateException("listener failure");
        });
        manager.reload();

        assertThat(manager.getPolicy()).isSameAs(SECOND);
    }

    @Test
    void startAndShutdown() throws Exception {
        when(compiler.compile(any(Path.class))).thenReturn(FIRST);

        try (PolicyManager manager = newManager()) {
            manager.start();
            assertThat(manager.getPolicyPath()).isEqualTo(policyPath);
        }
    }
}
