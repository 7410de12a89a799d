/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.audit;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tollgate.policyengine.api.audit.AuditRecord;
import com.tollgate.policyengine.api.audit.AuditSink;
import com.tollgate.policyengine.api.audit.NoopAuditSink;
import com.tollgate.policyengine.api.model.Policy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes audit records as single lines to the {@value #LOGGER_NAME} logger at INFO.
 * Route that logger in the logging backend to choose the destination.
 */
public final class Slf4jAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "tollgate.audit";

    private static final Logger auditLog = LoggerFactory.getLogger(LOGGER_NAME);
    private static final Logger logger = LoggerFactory.getLogger(Slf4jAuditSink.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    public enum Format {
        JSON, CSV;

        static Format fromName(String name) {
            return valueOf(name.toUpperCase(Locale.ROOT));
        }
    }

    private final Format format;

    public Slf4jAuditSink() {
        this(Format.JSON);
    }

    public Slf4jAuditSink(Format format) {
        this.format = Objects.requireNonNull(format, "format must not be null");
    }

    /**
     * Sink configured from a policy's audit section, or a no-op sink when auditing is disabled.
     */
    public static AuditSink forPolicy(Policy.Audit audit) {
        if (!audit.enabled()) {
            return NoopAuditSink.INSTANCE;
        }
        return new Slf4jAuditSink(Format.fromName(audit.format()));
    }

    @Override
    public void append(AuditRecord record) {
        if (auditLog.isInfoEnabled()) {
            auditLog.info(render(record));
        }
    }

    String render(AuditRecord record) {
        if (format == Format.CSV) {
            return toCsv(record);
        }
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize audit record, falling back to CSV", e);
            return toCsv(record);
        }
    }

    private static String toCsv(AuditRecord record) {
        return Stream.of(record.subjectKey(), record.ruleId(), record.decision(),
                        record.amount() == null ? null : record.amount().toPlainString(),
                        record.timestamp() == null ? null : record.timestamp().toString())
                .map(Slf4jAuditSink::csvField)
                .collect(Collectors.joining(","));
    }

    private static String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
