/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.render;

/**
 * Line-oriented text builder with two-space indentation and {@code \n} line endings.
 */
public final class SourceWriter {
    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth;

    public SourceWriter line(String text) {
        if (!text.isEmpty()) {
            out.append(INDENT.repeat(depth)).append(text);
        }
        out.append('\n');
        return this;
    }

    public SourceWriter line() {
        out.append('\n');
        return this;
    }

    /**
     * Writes {@code text} and indents the following lines.
     */
    public SourceWriter open(String text) {
        line(text);
        depth++;
        return this;
    }

    /**
     * Outdents, then writes {@code text}.
     */
    public SourceWriter close(String text) {
        if (depth == 0) {
            throw new IllegalStateException("Unbalanced close: " + text);
        }
        depth--;
        return line(text);
    }

    /**
     * Appends a multi-line block, re-indenting each line to the current depth.
     */
    public SourceWriter block(String text) {
        text.lines().forEach(this::line);
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
