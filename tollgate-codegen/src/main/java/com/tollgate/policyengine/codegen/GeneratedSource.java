/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Rendered middleware for one framework.
 *
 * @param fileName suggested file name, used when writing into a directory
 */
public record GeneratedSource(String framework, String fileName, String content) {

    public GeneratedSource {
        Objects.requireNonNull(framework, "framework must not be null");
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Writes the content to {@code target}, or to {@code target/fileName} if {@code target} is a directory.
     *
     * @return the file written
     */
    public Path writeTo(Path target) throws IOException {
        Path file = Files.isDirectory(target) ? target.resolve(fileName) : target;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
