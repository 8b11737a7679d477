package com.flowtrace.engine.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One source file's current text. Always read from disk; nothing is remembered between runs.
 */
public record SourceFile(String path, Language language, String text) {

    public static class SourceReadException extends RuntimeException {
        public SourceReadException(String msg, Throwable cause) { super(msg, cause); }
    }

    public static SourceFile read(Path path) {
        Language language = Language.fromPath(path)
            .orElseThrow(() -> new SourceReadException("Unsupported file type: " + path, null));
        try {
            return new SourceFile(path.toString(), language, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SourceReadException("Could not read " + path + ": " + e.getMessage(), e);
        }
    }

    public static SourceFile of(String path, String text) {
        Language language = Language.fromPath(Path.of(path))
            .orElseThrow(() -> new SourceReadException("Unsupported file type: " + path, null));
        return new SourceFile(path, language, text);
    }

    /** Trimmed text of a 1-based line, or "" when out of range. */
    public String line(int lineNumber) {
        int start = 0;
        for (int current = 1; current < lineNumber; current++) {
            int nl = text.indexOf('\n', start);
            if (nl < 0) return "";
            start = nl + 1;
        }
        int end = text.indexOf('\n', start);
        return (end < 0 ? text.substring(start) : text.substring(start, end)).trim();
    }

    public String sha256() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return "sha256:" + HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
