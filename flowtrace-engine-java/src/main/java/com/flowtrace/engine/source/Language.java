package com.flowtrace.engine.source;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Supported language surfaces, detected by file extension.
 */
public enum Language {
    PYTHON("python", ".py"),
    JAVA("java", ".java");

    private final String id;
    private final String extension;

    Language(String id, String extension) {
        this.id = id;
        this.extension = extension;
    }

    public String id()        { return id; }
    public String extension() { return extension; }

    public static Optional<Language> fromPath(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        for (Language l : values()) {
            if (name.endsWith(l.extension)) return Optional.of(l);
        }
        return Optional.empty();
    }
}
