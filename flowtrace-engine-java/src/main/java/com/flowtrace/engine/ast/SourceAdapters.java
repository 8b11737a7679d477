package com.flowtrace.engine.ast;

import com.flowtrace.engine.ast.java.JavaAdapter;
import com.flowtrace.engine.ast.python.PythonAdapter;
import com.flowtrace.engine.source.Language;

/**
 * Picks the front end for a language. Adapters are stateless, so a fresh one per file is fine
 * and keeps concurrent workers independent.
 */
public final class SourceAdapters {

    private SourceAdapters() {}

    public static SourceAdapter forLanguage(Language language) {
        return switch (language) {
            case PYTHON -> new PythonAdapter();
            case JAVA   -> new JavaAdapter();
        };
    }
}
