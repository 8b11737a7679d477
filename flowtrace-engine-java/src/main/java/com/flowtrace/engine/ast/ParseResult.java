package com.flowtrace.engine.ast;

import com.flowtrace.engine.source.Language;
import com.flowtrace.engine.source.SourceFile;

import java.util.List;

/**
 * Output of a {@link SourceAdapter}: the normalized statement stream of one file, or the errors
 * that prevented producing it. Callers must check {@link #ok()} before using the statements.
 */
public record ParseResult(SourceFile file, List<Stmt> statements, List<ParseError> errors) {

    public static ParseResult success(SourceFile file, List<Stmt> statements) {
        return new ParseResult(file, List.copyOf(statements), List.of());
    }

    public static ParseResult failure(SourceFile file, List<ParseError> errors) {
        return new ParseResult(file, List.of(), List.copyOf(errors));
    }

    public boolean ok() {
        return errors.isEmpty();
    }

    public Language language() {
        return file.language();
    }
}
