package com.flowtrace.engine.ast.python;

/**
 * Raised while normalizing a parse tree the grammar accepts but Python rejects, such as an
 * assignment to a call. The adapter turns it into a ParseError.
 */
class PythonSyntaxException extends RuntimeException {

    final int line;
    final int column;

    PythonSyntaxException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }
}
