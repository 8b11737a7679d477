package com.flowtrace.engine.ast;

import com.flowtrace.engine.source.Language;
import com.flowtrace.engine.source.SourceFile;

/**
 * Front end for one language surface. Turns a source file into the normalized {@link Stmt} stream
 * consumed by the graph builder, so nothing downstream depends on the language.
 *
 * Implementations must not throw on bad input: syntax failures are returned as
 * {@link ParseResult#failure} so a multi-file batch can continue.
 */
public interface SourceAdapter {

    Language language();

    ParseResult parse(SourceFile file);
}
