package com.flowtrace.engine.ast.python;

import com.flowtrace.engine.ast.ParseError;
import com.flowtrace.engine.ast.ParseResult;
import com.flowtrace.engine.ast.SourceAdapter;
import com.flowtrace.engine.ast.Stmt;
import com.flowtrace.engine.source.Language;
import com.flowtrace.engine.source.SourceFile;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Front end for Python sources. The generated {@code Python3Parser} builds the parse tree and
 * {@link PythonTreeNormalizer} turns it into the normalized statement stream.
 */
public class PythonAdapter implements SourceAdapter {

    /** Collects lexer and parser errors instead of printing them. */
    static class SyntaxErrors extends BaseErrorListener {

        private final String path;
        private final List<ParseError> errors = new ArrayList<>();

        SyntaxErrors(String path) {
            this.path = path;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            errors.add(new ParseError(path, line, charPositionInLine + 1, msg));
        }

        boolean any() {
            return !errors.isEmpty();
        }

        List<ParseError> errors() {
            return errors;
        }
    }

    @Override
    public Language language() {
        return Language.PYTHON;
    }

    @Override
    public ParseResult parse(SourceFile file) {
        SyntaxErrors errors = new SyntaxErrors(file.path());
        Python3Parser.FileInputContext tree = parser(file.text(), file.path(), errors).fileInput();
        if (errors.any()) {
            return ParseResult.failure(file, errors.errors());
        }
        try {
            List<Stmt> statements = new PythonTreeNormalizer(file).module(tree);
            return ParseResult.success(file, statements);
        } catch (PythonSyntaxException e) {
            return ParseResult.failure(file,
                List.of(new ParseError(file.path(), e.line, e.column, e.getMessage())));
        }
    }

    static Python3Parser parser(String text, String sourceName, SyntaxErrors errors) {
        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(text, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        Python3Parser parser = new Python3Parser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        return parser;
    }
}
