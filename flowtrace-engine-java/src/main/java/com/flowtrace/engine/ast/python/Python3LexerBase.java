package com.flowtrace.engine.ast.python;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Indentation handling for the generated {@code Python3Lexer}.
 *
 * A line break followed by code produces NEWLINE plus the INDENT or DEDENT tokens the new
 * indentation implies. Line breaks inside brackets, before blank lines and before comment-only
 * lines produce nothing. At end of input the open statement is closed with a NEWLINE and every
 * open block with a DEDENT.
 */
public abstract class Python3LexerBase extends Lexer {

    private static final int TAB_STOP = 8;

    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int opened = 0;
    private int lastType = Token.INVALID_TYPE;
    private boolean finished = false;

    protected Python3LexerBase(CharStream input) {
        super(input);
    }

    @Override
    public Token nextToken() {
        if (!pending.isEmpty()) {
            return remember(pending.poll());
        }
        Token next = super.nextToken();
        if (next.getType() == Token.EOF && !finished) {
            finished = true;
            if (lastType != Token.INVALID_TYPE && lastType != Python3Lexer.NEWLINE && lastType != Python3Lexer.DEDENT) {
                pending.add(synthetic(Python3Lexer.NEWLINE, "\n"));
            }
            while (!indents.isEmpty()) {
                indents.pop();
                pending.add(synthetic(Python3Lexer.DEDENT, ""));
            }
            pending.add(next);
            return remember(pending.poll());
        }
        if (lastType == Token.INVALID_TYPE && next.getType() != Token.EOF && next.getCharPositionInLine() > 0) {
            reportError(next.getLine(), next.getCharPositionInLine(), "unexpected indent");
        }
        return remember(next);
    }

    @Override
    public void reset() {
        super.reset();
        pending.clear();
        indents.clear();
        opened = 0;
        lastType = Token.INVALID_TYPE;
        finished = false;
    }

    protected void openBracket() {
        opened++;
    }

    protected void closeBracket() {
        if (opened > 0) opened--;
    }

    /** Action of the NEWLINE rule: its text is the line break plus the next line's indentation. */
    protected void onNewLine() {
        int next = _input.LA(1);
        boolean blank = next == '\r' || next == '\n' || next == '#' || next == CharStream.EOF;
        if (opened > 0 || blank || lastType == Token.INVALID_TYPE || lastType == Python3Lexer.NEWLINE) {
            skip();
            return;
        }
        int indent = indentation(getText());
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent > previous) {
            indents.push(indent);
            pending.add(synthetic(Python3Lexer.INDENT, ""));
        } else if (indent < previous) {
            while (!indents.isEmpty() && indents.peek() > indent) {
                indents.pop();
                pending.add(synthetic(Python3Lexer.DEDENT, ""));
            }
            int level = indents.isEmpty() ? 0 : indents.peek();
            if (level != indent) {
                reportError(getLine(), getCharPositionInLine(), "unindent does not match any outer indentation level");
            }
        }
    }

    private static int indentation(String newline) {
        int width = 0;
        for (int i = 0; i < newline.length(); i++) {
            char c = newline.charAt(i);
            if (c == '\t') {
                width += TAB_STOP - (width % TAB_STOP);
            } else if (c == ' ') {
                width++;
            }
        }
        return width;
    }

    private Token synthetic(int type, String text) {
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL,
            _input.index(), _input.index() - 1);
        token.setText(text);
        token.setLine(getLine());
        token.setCharPositionInLine(getCharPositionInLine());
        return token;
    }

    private Token remember(Token token) {
        if (token.getChannel() == DEFAULT_TOKEN_CHANNEL) {
            lastType = token.getType();
        }
        return token;
    }

    private void reportError(int line, int column, String message) {
        getErrorListenerDispatch().syntaxError(this, null, line, column, message, null);
    }
}
