package com.flowtrace.engine.ast.python;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Python3LexerTest {

    private static List<? extends Token> tokens(String source) {
        return new Python3Lexer(CharStreams.fromString(source)).getAllTokens();
    }

    private static List<Integer> types(String source) {
        return tokens(source).stream().map(Token::getType).toList();
    }

    @Test
    void indentationProducesIndentAndDedent() {
        List<Integer> types = types("if x:\n    y = 1\nz = 2\n");
        assertTrue(types.contains(Python3Lexer.INDENT));
        assertTrue(types.contains(Python3Lexer.DEDENT));
        assertEquals(Python3Lexer.NEWLINE, types.get(types.size() - 1));
    }

    @Test
    void openBlocksAreClosedAtEndOfInput() {
        List<Integer> types = types("def f():\n    if x:\n        return 1");
        long indents = types.stream().filter(t -> t == Python3Lexer.INDENT).count();
        long dedents = types.stream().filter(t -> t == Python3Lexer.DEDENT).count();
        assertEquals(2, indents);
        assertEquals(2, dedents);
        assertEquals(Python3Lexer.DEDENT, types.get(types.size() - 1));
    }

    @Test
    void bracketsJoinLines() {
        long newlines = types("total = (a +\n         b)\n").stream()
            .filter(t -> t == Python3Lexer.NEWLINE).count();
        assertEquals(1, newlines);
    }

    @Test
    void commentsAndBlankLinesAreSkipped() {
        List<? extends Token> tokens = tokens("# header\n\nx = 1  # trailing\n");
        assertEquals("x", tokens.get(0).getText());
        assertEquals(3, tokens.get(0).getLine());
    }

    @Test
    void longestOperatorWins() {
        List<? extends Token> tokens = tokens("x **= 2\n");
        assertEquals("**=", tokens.get(1).getText());
        assertEquals(Python3Lexer.POWER_ASSIGN, tokens.get(1).getType());
    }

    @Test
    void prefixedAndTripleQuotedStrings() {
        List<? extends Token> tokens = tokens("s = rb'raw' + f\"\"\"multi\nline\"\"\"\n");
        assertEquals(Python3Lexer.STRING, tokens.get(2).getType());
        assertEquals("rb'raw'", tokens.get(2).getText());
        assertEquals(Python3Lexer.STRING, tokens.get(4).getType());
    }

    @Test
    void softKeywordsAreNames() {
        List<? extends Token> tokens = tokens("match = case\n");
        assertEquals(Python3Lexer.NAME, tokens.get(0).getType());
        assertEquals(Python3Lexer.NAME, tokens.get(2).getType());
    }
}
