package com.chordbook.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.chordbook.compiler.grammar.SongLexer;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;

class SongLexerTest {

    @Test
    void chordSpanProducesBacktickAndTextTokens() {
        assertEquals(
                List.of("BACKTICKS", "TEXT", "BACKTICKS", "TEXT", "WS", "TEXT", "EOF"),
                symbolicNames("`G7`Hello there"));
    }

    @Test
    void doubledMarkersLexAsSingleTokens() {
        assertEquals(
                List.of("STRONG", "TEXT", "STRONG", "WS", "EMPH", "TEXT", "EMPH", "EOF"),
                symbolicNames("**loud** _soft_"));
    }

    @Test
    void tagsAreSingleTokensAndStrayAngleBracketIsLt() {
        assertEquals(
                List.of("TAG", "TEXT", "WS", "LT", "WS", "TEXT", "TAG", "EOF"),
                symbolicNames("<span class=\"x\">a < b</span>"));
    }

    @Test
    void linkAndImagePunctuation() {
        assertEquals(
                List.of("IMAGE_OPEN", "TEXT", "RBRACKET", "LPAREN", "TEXT", "RPAREN", "WS", "BANG", "EOF"),
                symbolicNames("![alt](a.png) !"));
    }

    @Test
    void chorusMarkAndEscape() {
        assertEquals(
                List.of("TEXT", "WS", "CHORUS_MARK", "WS", "ESCAPE", "TEXT", "BACKSLASH", "EOF"),
                symbolicNames("see >> \\*x\\"));
    }

    private static List<String> symbolicNames(String line) {
        SongLexer lexer = new SongLexer(CharStreams.fromString(line, "test"));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();

        List<String> symbolic = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            if (token.getType() == Token.EOF) {
                symbolic.add("EOF");
            } else {
                symbolic.add(lexer.getVocabulary().getSymbolicName(token.getType()));
            }
        }
        return symbolic;
    }
}
