package com.chordbook.compiler;

import com.chordbook.ast.SourceLocation;
import com.chordbook.compiler.grammar.SongLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.Token;

/** Developer switches for dumping lexer output while chasing markup problems. */
public final class DebugFlags {
    private static final String TOKENS_PROPERTY = "chordbook.debugTokens";
    /** Environment fallback; the system property wins when both are set. */
    private static final String TOKENS_ENV = "CHORDBOOK_DEBUG_TOKENS";
    /** Set only on threads that called {@link #startTokenCapture()}. */
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS = new ThreadLocal<>();

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    static void logTokens(List<? extends Token> tokens, SourceLocation location) {
        System.err.printf(Locale.ROOT, "[chordbook] Tokens of %s:%n", location);
        for (Token token : tokens) {
            String symbolic = SongLexer.VOCABULARY.getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-12s @ %-3d -> %s",
                            symbolic,
                            token.getCharPositionInLine() + location.getColumn(),
                            token.getText());
            System.err.printf(Locale.ROOT, "  %s%n", line);
            List<String> captured = CAPTURED_TOKENS.get();
            if (captured != null) {
                captured.add(line);
            }
        }
    }

    /** Keeps the token dump lines logged on the current thread until they are drained. */
    public static void startTokenCapture() {
        CAPTURED_TOKENS.set(new ArrayList<>());
    }

    /** Returns the lines captured on the current thread and stops capturing. */
    public static List<String> drainCapturedTokens() {
        List<String> captured = CAPTURED_TOKENS.get();
        CAPTURED_TOKENS.remove();
        return captured != null ? captured : List.of();
    }
}
