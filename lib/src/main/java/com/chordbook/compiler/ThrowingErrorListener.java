package com.chordbook.compiler;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Turns lexer errors into {@link ParseCancellationException}s carrying the column. */
final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        throw new ColumnCancellationException(charPositionInLine, msg, e);
    }

    static final class ColumnCancellationException extends ParseCancellationException {
        private final int charPositionInLine;

        ColumnCancellationException(int charPositionInLine, String message, Throwable cause) {
            super(message, cause);
            this.charPositionInLine = charPositionInLine;
        }

        int getCharPositionInLine() {
            return charPositionInLine;
        }
    }
}
