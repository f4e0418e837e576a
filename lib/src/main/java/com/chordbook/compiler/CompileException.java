package com.chordbook.compiler;

import java.util.List;

/** Checked exception thrown by {@link BookCompiler#compileStrict} when a book has errors. */
public final class CompileException extends Exception {
    private final List<Diagnostic> diagnostics;

    public CompileException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /** Every diagnostic collected for the book, errors or not. */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
