package com.chordbook.compiler;

import com.chordbook.ast.Book;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of compiling a book: the best-effort tree and every diagnostic, in input order. The
 * book is always present; blocks that failed to parse are missing from it.
 */
public final class CompileResult {
    private final Book book;
    private final List<Diagnostic> diagnostics;

    public CompileResult(Book book, List<Diagnostic> diagnostics) {
        this.book = book;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Book getBook() {
        return book;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                return true;
            }
        }
        return false;
    }

    public List<Diagnostic> getErrors() {
        List<Diagnostic> errors = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                errors.add(diagnostic);
            }
        }
        return errors;
    }
}
