package com.chordbook.compiler;

import com.chordbook.ast.SourceLocation;
import java.util.Objects;

/** Malformed directive, chord or markup token. Recovered at the enclosing block boundary. */
public class SongSyntaxException extends Exception {
    private final SourceLocation location;
    private final String expected;

    public SongSyntaxException(SourceLocation location, String expected) {
        super(location + ": expected " + expected);
        this.location = Objects.requireNonNull(location, "location");
        this.expected = expected;
    }

    public SongSyntaxException(SourceLocation location, String expected, Throwable cause) {
        super(location + ": expected " + expected, cause);
        this.location = Objects.requireNonNull(location, "location");
        this.expected = expected;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getExpected() {
        return expected;
    }

    public Diagnostic.Kind getKind() {
        return Diagnostic.Kind.SYNTAX_ERROR;
    }

    Diagnostic toDiagnostic() {
        String detail = getCause() != null ? getCause().getMessage() : "Syntax error: expected " + expected;
        return Diagnostic.error(getKind(), detail, location);
    }
}
