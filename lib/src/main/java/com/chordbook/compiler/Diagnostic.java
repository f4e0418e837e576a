package com.chordbook.compiler;

import com.chordbook.ast.SourceLocation;
import java.util.Locale;
import java.util.Objects;

/**
 * A problem found while compiling a book. Diagnostics never abort compilation; callers decide
 * whether any of them fail a build.
 */
public final class Diagnostic {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    public enum Kind {
        SYNTAX_ERROR,
        UNSUPPORTED_NOTATION,
        UNKNOWN_CHORUS_REFERENCE,
        NESTED_CHORD,
        DUPLICATE_CHORUS_LABEL,
        LABEL_ORDER,
        ORPHAN_CONTENT
    }

    private final Level level;
    private final Kind kind;
    private final String message;
    private final SourceLocation location;

    public Diagnostic(Level level, Kind kind, String message, SourceLocation location) {
        this.level = Objects.requireNonNull(level, "level");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.location = Objects.requireNonNull(location, "location");
    }

    public static Diagnostic error(Kind kind, String message, SourceLocation location) {
        return new Diagnostic(Level.ERROR, kind, message, location);
    }

    public static Diagnostic warning(Kind kind, String message, SourceLocation location) {
        return new Diagnostic(Level.WARNING, kind, message, location);
    }

    public Level getLevel() {
        return level;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isError() {
        return level == Level.ERROR;
    }

    @Override
    public String toString() {
        return location + ": " + level.name().toLowerCase(Locale.ROOT) + ": " + message;
    }
}
