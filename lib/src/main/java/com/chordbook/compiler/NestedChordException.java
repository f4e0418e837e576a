package com.chordbook.compiler;

import com.chordbook.ast.SourceLocation;

/** A chord span found inside the lyric content of another chord. */
public final class NestedChordException extends SongSyntaxException {

    public NestedChordException(SourceLocation location) {
        super(location, "lyrics without a nested chord");
    }

    @Override
    public Diagnostic.Kind getKind() {
        return Diagnostic.Kind.NESTED_CHORD;
    }

    @Override
    Diagnostic toDiagnostic() {
        return Diagnostic.error(getKind(), "Chord inside the lyrics of another chord", getLocation());
    }
}
