package com.chordbook.compiler;

import com.chordbook.ast.Song;
import java.util.List;

/** A song together with the diagnostics recorded while parsing it. */
final class ParsedSong {
    private final Song song;
    private final List<Diagnostic> diagnostics;

    ParsedSong(Song song, List<Diagnostic> diagnostics) {
        this.song = song;
        this.diagnostics = List.copyOf(diagnostics);
    }

    Song getSong() {
        return song;
    }

    List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
