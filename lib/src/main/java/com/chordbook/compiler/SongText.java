package com.chordbook.compiler;

import java.util.List;

/** The lines of one song, starting with its title line. */
final class SongText {
    private final String sourceName;
    private final List<SourceLine> lines;

    SongText(String sourceName, List<SourceLine> lines) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("A song needs at least its title line");
        }
        this.sourceName = sourceName;
        this.lines = List.copyOf(lines);
    }

    String getSourceName() {
        return sourceName;
    }

    List<SourceLine> getLines() {
        return lines;
    }

    SourceLine getTitleLine() {
        return lines.get(0);
    }
}
