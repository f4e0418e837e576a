package com.chordbook.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Cuts a source into songs at {@code # Title} lines that are not inside a code fence. */
final class SongSplitter {
    static final Pattern TITLE = Pattern.compile("^#(?:[ \\t]+(.*?))?[ \\t]*$");

    private SongSplitter() {}

    static Split split(SourceText source) {
        List<SourceLine> preamble = new ArrayList<>();
        List<SongText> songs = new ArrayList<>();
        List<SourceLine> current = null;
        Fence fence = null;
        for (SourceLine line : SourceLine.split(source.getText())) {
            if (fence != null) {
                if (fence.isClosedBy(line.getText())) {
                    fence = null;
                }
            } else if (TITLE.matcher(line.getText()).matches()) {
                if (current != null) {
                    songs.add(new SongText(source.getName(), current));
                }
                current = new ArrayList<>();
            } else {
                fence = Fence.open(line.getText());
            }
            (current != null ? current : preamble).add(line);
        }
        if (current != null) {
            songs.add(new SongText(source.getName(), current));
        }
        return new Split(preamble, songs);
    }

    static final class Split {
        private final List<SourceLine> preamble;
        private final List<SongText> songs;

        Split(List<SourceLine> preamble, List<SongText> songs) {
            this.preamble = List.copyOf(preamble);
            this.songs = List.copyOf(songs);
        }

        /** Lines before the first title. */
        List<SourceLine> getPreamble() {
            return preamble;
        }

        List<SongText> getSongs() {
            return songs;
        }
    }
}
