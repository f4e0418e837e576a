package com.chordbook.music;

/** A note read from the start of a chord token, with the index just past its spelling. */
final class NoteMatch {
    private final Note note;
    private final int end;

    NoteMatch(Note note, int end) {
        this.note = note;
        this.end = end;
    }

    Note getNote() {
        return note;
    }

    int getEnd() {
        return end;
    }
}
