package com.chordbook.music;

/** Checked exception signalling that a chord token does not match the grammar of its notation. */
public final class ChordSyntaxException extends Exception {
    private final String chordText;
    private final String expected;

    public ChordSyntaxException(String chordText, String expected) {
        super("Invalid chord '" + chordText + "': expected " + expected);
        this.chordText = chordText;
        this.expected = expected;
    }

    public String getChordText() {
        return chordText;
    }

    public String getExpected() {
        return expected;
    }
}
