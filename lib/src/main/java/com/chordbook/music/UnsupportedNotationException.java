package com.chordbook.music;

public final class UnsupportedNotationException extends Exception {
    private final String notationName;

    public UnsupportedNotationException(String notationName) {
        super("Unsupported notation: " + notationName);
        this.notationName = notationName;
    }

    public String getNotationName() {
        return notationName;
    }
}
