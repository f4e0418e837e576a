package com.chordbook.music;

/**
 * Raised when a transposition delta outside [-11, 11] is passed directly. Directive offsets are
 * normalized before they reach the chord engine, so parsing never triggers this.
 */
public final class InvalidTranspositionException extends IllegalArgumentException {
    private final int semitones;

    public InvalidTranspositionException(int semitones) {
        super("Transposition out of range [-11, 11]: " + semitones);
        this.semitones = semitones;
    }

    public int getSemitones() {
        return semitones;
    }
}
