package com.chordbook.music;

import java.util.Objects;

/**
 * A chord root or bass note: pitch class 0-11 (0 is C, or degree 1 in relative notations), the
 * accidental direction it was written with and whether it was written in lower case.
 */
public final class Note {
    private final int pitchClass;
    private final Accidental accidental;
    private final boolean lowercase;

    public Note(int pitchClass, Accidental accidental, boolean lowercase) {
        if (pitchClass < 0 || pitchClass > 11) {
            throw new IllegalArgumentException("Pitch class out of range: " + pitchClass);
        }
        this.pitchClass = pitchClass;
        this.accidental = Objects.requireNonNull(accidental, "accidental");
        this.lowercase = lowercase;
    }

    public int getPitchClass() {
        return pitchClass;
    }

    public Accidental getAccidental() {
        return accidental;
    }

    public boolean isLowercase() {
        return lowercase;
    }

    Note transpose(int semitones) {
        return new Note(Math.floorMod(pitchClass + semitones, 12), accidental, lowercase);
    }

    public String spell(Notation notation) {
        return notation.spell(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Note)) {
            return false;
        }
        Note other = (Note) obj;
        return pitchClass == other.pitchClass
                && lowercase == other.lowercase
                && accidental == other.accidental;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pitchClass, accidental, lowercase);
    }

    @Override
    public String toString() {
        return pitchClass + "/" + accidental + (lowercase ? "/lower" : "");
    }
}
