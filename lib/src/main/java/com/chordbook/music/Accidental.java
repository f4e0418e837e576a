package com.chordbook.music;

/**
 * Accidental direction a note was written with. Spelling tables are keyed on it so a note
 * written with flats keeps being spelled with flats after transposition or conversion.
 */
public enum Accidental {
    NATURAL,
    SHARP,
    FLAT;

    static Accidental ofCount(int count) {
        if (count > 0) {
            return SHARP;
        }
        if (count < 0) {
            return FLAT;
        }
        return NATURAL;
    }
}
