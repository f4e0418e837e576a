package com.chordbook.music;

import java.util.Locale;
import java.util.Objects;

/**
 * The four chord notation systems. Each constant reads a note from chord text and spells a
 * {@link Note} back using a fixed table per accidental direction, so conversions are total and
 * repeated round trips are deterministic.
 *
 * <p>Nashville and Roman are relative systems anchored on C: degree 1 (I) is pitch class 0.</p>
 */
public enum Notation {
    ENGLISH(
            "english",
            false,
            new String[] {"C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"},
            new String[] {"C", "Db", "D", "Eb", "E", "F", "Gb", "G", "Ab", "A", "Bb", "B"},
            new String[] {"C", "C#", "D", "Eb", "E", "F", "F#", "G", "Ab", "A", "Bb", "B"}) {
        @Override
        NoteMatch match(String text, int from) {
            char letter = text.charAt(from);
            if (letter < 'A' || letter > 'G') {
                return null;
            }
            int end = accidentalRunEnd(text, from + 1);
            int count = accidentalCount(text, from + 1, end);
            int pitch = Math.floorMod(LETTER_PITCH[letter - 'A'] + count, 12);
            return new NoteMatch(new Note(pitch, Accidental.ofCount(count), false), end);
        }
    },

    GERMAN(
            "german",
            true,
            new String[] {"C", "Cis", "D", "Dis", "E", "F", "Fis", "G", "Gis", "A", "Ais", "H"},
            new String[] {"C", "Des", "D", "Es", "E", "F", "Ges", "G", "As", "A", "B", "H"},
            new String[] {"C", "Cis", "D", "Es", "E", "F", "Fis", "G", "As", "A", "B", "H"}) {
        @Override
        NoteMatch match(String text, int from) {
            char letter = text.charAt(from);
            char upper = Character.toUpperCase(letter);
            if (upper < 'A' || upper > 'H') {
                return null;
            }
            int base;
            if (upper == 'H') {
                base = 11;
            } else if (upper == 'B') {
                base = 10;
            } else {
                base = LETTER_PITCH[upper - 'A'];
            }
            int pos = from + 1;
            int count = 0;
            // "As"/"Es" are flats, but "Asus4" is A with a sus4 suffix.
            if ((upper == 'A' || upper == 'E') && text.startsWith("s", pos) && !text.startsWith("sus", pos)) {
                count = -1;
                pos++;
                while (text.startsWith("es", pos)) {
                    count--;
                    pos += 2;
                }
            } else if (text.startsWith("is", pos)) {
                while (text.startsWith("is", pos)) {
                    count++;
                    pos += 2;
                }
            } else {
                while (text.startsWith("es", pos)) {
                    count--;
                    pos += 2;
                }
            }
            int pitch = Math.floorMod(base + count, 12);
            return new NoteMatch(
                    new Note(pitch, Accidental.ofCount(count), Character.isLowerCase(letter)), pos);
        }
    },

    NASHVILLE(
            "nashville",
            false,
            new String[] {"1", "#1", "2", "#2", "3", "4", "#4", "5", "#5", "6", "#6", "7"},
            new String[] {"1", "b2", "2", "b3", "3", "4", "b5", "5", "b6", "6", "b7", "7"},
            new String[] {"1", "b2", "2", "b3", "3", "4", "#4", "5", "b6", "6", "b7", "7"}) {
        @Override
        NoteMatch match(String text, int from) {
            int degreeAt = accidentalRunEnd(text, from);
            if (degreeAt >= text.length()) {
                return null;
            }
            char digit = text.charAt(degreeAt);
            if (digit < '1' || digit > '7') {
                return null;
            }
            int count = accidentalCount(text, from, degreeAt);
            int pitch = Math.floorMod(DEGREE_PITCH[digit - '1'] + count, 12);
            return new NoteMatch(new Note(pitch, Accidental.ofCount(count), false), degreeAt + 1);
        }
    },

    ROMAN(
            "roman",
            true,
            new String[] {"I", "#I", "II", "#II", "III", "IV", "#IV", "V", "#V", "VI", "#VI", "VII"},
            new String[] {"I", "bII", "II", "bIII", "III", "IV", "bV", "V", "bVI", "VI", "bVII", "VII"},
            new String[] {"I", "bII", "II", "bIII", "III", "IV", "#IV", "V", "bVI", "VI", "bVII", "VII"}) {
        @Override
        NoteMatch match(String text, int from) {
            int numeralAt = accidentalRunEnd(text, from);
            int count = accidentalCount(text, from, numeralAt);
            for (int i = 0; i < NUMERALS.length; i++) {
                String numeral = NUMERALS[i];
                boolean lower = text.startsWith(numeral.toLowerCase(Locale.ROOT), numeralAt);
                if (lower || text.startsWith(numeral, numeralAt)) {
                    int pitch = Math.floorMod(DEGREE_PITCH[NUMERAL_DEGREES[i] - 1] + count, 12);
                    return new NoteMatch(
                            new Note(pitch, Accidental.ofCount(count), lower),
                            numeralAt + numeral.length());
                }
            }
            return null;
        }
    };

    // Indexed by letter - 'A'.
    private static final int[] LETTER_PITCH = {9, 11, 0, 2, 4, 5, 7};
    // Major-scale offsets of degrees 1..7.
    private static final int[] DEGREE_PITCH = {0, 2, 4, 5, 7, 9, 11};
    // Longest numerals first so "IV" is not read as "I".
    private static final String[] NUMERALS = {"VII", "VI", "IV", "V", "III", "II", "I"};
    private static final int[] NUMERAL_DEGREES = {7, 6, 4, 5, 3, 2, 1};

    private final String name;
    private final boolean caseSensitive;
    private final String[] sharpSpellings;
    private final String[] flatSpellings;
    private final String[] naturalSpellings;

    Notation(
            String name,
            boolean caseSensitive,
            String[] sharpSpellings,
            String[] flatSpellings,
            String[] naturalSpellings) {
        this.name = name;
        this.caseSensitive = caseSensitive;
        this.sharpSpellings = sharpSpellings;
        this.flatSpellings = flatSpellings;
        this.naturalSpellings = naturalSpellings;
    }

    /**
     * Reads a note starting at {@code from}.
     *
     * @return the note and the index after it, or {@code null} when no note starts there
     */
    abstract NoteMatch match(String text, int from);

    public String getName() {
        return name;
    }

    public boolean isRelative() {
        return this == NASHVILLE || this == ROMAN;
    }

    /** Whether a lower-case source spelling is kept when spelling in this notation. */
    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    String spell(Note note) {
        String[] table;
        switch (note.getAccidental()) {
            case SHARP:
                table = sharpSpellings;
                break;
            case FLAT:
                table = flatSpellings;
                break;
            default:
                table = naturalSpellings;
                break;
        }
        String spelling = table[note.getPitchClass()];
        if (caseSensitive && note.isLowercase()) {
            return spelling.toLowerCase(Locale.ROOT);
        }
        return spelling;
    }

    public static Notation fromName(String name) throws UnsupportedNotationException {
        Objects.requireNonNull(name, "name");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Notation notation : values()) {
            if (notation.name.equals(normalized)) {
                return notation;
            }
        }
        throw new UnsupportedNotationException(name);
    }

    private static int accidentalValue(char c) {
        switch (c) {
            case '#':
            case '♯':
                return 1;
            case 'b':
            case '♭':
                return -1;
            default:
                return 0;
        }
    }

    /** End of a run of same-direction accidental marks starting at {@code from}. */
    private static int accidentalRunEnd(String text, int from) {
        if (from >= text.length()) {
            return from;
        }
        int sign = accidentalValue(text.charAt(from));
        int pos = from;
        while (sign != 0 && pos < text.length() && accidentalValue(text.charAt(pos)) == sign) {
            pos++;
        }
        return pos;
    }

    private static int accidentalCount(String text, int from, int end) {
        int count = 0;
        for (int i = from; i < end; i++) {
            count += accidentalValue(text.charAt(i));
        }
        return count;
    }

    @Override
    public String toString() {
        return name;
    }
}
