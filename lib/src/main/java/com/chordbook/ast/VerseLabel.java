package com.chordbook.ast;

import java.util.Objects;

/** Label of a verse paragraph: a verse number, a chorus number, custom text, or nothing. */
public final class VerseLabel {

    public enum Kind {
        NONE,
        VERSE,
        CHORUS,
        CUSTOM
    }

    private static final VerseLabel NONE = new VerseLabel(Kind.NONE, 0, null);

    private final Kind kind;
    private final int number;
    private final String text;

    private VerseLabel(Kind kind, int number, String text) {
        this.kind = kind;
        this.number = number;
        this.text = text;
    }

    public static VerseLabel none() {
        return NONE;
    }

    public static VerseLabel verse(int number) {
        return new VerseLabel(Kind.VERSE, number, null);
    }

    public static VerseLabel chorus(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Chorus number must be positive: " + number);
        }
        return new VerseLabel(Kind.CHORUS, number, null);
    }

    public static VerseLabel custom(String text) {
        return new VerseLabel(Kind.CUSTOM, 0, Objects.requireNonNull(text, "text"));
    }

    public Kind getKind() {
        return kind;
    }

    /** Verse or chorus number; 0 for other kinds. */
    public int getNumber() {
        return number;
    }

    /** Custom label text, or {@code null}. */
    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof VerseLabel)) {
            return false;
        }
        VerseLabel other = (VerseLabel) obj;
        return kind == other.kind && number == other.number && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text);
    }

    @Override
    public String toString() {
        switch (kind) {
            case VERSE:
                return number + ".";
            case CHORUS:
                return "chorus " + number;
            case CUSTOM:
                return "[" + text + "]";
            default:
                return "";
        }
    }
}
