package com.chordbook.music;

import java.util.Objects;

/**
 * A parsed chord: root note, an opaque quality/extension suffix and an optional bass note, in a
 * given notation. Instances are immutable; transposition and conversion return new values and
 * never touch the suffix.
 */
public final class ChordSymbol {
    private final Note root;
    private final String suffix;
    private final Note bass;
    private final Notation notation;

    public ChordSymbol(Note root, String suffix, Note bass, Notation notation) {
        this.root = Objects.requireNonNull(root, "root");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        this.bass = bass;
        this.notation = Objects.requireNonNull(notation, "notation");
    }

    /**
     * Parses chord text such as {@code "F#m7/C#"} in the given notation.
     *
     * @throws ChordSyntaxException when the text has no valid root or the suffix contains
     *     whitespace
     */
    public static ChordSymbol parse(String text, Notation notation) throws ChordSyntaxException {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(notation, "notation");
        String chord = text.strip();
        if (chord.isEmpty()) {
            throw new ChordSyntaxException(text, "a chord root");
        }
        NoteMatch root = notation.match(chord, 0);
        if (root == null) {
            throw new ChordSyntaxException(text, "a " + notation.getName() + " root note");
        }
        String rest = chord.substring(root.getEnd());
        Note bass = null;
        int slash = rest.lastIndexOf('/');
        if (slash >= 0 && slash + 1 < rest.length()) {
            String bassText = rest.substring(slash + 1);
            NoteMatch bassMatch = notation.match(bassText, 0);
            if (bassMatch != null && bassMatch.getEnd() == bassText.length()) {
                bass = bassMatch.getNote();
                rest = rest.substring(0, slash);
            }
        }
        for (int i = 0; i < rest.length(); i++) {
            if (Character.isWhitespace(rest.charAt(i))) {
                throw new ChordSyntaxException(text, "a single chord without whitespace");
            }
        }
        return new ChordSymbol(root.getNote(), rest, bass, notation);
    }

    public Note getRoot() {
        return root;
    }

    public String getSuffix() {
        return suffix;
    }

    /** The bass note, or {@code null} when the chord has none. */
    public Note getBass() {
        return bass;
    }

    public Notation getNotation() {
        return notation;
    }

    /**
     * Moves root and bass by {@code semitones}, keeping notation, suffix and spelling direction.
     *
     * @throws InvalidTranspositionException when {@code semitones} is outside [-11, 11]
     */
    public ChordSymbol transpose(int semitones) {
        if (semitones < -11 || semitones > 11) {
            throw new InvalidTranspositionException(semitones);
        }
        if (semitones == 0) {
            return this;
        }
        return new ChordSymbol(
                root.transpose(semitones),
                suffix,
                bass == null ? null : bass.transpose(semitones),
                notation);
    }

    /** Re-spells the same pitches in {@code target}. */
    public ChordSymbol convert(Notation target) {
        Objects.requireNonNull(target, "target");
        if (target == notation) {
            return this;
        }
        return new ChordSymbol(root, suffix, bass, target);
    }

    public ChordSymbol convert(String targetName) throws UnsupportedNotationException {
        return convert(Notation.fromName(targetName));
    }

    /** Surface text of this chord in its notation. */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(root.spell(notation)).append(suffix);
        if (bass != null) {
            sb.append('/').append(bass.spell(notation));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ChordSymbol)) {
            return false;
        }
        ChordSymbol other = (ChordSymbol) obj;
        return root.equals(other.root)
                && suffix.equals(other.suffix)
                && Objects.equals(bass, other.bass)
                && notation == other.notation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, suffix, bass, notation);
    }

    @Override
    public String toString() {
        return format();
    }
}
