package com.chordbook.ast;

import java.util.List;
import java.util.Objects;

/**
 * A chord placed over lyrics. {@code chord} is the text after transposition and notation
 * conversion; {@code altChord} is the second-row rendering, present only while the secondary
 * row is enabled. {@code backticks} records the delimiter count used in the source (1 or 2).
 */
public final class Chord implements Inline {
    private final String chord;
    private final String altChord;
    private final int backticks;
    private final boolean baseline;
    private final List<Inline> inlines;

    public Chord(String chord, String altChord, int backticks, boolean baseline, List<Inline> inlines) {
        this.chord = Objects.requireNonNull(chord, "chord");
        this.altChord = altChord;
        if (backticks != 1 && backticks != 2) {
            throw new IllegalArgumentException("Chord style must be 1 or 2 backticks: " + backticks);
        }
        this.backticks = backticks;
        this.baseline = baseline;
        this.inlines = List.copyOf(inlines);
        if (baseline && !this.inlines.isEmpty()) {
            throw new IllegalArgumentException("Baseline chord cannot carry lyrics");
        }
        if (containsChord(this.inlines)) {
            throw new IllegalArgumentException("Chords cannot nest: " + chord);
        }
    }

    private static boolean containsChord(List<Inline> inlines) {
        for (Inline inline : inlines) {
            if (inline instanceof Chord) {
                return true;
            }
            if (inline instanceof Emph && containsChord(((Emph) inline).getInlines())) {
                return true;
            }
            if (inline instanceof Strong && containsChord(((Strong) inline).getInlines())) {
                return true;
            }
        }
        return false;
    }

    public String getChord() {
        return chord;
    }

    /** Second-row chord text, or {@code null}. */
    public String getAltChord() {
        return altChord;
    }

    public int getBackticks() {
        return backticks;
    }

    public boolean isBaseline() {
        return baseline;
    }

    public List<Inline> getInlines() {
        return inlines;
    }

    @Override
    public InlineKind getKind() {
        return InlineKind.CHORD;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitChord(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Chord)) {
            return false;
        }
        Chord other = (Chord) obj;
        return backticks == other.backticks
                && baseline == other.baseline
                && chord.equals(other.chord)
                && Objects.equals(altChord, other.altChord)
                && inlines.equals(other.inlines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chord, altChord, backticks, baseline, inlines);
    }

    @Override
    public String toString() {
        return "Chord[" + chord + (altChord != null ? "|" + altChord : "") + "]" + inlines;
    }
}
