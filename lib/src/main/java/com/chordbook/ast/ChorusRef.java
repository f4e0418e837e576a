package com.chordbook.ast;

/** Points back to chorus {@code number} declared earlier in the same song. */
public final class ChorusRef implements Inline {
    private final int number;
    private final boolean prefixSpace;

    public ChorusRef(int number, boolean prefixSpace) {
        if (number < 1) {
            throw new IllegalArgumentException("Chorus number must be positive: " + number);
        }
        this.number = number;
        this.prefixSpace = prefixSpace;
    }

    public int getNumber() {
        return number;
    }

    /** Whether the reference was separated from preceding text by whitespace. */
    public boolean isPrefixSpace() {
        return prefixSpace;
    }

    @Override
    public InlineKind getKind() {
        return InlineKind.CHORUS_REF;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitChorusRef(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ChorusRef)) {
            return false;
        }
        ChorusRef other = (ChorusRef) obj;
        return number == other.number && prefixSpace == other.prefixSpace;
    }

    @Override
    public int hashCode() {
        return 31 * number + (prefixSpace ? 1 : 0);
    }

    @Override
    public String toString() {
        return "ChorusRef[" + number + "]";
    }
}
