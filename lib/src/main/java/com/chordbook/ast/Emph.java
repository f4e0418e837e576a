package com.chordbook.ast;

import java.util.List;

public final class Emph implements Inline {
    private final List<Inline> inlines;

    public Emph(List<Inline> inlines) {
        this.inlines = List.copyOf(inlines);
    }

    public List<Inline> getInlines() {
        return inlines;
    }

    @Override
    public InlineKind getKind() {
        return InlineKind.EMPH;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitEmph(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Emph && inlines.equals(((Emph) obj).inlines);
    }

    @Override
    public int hashCode() {
        return 31 * inlines.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "Emph" + inlines;
    }
}
