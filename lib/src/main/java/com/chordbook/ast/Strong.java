package com.chordbook.ast;

import java.util.List;

public final class Strong implements Inline {
    private final List<Inline> inlines;

    public Strong(List<Inline> inlines) {
        this.inlines = List.copyOf(inlines);
    }

    public List<Inline> getInlines() {
        return inlines;
    }

    @Override
    public InlineKind getKind() {
        return InlineKind.STRONG;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitStrong(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Strong && inlines.equals(((Strong) obj).inlines);
    }

    @Override
    public int hashCode() {
        return 31 * inlines.hashCode() + 2;
    }

    @Override
    public String toString() {
        return "Strong" + inlines;
    }
}
