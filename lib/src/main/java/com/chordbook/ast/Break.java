package com.chordbook.ast;

/** Line separator inside a paragraph. Never the last inline of a paragraph. */
public final class Break implements Inline {
    public static final Break INSTANCE = new Break();

    private Break() {}

    @Override
    public InlineKind getKind() {
        return InlineKind.BREAK;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }

    @Override
    public String toString() {
        return "Break";
    }
}
