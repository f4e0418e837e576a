package com.chordbook.ast;

import java.util.Objects;

/** Preformatted text, stored exactly as it appeared between the fences. */
public final class Pre implements Block {
    private final String text;
    private final SourceLocation location;

    public Pre(String text, SourceLocation location) {
        this.text = Objects.requireNonNull(text, "text");
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getText() {
        return text;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.PRE;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitPre(this);
    }
}
