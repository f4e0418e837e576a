package com.chordbook.ast;

import java.util.List;
import java.util.Objects;

public final class HtmlBlock implements Block {
    private final List<Inline> inlines;
    private final SourceLocation location;

    public HtmlBlock(List<Inline> inlines, SourceLocation location) {
        this.inlines = List.copyOf(inlines);
        this.location = Objects.requireNonNull(location, "location");
    }

    public List<Inline> getInlines() {
        return inlines;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.HTML_BLOCK;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitHtmlBlock(this);
    }
}
