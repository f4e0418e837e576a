package com.chordbook.ast;

import java.util.Objects;

public final class HorizontalLine implements Block {
    private final SourceLocation location;

    public HorizontalLine(SourceLocation location) {
        this.location = Objects.requireNonNull(location, "location");
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.HORIZONTAL_LINE;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitHorizontalLine(this);
    }
}
