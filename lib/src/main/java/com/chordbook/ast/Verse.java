package com.chordbook.ast;

import java.util.List;
import java.util.Objects;

public final class Verse implements Block {
    private final List<Paragraph> paragraphs;
    private final SourceLocation location;

    public Verse(List<Paragraph> paragraphs, SourceLocation location) {
        this.paragraphs = List.copyOf(paragraphs);
        this.location = Objects.requireNonNull(location, "location");
    }

    public List<Paragraph> getParagraphs() {
        return paragraphs;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.VERSE;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitVerse(this);
    }
}
