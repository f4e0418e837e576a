package com.chordbook.ast;

import java.util.List;
import java.util.Objects;

public final class Paragraph {
    private final VerseLabel label;
    private final List<Inline> inlines;
    private final SourceLocation location;

    public Paragraph(VerseLabel label, List<Inline> inlines, SourceLocation location) {
        this.label = Objects.requireNonNull(label, "label");
        this.inlines = List.copyOf(inlines);
        this.location = Objects.requireNonNull(location, "location");
        if (!this.inlines.isEmpty() && this.inlines.get(this.inlines.size() - 1) instanceof Break) {
            throw new IllegalArgumentException("Paragraph cannot end with a line break");
        }
    }

    public VerseLabel getLabel() {
        return label;
    }

    public List<Inline> getInlines() {
        return inlines;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
