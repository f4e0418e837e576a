package com.chordbook.ast;

import java.util.List;
import java.util.Objects;

/** A flat list whose items were rendered to plain strings while parsing. */
public final class BulletList implements Block {
    private final List<String> items;
    private final SourceLocation location;

    public BulletList(List<String> items, SourceLocation location) {
        this.items = List.copyOf(items);
        this.location = Objects.requireNonNull(location, "location");
    }

    public List<String> getItems() {
        return items;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.BULLET_LIST;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitBulletList(this);
    }
}
