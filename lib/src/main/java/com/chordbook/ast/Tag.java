package com.chordbook.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An inline HTML-style tag passed through to the renderer. Closing tags carry a name starting
 * with {@code '/'}. Attribute order follows the source.
 */
public final class Tag implements Inline {
    private final String name;
    private final Map<String, String> attributes;

    public Tag(String name, Map<String, String> attributes) {
        this.name = Objects.requireNonNull(name, "name");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String getName() {
        return name;
    }

    public boolean isClosing() {
        return name.startsWith("/");
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public InlineKind getKind() {
        return InlineKind.TAG;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitTag(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Tag)) {
            return false;
        }
        Tag other = (Tag) obj;
        return name.equals(other.name) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes);
    }

    @Override
    public String toString() {
        return "Tag[" + name + " " + attributes + "]";
    }
}
