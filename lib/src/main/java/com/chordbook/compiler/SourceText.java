package com.chordbook.compiler;

import java.util.Objects;

/** One named input: the contents of a song file or any other chunk of markup. */
public final class SourceText {
    private final String name;
    private final String text;

    public SourceText(String name, String text) {
        this.name = Objects.requireNonNull(name, "name");
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return name;
    }
}
