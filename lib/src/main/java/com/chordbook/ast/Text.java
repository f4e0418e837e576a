package com.chordbook.ast;

import java.util.Objects;

public final class Text implements Inline {
    private final String text;

    public Text(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public InlineKind getKind() {
        return InlineKind.TEXT;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitText(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Text && text.equals(((Text) obj).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "Text[" + text + "]";
    }
}
