package com.chordbook.ast;

/** Inline variants with the tag names renderers dispatch on. */
public enum InlineKind {
    TEXT("i-text"),
    CHORD("i-chord"),
    BREAK("i-break"),
    EMPH("i-emph"),
    STRONG("i-strong"),
    LINK("i-link"),
    IMAGE("i-image"),
    CHORUS_REF("i-chorus-ref"),
    TAG("i-tag");

    private final String tag;

    InlineKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
