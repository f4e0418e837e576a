package com.chordbook.ast;

/** Block variants with the tag names renderers dispatch on. */
public enum BlockKind {
    VERSE("b-verse"),
    BULLET_LIST("b-bullet-list"),
    HORIZONTAL_LINE("b-horizontal-line"),
    PRE("b-pre"),
    HTML_BLOCK("b-html-block");

    private final String tag;

    BlockKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
