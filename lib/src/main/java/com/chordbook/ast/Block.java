package com.chordbook.ast;

public sealed interface Block permits Verse, BulletList, HorizontalLine, Pre, HtmlBlock {

    BlockKind getKind();

    SourceLocation getLocation();

    <R> R accept(BlockVisitor<R> visitor);
}
