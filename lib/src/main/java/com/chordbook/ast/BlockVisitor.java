package com.chordbook.ast;

public interface BlockVisitor<R> {
    R visitVerse(Verse verse);

    R visitBulletList(BulletList list);

    R visitHorizontalLine(HorizontalLine line);

    R visitPre(Pre pre);

    R visitHtmlBlock(HtmlBlock block);
}
