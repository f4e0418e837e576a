package com.chordbook.ast;

public interface InlineVisitor<R> {
    R visitText(Text text);

    R visitChord(Chord chord);

    R visitBreak(Break lineBreak);

    R visitEmph(Emph emph);

    R visitStrong(Strong strong);

    R visitLink(Link link);

    R visitImage(Image image);

    R visitChorusRef(ChorusRef chorusRef);

    R visitTag(Tag tag);
}
