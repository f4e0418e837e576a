package com.chordbook.ast;

public sealed interface Inline
        permits Text, Chord, Break, Emph, Strong, Link, Image, ChorusRef, Tag {

    InlineKind getKind();

    <R> R accept(InlineVisitor<R> visitor);
}
