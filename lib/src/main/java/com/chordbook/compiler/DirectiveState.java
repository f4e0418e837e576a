package com.chordbook.compiler;

import com.chordbook.music.ChordSymbol;
import com.chordbook.music.ChordSyntaxException;
import com.chordbook.music.Notation;
import java.util.Objects;

/**
 * Transposition and notation settings in force at the current point of one song. A fresh
 * instance is created per song; it is never shared between parses.
 */
public final class DirectiveState {
    private final Notation sourceNotation;
    private int primaryOffset;
    private Notation primaryNotation;
    private boolean secondaryEnabled;
    private int secondaryOffset;
    private Notation secondaryNotation;

    public DirectiveState(Notation sourceNotation) {
        this.sourceNotation = Objects.requireNonNull(sourceNotation, "sourceNotation");
        this.primaryNotation = sourceNotation;
        this.secondaryNotation = sourceNotation;
    }

    public void apply(Directive directive) {
        if (directive.getRow() == Directive.Row.PRIMARY) {
            if (directive.isTransposition()) {
                primaryOffset = directive.getOffset();
            } else {
                primaryNotation = directive.getNotation();
            }
            return;
        }
        secondaryEnabled = true;
        if (directive.isTransposition()) {
            secondaryOffset = directive.getOffset();
        } else {
            secondaryNotation = directive.getNotation();
        }
    }

    /** Parses source chord text in the book notation. */
    public ChordSymbol parseChord(String text) throws ChordSyntaxException {
        return ChordSymbol.parse(text, sourceNotation);
    }

    public String resolvePrimary(ChordSymbol chord) {
        return render(chord, primaryOffset, primaryNotation);
    }

    /** Secondary-row text, or {@code null} while the secondary row is disabled. */
    public String resolveAlt(ChordSymbol chord) {
        if (!secondaryEnabled) {
            return null;
        }
        return render(chord, secondaryOffset, secondaryNotation);
    }

    private static String render(ChordSymbol chord, int offset, Notation notation) {
        return chord.transpose(offset).convert(notation).format();
    }

    public Notation getSourceNotation() {
        return sourceNotation;
    }

    public int getPrimaryOffset() {
        return primaryOffset;
    }

    public Notation getPrimaryNotation() {
        return primaryNotation;
    }

    public boolean isSecondaryEnabled() {
        return secondaryEnabled;
    }

    public int getSecondaryOffset() {
        return secondaryOffset;
    }

    public Notation getSecondaryNotation() {
        return secondaryNotation;
    }
}
