package com.chordbook.compiler;

import com.chordbook.music.Notation;
import java.util.Objects;

/** Options the song parser needs: source notation, chorus label prefix, smart punctuation. */
public final class ParserConfig {
    private final Notation notation;
    private final String chorusLabel;
    private final boolean smartPunctuation;

    public ParserConfig(Notation notation, String chorusLabel, boolean smartPunctuation) {
        this.notation = Objects.requireNonNull(notation, "notation");
        this.chorusLabel = Objects.requireNonNull(chorusLabel, "chorusLabel");
        this.smartPunctuation = smartPunctuation;
    }

    public static ParserConfig defaults() {
        return new ParserConfig(Notation.ENGLISH, BookConfig.DEFAULT_CHORUS_LABEL, true);
    }

    /** Notation chords are written in, and the initial output notation of every song. */
    public Notation getNotation() {
        return notation;
    }

    public String getChorusLabel() {
        return chorusLabel;
    }

    public boolean isSmartPunctuation() {
        return smartPunctuation;
    }
}
