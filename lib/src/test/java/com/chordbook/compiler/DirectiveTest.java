package com.chordbook.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chordbook.ast.SourceLocation;
import com.chordbook.music.ChordSymbol;
import com.chordbook.music.Notation;
import com.chordbook.music.UnsupportedNotationException;
import org.junit.jupiter.api.Test;

class DirectiveTest {
    private static final SourceLocation LINE = SourceLocation.lineStart("song.md", 4);

    @Test
    void recognisesDirectiveLinesButNotImages() {
        assertTrue(Directive.isDirectiveLine("!+2"));
        assertTrue(Directive.isDirectiveLine("  !!german"));
        assertFalse(Directive.isDirectiveLine("![cover](a.png)"));
        assertFalse(Directive.isDirectiveLine("la la !"));
    }

    @Test
    void transpositionOffsetsAreNormalisedModuloTwelve() throws Exception {
        assertEquals(2, Directive.parse("!+2", LINE).getOffset());
        assertEquals(9, Directive.parse("!-3", LINE).getOffset());
        assertEquals(1, Directive.parse("!+13", LINE).getOffset());
        assertEquals(0, Directive.parse("!0", LINE).getOffset());
        assertEquals(Directive.Row.SECONDARY, Directive.parse("!!-1", LINE).getRow());
    }

    @Test
    void notationDirectives() throws Exception {
        Directive directive = Directive.parse("!Nashville", LINE);

        assertFalse(directive.isTransposition());
        assertEquals(Notation.NASHVILLE, directive.getNotation());
        assertEquals(Directive.Row.PRIMARY, directive.getRow());
    }

    @Test
    void malformedDirectiveIsASyntaxError() {
        SongSyntaxException ex = assertThrows(SongSyntaxException.class, () -> Directive.parse("!2", LINE));
        assertEquals(LINE, ex.getLocation());
        assertThrows(SongSyntaxException.class, () -> Directive.parse("!!!+1", LINE));
        assertThrows(SongSyntaxException.class, () -> Directive.parse("! german", LINE));
    }

    @Test
    void unknownNotationIsReportedByName() {
        UnsupportedNotationException ex =
                assertThrows(UnsupportedNotationException.class, () -> Directive.parse("!solfege", LINE));
        assertEquals("solfege", ex.getNotationName());
    }

    @Test
    void stateResolvesPrimaryAndSecondaryRows() throws Exception {
        DirectiveState state = new DirectiveState(Notation.ENGLISH);
        ChordSymbol g7 = state.parseChord("G7");

        assertEquals("G7", state.resolvePrimary(g7));
        assertNull(state.resolveAlt(g7));

        state.apply(Directive.parse("!+5", LINE));
        state.apply(Directive.parse("!!german", LINE));
        assertEquals("C7", state.resolvePrimary(g7));
        assertEquals("G7", state.resolveAlt(g7));
        assertTrue(state.isSecondaryEnabled());

        state.apply(Directive.parse("!0", LINE));
        state.apply(Directive.parse("!roman", LINE));
        assertEquals("V7", state.resolvePrimary(g7));
    }

    @Test
    void switchingToTheActiveNotationChangesNothing() throws Exception {
        DirectiveState state = new DirectiveState(Notation.GERMAN);
        ChordSymbol chord = state.parseChord("fis7/Cis");
        String before = state.resolvePrimary(chord);

        state.apply(Directive.parse("!german", LINE));

        assertEquals(before, state.resolvePrimary(chord));
        assertEquals("fis7/Cis", before);
    }
}
