package com.chordbook.compiler.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.chordbook.ast.Block;
import com.chordbook.ast.Chord;
import com.chordbook.ast.ChorusRef;
import com.chordbook.ast.HtmlBlock;
import com.chordbook.ast.Inline;
import com.chordbook.ast.Paragraph;
import com.chordbook.ast.Song;
import com.chordbook.ast.SourceLocation;
import com.chordbook.ast.Text;
import com.chordbook.ast.Verse;
import com.chordbook.ast.VerseLabel;
import com.chordbook.compiler.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationRunnerTest {

    @Test
    void referencesMustFollowTheirChorus() {
        Song song =
                song(
                        verse(paragraph(VerseLabel.none(), 2, new ChorusRef(1, false))),
                        verse(paragraph(VerseLabel.chorus(1), 4, new Text("la"))),
                        verse(paragraph(VerseLabel.none(), 6, new ChorusRef(1, false))));

        List<Diagnostic> diagnostics = new ChorusReferenceRule().validate(song);

        assertEquals(1, diagnostics.size());
        assertEquals(Diagnostic.Kind.UNKNOWN_CHORUS_REFERENCE, diagnostics.get(0).getKind());
        assertEquals(2, diagnostics.get(0).getLocation().getLine());
    }

    @Test
    void chorusParagraphCannotReferToItself() {
        Song song =
                song(
                        verse(paragraph(VerseLabel.chorus(1), 2, new Text("la"), new ChorusRef(1, true))),
                        verse(paragraph(VerseLabel.none(), 4, new ChorusRef(1, false))));

        List<Diagnostic> diagnostics = new ChorusReferenceRule().validate(song);

        assertEquals(1, diagnostics.size());
        assertEquals(2, diagnostics.get(0).getLocation().getLine());
    }

    @Test
    void referencesInsideChordLyricsAndHtmlBlocksAreChecked() {
        Chord chord = new Chord("G", null, 1, false, List.of(new ChorusRef(3, false)));
        Song song =
                song(
                        verse(paragraph(VerseLabel.none(), 2, chord)),
                        new HtmlBlock(List.of(new ChorusRef(4, false)), SourceLocation.lineStart("s.md", 4)));

        List<Diagnostic> diagnostics = new ChorusReferenceRule().validate(song);

        assertEquals(2, diagnostics.size());
        assertEquals("Unknown chorus reference: 3", diagnostics.get(0).getMessage());
        assertEquals("Unknown chorus reference: 4", diagnostics.get(1).getMessage());
    }

    @Test
    void duplicateAndDescendingChorusNumbers() {
        Song song =
                song(
                        verse(
                                paragraph(VerseLabel.chorus(2), 2, new Text("a")),
                                paragraph(VerseLabel.chorus(2), 3, new Text("b")),
                                paragraph(VerseLabel.chorus(1), 4, new Text("c"))));

        List<Diagnostic> diagnostics = new ChorusLabelRule().validate(song);

        assertEquals(2, diagnostics.size());
        assertEquals(Diagnostic.Kind.DUPLICATE_CHORUS_LABEL, diagnostics.get(0).getKind());
        assertEquals(Diagnostic.Level.ERROR, diagnostics.get(0).getLevel());
        assertEquals(Diagnostic.Kind.LABEL_ORDER, diagnostics.get(1).getKind());
        assertEquals(Diagnostic.Level.WARNING, diagnostics.get(1).getLevel());
    }

    @Test
    void verseNumbersMayRepeatButNotDecrease() {
        Song song =
                song(
                        verse(paragraph(VerseLabel.verse(1), 2, new Text("a"))),
                        verse(paragraph(VerseLabel.verse(1), 4, new Text("b"))),
                        verse(paragraph(VerseLabel.custom("Bridge"), 6, new Text("c"))),
                        verse(paragraph(VerseLabel.verse(3), 8, new Text("d"))),
                        verse(paragraph(VerseLabel.verse(2), 10, new Text("e"))));

        List<Diagnostic> diagnostics = new VerseNumberRule().validate(song);

        assertEquals(1, diagnostics.size());
        assertEquals(10, diagnostics.get(0).getLocation().getLine());
    }

    @Test
    void defaultRunnerAppliesEveryRule() {
        Song song =
                song(
                        verse(paragraph(VerseLabel.verse(2), 2, new ChorusRef(1, false))),
                        verse(paragraph(VerseLabel.verse(1), 4, new Text("x"))),
                        verse(paragraph(VerseLabel.chorus(1), 6, new Text("y"))),
                        verse(paragraph(VerseLabel.chorus(1), 8, new Text("z"))));

        List<Diagnostic> diagnostics = ValidationRunner.defaultRules().run(song);

        assertEquals(3, diagnostics.size());
        assertEquals(Diagnostic.Kind.UNKNOWN_CHORUS_REFERENCE, diagnostics.get(0).getKind());
        assertEquals(Diagnostic.Kind.DUPLICATE_CHORUS_LABEL, diagnostics.get(1).getKind());
        assertEquals(Diagnostic.Kind.LABEL_ORDER, diagnostics.get(2).getKind());
    }

    private static Song song(Block... blocks) {
        return new Song("S", List.of(), List.of(blocks), SourceLocation.lineStart("s.md", 1));
    }

    private static Verse verse(Paragraph... paragraphs) {
        return new Verse(List.of(paragraphs), paragraphs[0].getLocation());
    }

    private static Paragraph paragraph(VerseLabel label, int line, Inline... inlines) {
        return new Paragraph(label, new ArrayList<>(List.of(inlines)), SourceLocation.lineStart("s.md", line));
    }
}
