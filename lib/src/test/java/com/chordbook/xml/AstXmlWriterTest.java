package com.chordbook.xml;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chordbook.ast.Book;
import com.chordbook.ast.Break;
import com.chordbook.ast.BulletList;
import com.chordbook.ast.Chord;
import com.chordbook.ast.ChorusRef;
import com.chordbook.ast.HorizontalLine;
import com.chordbook.ast.Image;
import com.chordbook.ast.Paragraph;
import com.chordbook.ast.Pre;
import com.chordbook.ast.Song;
import com.chordbook.ast.SourceLocation;
import com.chordbook.ast.Tag;
import com.chordbook.ast.Text;
import com.chordbook.ast.Verse;
import com.chordbook.ast.VerseLabel;
import com.chordbook.music.Notation;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AstXmlWriterTest {
    private static final SourceLocation AT = SourceLocation.lineStart("s.md", 2);

    @Test
    void writesBookMetadataAndVersion() throws Exception {
        Book book = new Book("Rock & Roll", "Vol. 2", null, null, "Ch", Notation.GERMAN, List.of());

        String xml = AstXmlWriter.toXml(book);

        assertTrue(xml.contains("<book ast-version=\"1.2.0\">"), xml);
        assertTrue(xml.contains("<title>Rock &amp; Roll</title>"), xml);
        assertTrue(xml.contains("<subtitle>Vol. 2</subtitle>"), xml);
        assertTrue(xml.contains("<notation>german</notation>"), xml);
        assertFalse(xml.contains("front-img"), xml);
    }

    @Test
    void writesBlocksAndInlines() throws Exception {
        Paragraph chorus =
                new Paragraph(
                        VerseLabel.chorus(1),
                        List.of(
                                new Chord("G", "H", 1, false, List.of(new Text("Hal"))),
                                Break.INSTANCE,
                                new Chord("D", null, 2, true, List.of()),
                                new ChorusRef(1, true)),
                        AT);
        Paragraph bridge =
                new Paragraph(
                        VerseLabel.custom("Bridge"),
                        List.of(
                                new Image("a.png", 10, 20, "wide"),
                                new Tag("span", Map.of("class", "x"))),
                        AT);
        Song song =
                new Song(
                        "First",
                        List.of("trad."),
                        List.of(
                                new Verse(List.of(chorus, bridge), AT),
                                new BulletList(List.of("one"), AT),
                                new HorizontalLine(AT),
                                new Pre("a < b", AT)),
                        AT);
        Book book = new Book("Songs", null, null, null, "Ch", Notation.ENGLISH, List.of(song));

        String xml = AstXmlWriter.toXml(book);

        assertTrue(xml.contains("<subtitles><subtitle>trad.</subtitle></subtitles>"), xml);
        assertTrue(xml.contains("<b-verse><paragraph label=\"chorus\" num=\"1\">"), xml);
        assertTrue(
                xml.contains(
                        "<i-chord chord=\"G\" alt-chord=\"H\" backticks=\"1\" baseline=\"false\">"
                                + "<i-text>Hal</i-text></i-chord><i-break/>"),
                xml);
        assertTrue(xml.contains("<i-chord chord=\"D\" backticks=\"2\" baseline=\"true\"></i-chord>"), xml);
        assertTrue(xml.contains("<i-chorus-ref num=\"1\" prefix-space=\"true\"/>"), xml);
        assertTrue(xml.contains("<paragraph label=\"custom\" text=\"Bridge\">"), xml);
        assertTrue(xml.contains("<i-image path=\"a.png\" width=\"10\" height=\"20\" class=\"wide\"/>"), xml);
        assertTrue(xml.contains("<i-tag name=\"span\"><attr name=\"class\">x</attr></i-tag>"), xml);
        assertTrue(xml.contains("<b-bullet-list><item>one</item></b-bullet-list>"), xml);
        assertTrue(xml.contains("<b-horizontal-line/>"), xml);
        assertTrue(xml.contains("<b-pre>a &lt; b</b-pre>"), xml);
    }
}
