package com.chordbook.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.chordbook.ast.Break;
import com.chordbook.ast.Chord;
import com.chordbook.ast.ChorusRef;
import com.chordbook.ast.Emph;
import com.chordbook.ast.Image;
import com.chordbook.ast.Inline;
import com.chordbook.ast.Link;
import com.chordbook.ast.SourceLocation;
import com.chordbook.ast.Strong;
import com.chordbook.ast.Tag;
import com.chordbook.ast.Text;
import com.chordbook.music.ChordSyntaxException;
import com.chordbook.music.Notation;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InlineParserTest {
    private static final SourceLocation LINE = new SourceLocation("song.md", 3, 1);

    private final InlineParser parser = new InlineParser(new ParserConfig(Notation.ENGLISH, "Ch", false));

    @Test
    void plainTextIsOneTextInline() throws Exception {
        assertEquals(List.of(new Text("Hello world")), parse("Hello world"));
    }

    @Test
    void chordLyricsRunToTheNextChord() throws Exception {
        assertEquals(
                List.of(chord("G", List.of(new Text("Hello "))), chord("C", List.of(new Text("world")))),
                parse("`G`Hello `C`world"));
    }

    @Test
    void whitespaceOnlyLyricsMakeABaselineChord() throws Exception {
        assertEquals(
                List.of(
                        new Chord("G", null, 1, true, List.of()),
                        new Text(" "),
                        chord("C", List.of(new Text("la")))),
                parse("`G` `C`la"));
        assertEquals(
                List.of(new Text("la "), new Chord("G", null, 1, true, List.of())), parse("la `G`"));
    }

    @Test
    void breaksAndTagsAfterAChordLeaveItOnTheBaseline() throws Exception {
        assertEquals(
                List.of(new Text("la "), new Chord("G", null, 1, true, List.of()), Break.INSTANCE),
                parse("la `G`<br>"));
        assertEquals(
                List.of(new Chord("G", null, 1, true, List.of()), new Text(" "), new Tag("/span", Map.of())),
                parse("`G` </span>"));
        assertEquals(
                List.of(new Chord("G", null, 1, true, List.of()), new ChorusRef(2, true)), parse("`G` >>"));
    }

    @Test
    void doubledDelimiterSetsChordStyle() throws Exception {
        assertEquals(List.of(new Chord("C7", null, 2, false, List.of(new Text("x")))), parse("``C7``x"));
    }

    @Test
    void threeBackticksAreASyntaxError() {
        assertThrows(SongSyntaxException.class, () -> parse("```C```x"));
    }

    @Test
    void unterminatedChordReportsItsOpeningColumn() {
        SongSyntaxException ex = assertThrows(SongSyntaxException.class, () -> parse("la `G la"));
        assertEquals(new SourceLocation("song.md", 3, 4), ex.getLocation());
        assertEquals(Diagnostic.Kind.SYNTAX_ERROR, ex.getKind());
    }

    @Test
    void unparsableChordKeepsTheChordError() {
        SongSyntaxException ex = assertThrows(SongSyntaxException.class, () -> parse("`Xm`la"));
        assertInstanceOf(ChordSyntaxException.class, ex.getCause());
    }

    @Test
    void emphasisAndStrong() throws Exception {
        assertEquals(
                List.of(new Emph(List.of(new Text("soft"))), new Text(" "), new Strong(List.of(new Text("loud")))),
                parse("*soft* **loud**"));
    }

    @Test
    void unmatchedMarkersStayLiteral() throws Exception {
        assertEquals(List.of(new Text("2 * 3")), parse("2 * 3"));
        assertEquals(List.of(new Text("a *b")), parse("a *b"));
        assertEquals(List.of(new Text("snake_case_name")), parse("snake_case_name"));
    }

    @Test
    void chordLyricsStopAtTheEnclosingCloser() throws Exception {
        assertEquals(
                List.of(new Emph(List.of(chord("G", List.of(new Text("la"))))), new Text(" ok")),
                parse("*`G`la* ok"));
    }

    @Test
    void chordInsideLyricMarkupIsANestingError() {
        NestedChordException ex = assertThrows(NestedChordException.class, () -> parse("`G`*la `C`x*"));
        assertEquals(Diagnostic.Kind.NESTED_CHORD, ex.getKind());
    }

    @Test
    void linksCarryUrlTitleAndPlainText() throws Exception {
        assertEquals(
                List.of(new Link("http://x.org", "Home page", "home")),
                parse("[home](http://x.org \"Home page\")"));
        assertEquals(List.of(new Text("see "), new Link("a.html", null, "bold")), parse("see [*bold*](a.html)"));
    }

    @Test
    void bracketsInsideALinkCaption() throws Exception {
        assertEquals(List.of(new Link("http://x", null, "a [b] c")), parse("[a [b] c](http://x)"));
    }

    @Test
    void bracketsWithoutDestinationStayLiteral() throws Exception {
        assertEquals(List.of(new Text("[Chorus] x")), parse("[Chorus] x"));
    }

    @Test
    void unterminatedLinkDestinationIsASyntaxError() {
        assertThrows(SongSyntaxException.class, () -> parse("[a](b"));
        assertThrows(SongSyntaxException.class, () -> parse("[a]()"));
    }

    @Test
    void imagesFromMarkdownAndTags() throws Exception {
        assertEquals(List.of(new Image("img/a.png", 0, 0, "wide")), parse("![cover](img/a.png \"wide\")"));
        assertEquals(
                List.of(new Image("a.png", 20, 10, null)), parse("<img src=\"a.png\" width=\"20\" height=\"10\">"));
    }

    @Test
    void brTagIsABreak() throws Exception {
        List<Inline> inlines = parse("a<br>b");

        assertEquals(3, inlines.size());
        assertEquals(new Text("a"), inlines.get(0));
        assertInstanceOf(Break.class, inlines.get(1));
        assertEquals(new Text("b"), inlines.get(2));
    }

    @Test
    void otherTagsPassThrough() throws Exception {
        assertEquals(
                List.of(new Tag("span", Map.of("class", "x")), new Text("a"), new Tag("/span", Map.of())),
                parse("<span class=\"x\">a</span>"));
    }

    @Test
    void standaloneMarksAreChorusReferences() throws Exception {
        assertEquals(List.of(new Text("Repeat"), new ChorusRef(2, true)), parse("Repeat >>"));
        assertEquals(List.of(new ChorusRef(1, false)), parse(">"));
        assertEquals(List.of(new Text("a>b")), parse("a>b"));
        assertEquals(List.of(new Text(">>>> x")), parse(">>>> x"));
    }

    @Test
    void escapesProduceTheEscapedCharacter() throws Exception {
        assertEquals(List.of(new Text("*not emph*")), parse("\\*not emph\\*"));
    }

    @Test
    void smartPunctuationWhenEnabled() throws Exception {
        InlineParser smart = new InlineParser(ParserConfig.defaults());
        List<Inline> inlines =
                smart.parseLine("Don't stop -- \"go\"...", new DirectiveState(Notation.ENGLISH), LINE);

        assertEquals(List.of(new Text("Don’t stop – “go”…")), inlines);
    }

    @Test
    void apostropheAfterAChordInsideAWordCloses() throws Exception {
        InlineParser smart = new InlineParser(ParserConfig.defaults());
        DirectiveState state = new DirectiveState(Notation.ENGLISH);

        assertEquals(
                List.of(new Text("can"), chord("C", List.of(new Text("’t stop")))),
                smart.parseLine("can`C`'t stop", state, LINE));
        assertEquals(
                List.of(new Text("so "), chord("C", List.of(new Text("‘tis")))),
                smart.parseLine("so `C`'tis", state, LINE));
        assertEquals(
                List.of(chord("G", List.of(new Text("la "))), chord("C", List.of(new Text("‘tis")))),
                smart.parseLine("`G`la `C`'tis", state, LINE));
    }

    @Test
    void chordsFollowTheDirectiveState() throws Exception {
        DirectiveState state = new DirectiveState(Notation.ENGLISH);
        state.apply(Directive.parse("!+2", LINE));
        state.apply(Directive.parse("!!german", LINE));
        state.apply(Directive.parse("!!+1", LINE));

        List<Inline> inlines = parser.parseLine("`C`la", state, LINE);

        assertEquals(List.of(new Chord("D", "Cis", 1, false, List.of(new Text("la")))), inlines);
    }

    private List<Inline> parse(String line) throws SongSyntaxException {
        return parser.parseLine(line, new DirectiveState(Notation.ENGLISH), LINE);
    }

    private static Chord chord(String name, List<Inline> lyrics) {
        return new Chord(name, null, 1, false, lyrics);
    }
}
