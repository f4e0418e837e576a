package com.chordbook.compiler;

import com.chordbook.ast.Block;
import com.chordbook.ast.Break;
import com.chordbook.ast.BulletList;
import com.chordbook.ast.HorizontalLine;
import com.chordbook.ast.HtmlBlock;
import com.chordbook.ast.Inline;
import com.chordbook.ast.Paragraph;
import com.chordbook.ast.Pre;
import com.chordbook.ast.Song;
import com.chordbook.ast.SourceLocation;
import com.chordbook.ast.Text;
import com.chordbook.ast.Verse;
import com.chordbook.ast.VerseLabel;
import com.chordbook.music.UnsupportedNotationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the lines of one song into a {@link Song}. A block that fails to parse is dropped with a
 * diagnostic and parsing resumes after it; directives inside a dropped block still take effect.
 */
final class SongParser {
    private static final Logger LOG = LoggerFactory.getLogger(SongParser.class);

    private static final Pattern SUBTITLE = Pattern.compile("^##[ \\t]+(.*?)[ \\t]*$");
    private static final Pattern HORIZONTAL_LINE = Pattern.compile("^ {0,3}([-*_])( *\\1){2,} *$");
    private static final Pattern BULLET = Pattern.compile("^ {0,3}[-*+][ \\t]+(.*)$");
    private static final Pattern VERSE_LABEL = Pattern.compile("^(\\d{1,6})\\.(?:[ \\t]+|$)");
    private static final Pattern CHORUS_MARK_LABEL = Pattern.compile("^(>+)[ \\t]+(?=\\S)");
    private static final Pattern CUSTOM_LABEL = Pattern.compile("^\\[([^\\]]+)\\](?:[ \\t]+|$)");
    private static final Pattern SINGLE_TAG = Pattern.compile("^\\s*</?[a-zA-Z][^<>]*>\\s*$");
    private static final Pattern BLOCK_TAG = Pattern.compile("^\\s*</?([a-zA-Z][a-zA-Z0-9]*)[\\s/>]");
    private static final Set<String> BLOCK_TAG_NAMES =
            Set.of(
                    "address", "article", "aside", "blockquote", "center", "details", "div", "dl",
                    "figcaption", "figure", "footer", "h1", "h2", "h3", "h4", "h5", "h6", "header",
                    "hr", "li", "nav", "ol", "p", "section", "summary", "table", "tbody", "td",
                    "tfoot", "th", "thead", "tr", "ul");

    private final ParserConfig config;
    private final InlineParser inlineParser;
    private final Pattern chorusNumberLabel;

    SongParser(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.inlineParser = new InlineParser(config);
        this.chorusNumberLabel =
                Pattern.compile("^" + Pattern.quote(config.getChorusLabel()) + "(\\d{1,6})\\.(?:[ \\t]+|$)");
    }

    ParsedSong parse(SongText text) {
        return new SongContext(text).parse();
    }

    /** Mutable state of one song's parse. */
    private final class SongContext {
        private final String sourceName;
        private final List<SourceLine> lines;
        private final DirectiveState state;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final List<String> subtitles = new ArrayList<>();
        private final List<Block> blocks = new ArrayList<>();
        /** Chorus numbers of the verses kept so far. */
        private final Set<Integer> declaredChoruses = new HashSet<>();

        SongContext(SongText text) {
            this.sourceName = text.getSourceName();
            this.lines = text.getLines();
            this.state = new DirectiveState(config.getNotation());
        }

        ParsedSong parse() {
            SourceLine titleLine = lines.get(0);
            Matcher title = SongSplitter.TITLE.matcher(titleLine.getText());
            String titleText = title.matches() && title.group(1) != null ? title.group(1) : "";
            if (titleText.isEmpty()) {
                diagnostics.add(
                        Diagnostic.error(
                                Diagnostic.Kind.SYNTAX_ERROR,
                                "Syntax error: expected a song title after '#'",
                                titleLine.location(sourceName)));
            }
            int i = 1;
            while (i < lines.size()) {
                i = parseBlock(i);
            }
            Song song = new Song(titleText, subtitles, blocks, titleLine.location(sourceName));
            LOG.debug("Parsed song '{}' with {} blocks and {} diagnostics", titleText, blocks.size(), diagnostics.size());
            return new ParsedSong(song, diagnostics);
        }

        /** Parses the block starting at line {@code i}; returns the index after it. */
        private int parseBlock(int i) {
            SourceLine line = lines.get(i);
            String text = line.getText();
            if (line.isBlank()) {
                return i + 1;
            }
            if (Directive.isDirectiveLine(text)) {
                applyDirective(line);
                return i + 1;
            }
            Matcher subtitle = SUBTITLE.matcher(text);
            if (subtitle.matches()) {
                subtitles.add(subtitle.group(1));
                return i + 1;
            }
            Fence fence = Fence.open(text);
            if (fence != null) {
                return parsePre(i, fence);
            }
            if (HORIZONTAL_LINE.matcher(text).matches()) {
                blocks.add(new HorizontalLine(line.location(sourceName)));
                return i + 1;
            }
            if (BULLET.matcher(text).matches()) {
                return parseBulletList(i);
            }
            if (startsHtmlBlock(text)) {
                return parseHtmlBlock(i);
            }
            return parseVerse(i);
        }

        private int parsePre(int start, Fence fence) {
            StringBuilder content = new StringBuilder();
            int i = start + 1;
            while (i < lines.size() && !fence.isClosedBy(lines.get(i).getText())) {
                content.append(lines.get(i).getText()).append(lines.get(i).getTerminator());
                i++;
            }
            SourceLocation location = lines.get(start).location(sourceName);
            if (i >= lines.size()) {
                diagnostics.add(
                        Diagnostic.warning(
                                Diagnostic.Kind.SYNTAX_ERROR,
                                "Unclosed code fence runs to the end of the song",
                                location));
            }
            blocks.add(new Pre(content.toString(), location));
            return Math.min(i + 1, lines.size());
        }

        private int parseBulletList(int start) {
            int end = start;
            while (end < lines.size()) {
                String text = lines.get(end).getText();
                boolean continuation = end > start && !text.isBlank() && Character.isWhitespace(text.charAt(0));
                if (BULLET.matcher(text).matches() && !HORIZONTAL_LINE.matcher(text).matches()
                        || continuation
                        || end > start && Directive.isDirectiveLine(text)) {
                    end++;
                } else {
                    break;
                }
            }
            List<String> items = new ArrayList<>();
            List<Diagnostic> references = new ArrayList<>();
            StringBuilder item = null;
            SourceLocation itemLocation = null;
            SongSyntaxException failure = null;
            for (int i = start; i < end; i++) {
                SourceLine line = lines.get(i);
                Matcher bullet = BULLET.matcher(line.getText());
                if (Directive.isDirectiveLine(line.getText()) && !bullet.matches()) {
                    applyDirective(line);
                    continue;
                }
                if (bullet.matches()) {
                    failure = renderItem(items, references, item, itemLocation, failure);
                    item = new StringBuilder(bullet.group(1).strip());
                    itemLocation = line.location(sourceName, bullet.start(1));
                } else {
                    item.append(' ').append(line.getText().strip());
                }
            }
            failure = renderItem(items, references, item, itemLocation, failure);
            if (failure != null) {
                drop("bullet list", failure);
            } else {
                blocks.add(new BulletList(items, lines.get(start).location(sourceName)));
                diagnostics.addAll(references);
            }
            return end;
        }

        /**
         * Renders one item to text. Items keep no inlines, so their chorus references are checked
         * here against the choruses declared so far.
         */
        private SongSyntaxException renderItem(
                List<String> items,
                List<Diagnostic> references,
                StringBuilder item,
                SourceLocation location,
                SongSyntaxException failure) {
            if (item == null || failure != null) {
                return failure;
            }
            try {
                List<Inline> inlines = inlineParser.parseLine(item.toString(), state, location);
                PlainTextRenderer rendered = PlainTextRenderer.of(inlines, config.getChorusLabel());
                items.add(rendered.getText());
                for (int number : rendered.getChorusReferences()) {
                    if (!declaredChoruses.contains(number)) {
                        references.add(
                                Diagnostic.error(
                                        Diagnostic.Kind.UNKNOWN_CHORUS_REFERENCE,
                                        "Unknown chorus reference: " + number,
                                        location));
                    }
                }
                return null;
            } catch (SongSyntaxException ex) {
                return ex;
            }
        }

        private int parseHtmlBlock(int start) {
            int end = start;
            while (end < lines.size() && !lines.get(end).isBlank()) {
                end++;
            }
            List<Inline> inlines = new ArrayList<>();
            SongSyntaxException failure = null;
            for (int i = start; i < end; i++) {
                SourceLine line = lines.get(i);
                if (Directive.isDirectiveLine(line.getText())) {
                    applyDirective(line);
                    continue;
                }
                if (failure != null) {
                    continue;
                }
                try {
                    if (!inlines.isEmpty()) {
                        inlines.add(new Text("\n"));
                    }
                    inlines.addAll(inlineParser.parseLine(line.getText(), state, line.location(sourceName)));
                } catch (SongSyntaxException ex) {
                    failure = ex;
                }
            }
            if (failure != null) {
                drop("HTML block", failure);
            } else {
                blocks.add(new HtmlBlock(inlines, lines.get(start).location(sourceName)));
            }
            return end;
        }

        private int parseVerse(int start) {
            int end = start + 1;
            while (end < lines.size() && !endsVerse(lines.get(end).getText())) {
                end++;
            }
            List<Paragraph> paragraphs = new ArrayList<>();
            ParagraphBuilder paragraph = null;
            SongSyntaxException failure = null;
            for (int i = start; i < end; i++) {
                SourceLine line = lines.get(i);
                if (Directive.isDirectiveLine(line.getText())) {
                    applyDirective(line);
                    continue;
                }
                if (failure != null) {
                    continue;
                }
                String text = line.getText();
                LabelMatch label = matchLabel(text);
                if (label != null || paragraph == null) {
                    if (paragraph != null) {
                        paragraphs.add(paragraph.build());
                    }
                    paragraph =
                            new ParagraphBuilder(
                                    label != null ? label.label : VerseLabel.none(), line.location(sourceName));
                }
                int contentStart = label != null ? label.contentStart : 0;
                try {
                    paragraph.addLine(
                            inlineParser.parseLine(
                                    text.substring(contentStart), state, line.location(sourceName, contentStart)));
                } catch (SongSyntaxException ex) {
                    failure = ex;
                }
            }
            if (failure != null) {
                drop("verse", failure);
                return end;
            }
            if (paragraph != null) {
                paragraphs.add(paragraph.build());
            }
            if (!paragraphs.isEmpty()) {
                blocks.add(new Verse(paragraphs, lines.get(start).location(sourceName)));
                for (Paragraph kept : paragraphs) {
                    if (kept.getLabel().getKind() == VerseLabel.Kind.CHORUS) {
                        declaredChoruses.add(kept.getLabel().getNumber());
                    }
                }
            }
            return end;
        }

        private boolean endsVerse(String text) {
            return text.isBlank()
                    || SUBTITLE.matcher(text).matches()
                    || Fence.open(text) != null
                    || HORIZONTAL_LINE.matcher(text).matches()
                    || BULLET.matcher(text).matches();
        }

        private LabelMatch matchLabel(String text) {
            Matcher verse = VERSE_LABEL.matcher(text);
            if (verse.lookingAt()) {
                return new LabelMatch(VerseLabel.verse(Integer.parseInt(verse.group(1))), verse.end());
            }
            Matcher chorusNumber = chorusNumberLabel.matcher(text);
            if (chorusNumber.lookingAt()) {
                return new LabelMatch(VerseLabel.chorus(Integer.parseInt(chorusNumber.group(1))), chorusNumber.end());
            }
            Matcher chorusMark = CHORUS_MARK_LABEL.matcher(text);
            if (chorusMark.lookingAt()) {
                return new LabelMatch(VerseLabel.chorus(chorusMark.group(1).length()), chorusMark.end());
            }
            Matcher custom = CUSTOM_LABEL.matcher(text);
            if (custom.lookingAt()) {
                return new LabelMatch(VerseLabel.custom(custom.group(1)), custom.end());
            }
            return null;
        }

        private boolean startsHtmlBlock(String text) {
            if (SINGLE_TAG.matcher(text).matches()) {
                return true;
            }
            Matcher tag = BLOCK_TAG.matcher(text);
            return tag.lookingAt() && BLOCK_TAG_NAMES.contains(tag.group(1).toLowerCase(Locale.ROOT));
        }

        private void applyDirective(SourceLine line) {
            SourceLocation location = line.location(sourceName);
            try {
                state.apply(Directive.parse(line.getText(), location));
            } catch (SongSyntaxException ex) {
                diagnostics.add(ex.toDiagnostic());
            } catch (UnsupportedNotationException ex) {
                diagnostics.add(Diagnostic.error(Diagnostic.Kind.UNSUPPORTED_NOTATION, ex.getMessage(), location));
            }
        }

        private void drop(String blockName, SongSyntaxException failure) {
            Diagnostic diagnostic = failure.toDiagnostic();
            diagnostics.add(diagnostic);
            LOG.debug("Dropped {} at {}: {}", blockName, failure.getLocation(), diagnostic.getMessage());
        }
    }

    private static final class LabelMatch {
        private final VerseLabel label;
        private final int contentStart;

        LabelMatch(VerseLabel label, int contentStart) {
            this.label = label;
            this.contentStart = contentStart;
        }
    }

    /** Joins the lines of one paragraph with breaks. */
    private static final class ParagraphBuilder {
        private final VerseLabel label;
        private final SourceLocation location;
        private final List<Inline> inlines = new ArrayList<>();

        ParagraphBuilder(VerseLabel label, SourceLocation location) {
            this.label = label;
            this.location = location;
        }

        void addLine(List<Inline> line) {
            if (line.isEmpty()) {
                return;
            }
            if (!inlines.isEmpty()) {
                inlines.add(Break.INSTANCE);
            }
            inlines.addAll(line);
        }

        Paragraph build() {
            while (!inlines.isEmpty() && inlines.get(inlines.size() - 1) instanceof Break) {
                inlines.remove(inlines.size() - 1);
            }
            return new Paragraph(label, inlines, location);
        }
    }
}
