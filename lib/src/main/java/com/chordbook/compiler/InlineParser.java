package com.chordbook.compiler;

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
import com.chordbook.compiler.grammar.SongLexer;
import com.chordbook.music.ChordSymbol;
import com.chordbook.music.ChordSyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/**
 * Parses one line of song markup into inlines. Chords are resolved against the directive state
 * at the time the line is parsed. Instances hold only configuration and may be shared between
 * threads; every call works on its own cursor.
 */
public final class InlineParser {
    private static final Pattern TAG =
            Pattern.compile("^<(/?)([a-zA-Z][a-zA-Z0-9-]*)(.*?)/?>$", Pattern.DOTALL);
    private static final Pattern TAG_ATTRIBUTE =
            Pattern.compile(
                    "([a-zA-Z_:][a-zA-Z0-9_:.\\-]*)(?:\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^\\s\"'=<>`/]+))?");
    private static final Pattern DESTINATION = Pattern.compile("^(\\S+)(?:\\s+\"([^\"]*)\")?$");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,6}");

    private final ParserConfig config;

    public InlineParser(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Parses {@code text}, a single source line without its terminator.
     *
     * @param location position of the first character of {@code text}
     * @throws SongSyntaxException on an unterminated chord or link destination, a chord
     *     delimiter of three or more backticks, an unparsable chord or a chord nested in lyrics
     */
    public List<Inline> parseLine(String text, DirectiveState state, SourceLocation location)
            throws SongSyntaxException {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(location, "location");
        List<Token> tokens = tokenize(text, location);
        Cursor cursor = new Cursor(tokens, state, location);
        Sequence sequence = cursor.parseSequence(null, null, false, false, false);
        return sequence.inlines;
    }

    private static List<Token> tokenize(String text, SourceLocation location) throws SongSyntaxException {
        SongLexer lexer = new SongLexer(CharStreams.fromString(text, location.getSourceName()));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
        CommonTokenStream stream = new CommonTokenStream(lexer);
        try {
            stream.fill();
        } catch (ThrowingErrorListener.ColumnCancellationException ex) {
            throw new SongSyntaxException(
                    location.shift(ex.getCharPositionInLine()), "valid song markup", ex);
        }
        List<Token> tokens = new ArrayList<>();
        for (Token token : stream.getTokens()) {
            if (token.getType() != Token.EOF) {
                tokens.add(token);
            }
        }
        if (DebugFlags.isTokenDebugEnabled()) {
            DebugFlags.logTokens(tokens, location);
        }
        return tokens;
    }

    private static final class Sequence {
        private final List<Inline> inlines;
        private final boolean closed;

        Sequence(List<Inline> inlines, boolean closed) {
            this.inlines = inlines;
            this.closed = closed;
        }
    }

    /** Collects text between non-text inlines; smart punctuation is applied when text settles. */
    private final class TextBuffer {
        private final List<Inline> out = new ArrayList<>();
        private final StringBuilder settled = new StringBuilder();
        private final StringBuilder pending = new StringBuilder();
        /** Whether the text this buffer continues ended inside a word. */
        private final boolean continuesWord;

        TextBuffer(boolean continuesWord) {
            this.continuesWord = continuesWord;
        }

        void text(String value) {
            pending.append(value);
        }

        void literal(String value) {
            settle();
            settled.append(value);
        }

        void add(Inline inline) {
            flush();
            out.add(inline);
        }

        void stripTrailingWhitespace() {
            settle();
            int end = settled.length();
            while (end > 0 && Character.isWhitespace(settled.charAt(end - 1))) {
                end--;
            }
            settled.setLength(end);
        }

        List<Inline> finish() {
            flush();
            return out;
        }

        /** True when the text collected so far ends inside a word. */
        boolean endsInWord() {
            settle();
            return afterWordChar();
        }

        private void settle() {
            if (pending.length() == 0) {
                return;
            }
            String value = pending.toString();
            pending.setLength(0);
            settled.append(config.isSmartPunctuation() ? SmartPunctuation.apply(value, afterWordChar()) : value);
        }

        private boolean afterWordChar() {
            if (settled.length() > 0) {
                return insideWord(settled.charAt(settled.length() - 1));
            }
            if (out.isEmpty()) {
                return continuesWord;
            }
            Inline last = out.get(out.size() - 1);
            if (last instanceof Chord && !((Chord) last).getInlines().isEmpty()) {
                List<Inline> lyric = ((Chord) last).getInlines();
                last = lyric.get(lyric.size() - 1);
            }
            if (last instanceof Text) {
                String text = ((Text) last).getText();
                return !text.isEmpty() && insideWord(text.charAt(text.length() - 1));
            }
            return !(last instanceof Break);
        }

        private void flush() {
            settle();
            if (settled.length() > 0) {
                out.add(new Text(settled.toString()));
                settled.setLength(0);
            }
        }
    }

    private final class Cursor {
        private final List<Token> tokens;
        private final DirectiveState state;
        private final SourceLocation location;
        private int pos;

        Cursor(List<Token> tokens, DirectiveState state, SourceLocation location) {
            this.tokens = tokens;
            this.state = state;
            this.location = location;
        }

        /**
         * Parses until {@code closer} (consumed), {@code stopAt} (left in place) or end of line.
         * Inside chord lyrics a further chord span ends the lyrics when {@code stopAtChord}, and
         * is a nesting error otherwise. {@code continuesWord} tells smart quotes that the
         * sequence starts in the middle of a word.
         */
        Sequence parseSequence(
                Token closer, Token stopAt, boolean inChord, boolean stopAtChord, boolean continuesWord)
                throws SongSyntaxException {
            TextBuffer buffer = new TextBuffer(continuesWord);
            while (pos < tokens.size()) {
                Token token = tokens.get(pos);
                if (closer != null && closes(closer, pos)) {
                    pos++;
                    return new Sequence(buffer.finish(), true);
                }
                if (stopAt != null && closes(stopAt, pos)) {
                    return new Sequence(buffer.finish(), false);
                }
                switch (token.getType()) {
                    case SongLexer.BACKTICKS:
                        if (stopAtChord) {
                            return new Sequence(buffer.finish(), false);
                        }
                        if (inChord) {
                            throw new NestedChordException(locationOf(token));
                        }
                        parseChord(buffer, closer != null ? closer : stopAt);
                        break;
                    case SongLexer.STRONG:
                    case SongLexer.EMPH:
                        parseEmphasis(buffer, token, inChord);
                        break;
                    case SongLexer.LBRACKET:
                        parseLink(buffer, token, inChord);
                        break;
                    case SongLexer.IMAGE_OPEN:
                        parseImage(buffer, token);
                        break;
                    case SongLexer.CHORUS_MARK:
                        parseChorusMark(buffer, token);
                        break;
                    case SongLexer.TAG:
                        buffer.add(toInline(token));
                        pos++;
                        break;
                    case SongLexer.ESCAPE:
                        buffer.literal(token.getText().substring(1));
                        pos++;
                        break;
                    case SongLexer.NEWLINE:
                        buffer.add(Break.INSTANCE);
                        pos++;
                        break;
                    default:
                        buffer.text(token.getText());
                        pos++;
                        break;
                }
            }
            return new Sequence(buffer.finish(), false);
        }

        private void parseChord(TextBuffer buffer, Token enclosingCloser) throws SongSyntaxException {
            Token opener = tokens.get(pos);
            int backticks = opener.getText().length();
            if (backticks > 2) {
                throw new SongSyntaxException(locationOf(opener), "a chord delimited by one or two backticks");
            }
            StringBuilder raw = new StringBuilder();
            int end = pos + 1;
            while (end < tokens.size() && !sameDelimiter(opener, tokens.get(end))) {
                raw.append(tokens.get(end).getText());
                end++;
            }
            if (end >= tokens.size()) {
                throw new SongSyntaxException(locationOf(opener), "closing " + opener.getText() + " after the chord");
            }
            ChordSymbol symbol;
            try {
                symbol = state.parseChord(raw.toString());
            } catch (ChordSyntaxException ex) {
                throw new SongSyntaxException(locationOf(opener), "a chord", ex);
            }
            String primary = state.resolvePrimary(symbol);
            String alt = state.resolveAlt(symbol);
            pos = end + 1;

            Sequence lyrics = parseSequence(null, enclosingCloser, true, true, buffer.endsInWord());
            if (hasLyricText(lyrics.inlines)) {
                buffer.add(new Chord(primary, alt, backticks, false, lyrics.inlines));
                return;
            }
            buffer.add(new Chord(primary, alt, backticks, true, List.of()));
            for (Inline inline : lyrics.inlines) {
                if (inline instanceof Text) {
                    buffer.literal(((Text) inline).getText());
                } else {
                    buffer.add(inline);
                }
            }
        }

        private void parseEmphasis(TextBuffer buffer, Token opener, boolean inChord)
                throws SongSyntaxException {
            int start = pos;
            if (!canOpen(start) || !hasCloserAhead(start)) {
                buffer.text(opener.getText());
                pos++;
                return;
            }
            pos++;
            Sequence inner = parseSequence(opener, null, inChord, false, false);
            if (!inner.closed || inner.inlines.isEmpty()) {
                pos = start + 1;
                buffer.text(opener.getText());
                return;
            }
            if (opener.getType() == SongLexer.STRONG) {
                buffer.add(new Strong(inner.inlines));
            } else {
                buffer.add(new Emph(inner.inlines));
            }
        }

        private void parseLink(TextBuffer buffer, Token opener, boolean inChord) throws SongSyntaxException {
            int start = pos;
            int close = matchingBracket(start);
            if (close < 0 || close + 1 >= tokens.size() || tokens.get(close + 1).getType() != SongLexer.LPAREN) {
                buffer.text(opener.getText());
                pos++;
                return;
            }
            pos++;
            Sequence caption = parseSequence(tokens.get(close), null, inChord, false, false);
            if (!caption.closed || pos >= tokens.size() || tokens.get(pos).getType() != SongLexer.LPAREN) {
                pos = start + 1;
                buffer.text(opener.getText());
                return;
            }
            String[] destination = readDestination();
            String text = PlainTextRenderer.render(caption.inlines, config.getChorusLabel());
            buffer.add(new Link(destination[0], destination[1], text));
        }

        private void parseImage(TextBuffer buffer, Token opener) throws SongSyntaxException {
            int close = pos + 1;
            while (close < tokens.size() && tokens.get(close).getType() != SongLexer.RBRACKET) {
                close++;
            }
            if (close + 1 >= tokens.size() || tokens.get(close + 1).getType() != SongLexer.LPAREN) {
                buffer.text(opener.getText());
                pos++;
                return;
            }
            pos = close + 1;
            String[] destination = readDestination();
            buffer.add(new Image(destination[0], 0, 0, destination[1]));
        }

        /** Reads {@code (url "title")} starting at the opening parenthesis. */
        private String[] readDestination() throws SongSyntaxException {
            Token open = tokens.get(pos);
            StringBuilder raw = new StringBuilder();
            int depth = 0;
            int index = pos + 1;
            for (; index < tokens.size(); index++) {
                Token token = tokens.get(index);
                if (token.getType() == SongLexer.RPAREN) {
                    if (depth == 0) {
                        break;
                    }
                    depth--;
                } else if (token.getType() == SongLexer.LPAREN) {
                    depth++;
                }
                raw.append(token.getType() == SongLexer.ESCAPE ? token.getText().substring(1) : token.getText());
            }
            if (index >= tokens.size()) {
                throw new SongSyntaxException(locationOf(open), "')' closing the link destination");
            }
            String destination = raw.toString().strip();
            if (destination.isEmpty()) {
                throw new SongSyntaxException(locationOf(open), "a link destination");
            }
            Matcher matcher = DESTINATION.matcher(destination);
            if (!matcher.matches()) {
                throw new SongSyntaxException(locationOf(open), "a destination without spaces and an optional \"title\"");
            }
            pos = index + 1;
            return new String[] {matcher.group(1), matcher.group(2)};
        }

        private void parseChorusMark(TextBuffer buffer, Token mark) {
            boolean prefixSpace = pos > 0 && tokens.get(pos - 1).getType() == SongLexer.WS;
            boolean standalone =
                    (pos == 0 || prefixSpace)
                            && (pos + 1 >= tokens.size() || tokens.get(pos + 1).getType() == SongLexer.WS)
                            && mark.getText().length() <= 3;
            pos++;
            if (!standalone) {
                buffer.text(mark.getText());
                return;
            }
            if (prefixSpace) {
                buffer.stripTrailingWhitespace();
            }
            buffer.add(new ChorusRef(mark.getText().length(), prefixSpace));
        }

        private Inline toInline(Token token) {
            Matcher matcher = TAG.matcher(token.getText());
            if (!matcher.matches()) {
                return new Text(token.getText());
            }
            boolean closing = !matcher.group(1).isEmpty();
            String name = matcher.group(2).toLowerCase(Locale.ROOT);
            Map<String, String> attributes = new LinkedHashMap<>();
            Matcher attribute = TAG_ATTRIBUTE.matcher(matcher.group(3));
            while (attribute.find()) {
                attributes.put(attribute.group(1).toLowerCase(Locale.ROOT), unquote(attribute.group(2)));
            }
            if (!closing && name.equals("br")) {
                return Break.INSTANCE;
            }
            if (!closing && name.equals("img") && attributes.containsKey("src")) {
                return new Image(
                        attributes.get("src"),
                        dimension(attributes.get("width")),
                        dimension(attributes.get("height")),
                        attributes.get("class"));
            }
            return new Tag(closing ? "/" + name : name, attributes);
        }

        private boolean closes(Token closer, int index) {
            Token token = tokens.get(index);
            if (token.getType() != closer.getType() || !token.getText().equals(closer.getText())) {
                return false;
            }
            if (token.getType() == SongLexer.RBRACKET) {
                return token.getTokenIndex() == closer.getTokenIndex();
            }
            if (token.getType() == SongLexer.STRONG || token.getType() == SongLexer.EMPH) {
                return canClose(index);
            }
            return true;
        }

        private boolean canOpen(int index) {
            Token next = index + 1 < tokens.size() ? tokens.get(index + 1) : null;
            if (next == null || next.getType() == SongLexer.WS) {
                return false;
            }
            if (isUnderscore(tokens.get(index))) {
                return index == 0 || !endsWithWordChar(tokens.get(index - 1));
            }
            return true;
        }

        private boolean canClose(int index) {
            if (index == 0 || tokens.get(index - 1).getType() == SongLexer.WS) {
                return false;
            }
            if (isUnderscore(tokens.get(index))) {
                return index + 1 >= tokens.size() || !startsWithWordChar(tokens.get(index + 1));
            }
            return true;
        }

        private boolean hasCloserAhead(int index) {
            Token opener = tokens.get(index);
            for (int i = index + 2; i < tokens.size(); i++) {
                if (closes(opener, i)) {
                    return true;
                }
            }
            return false;
        }

        private int matchingBracket(int index) {
            int depth = 0;
            for (int i = index; i < tokens.size(); i++) {
                int type = tokens.get(i).getType();
                if (type == SongLexer.LBRACKET) {
                    depth++;
                } else if (type == SongLexer.RBRACKET && --depth == 0) {
                    return i;
                }
            }
            return -1;
        }

        private SourceLocation locationOf(Token token) {
            return location.shift(token.getCharPositionInLine());
        }
    }

    private static boolean insideWord(char last) {
        return !Character.isWhitespace(last) && last != '(' && last != '[';
    }

    private static boolean sameDelimiter(Token opener, Token token) {
        return token.getType() == SongLexer.BACKTICKS && token.getText().length() == opener.getText().length();
    }

    private static boolean isUnderscore(Token token) {
        return token.getText().charAt(0) == '_';
    }

    private static boolean endsWithWordChar(Token token) {
        String text = token.getText();
        return token.getType() == SongLexer.TEXT && Character.isLetterOrDigit(text.charAt(text.length() - 1));
    }

    private static boolean startsWithWordChar(Token token) {
        return token.getType() == SongLexer.TEXT && Character.isLetterOrDigit(token.getText().charAt(0));
    }

    /**
     * Whether a chord's lyric carries anything sung: non-blank text, emphasis, a link or an
     * image. Breaks, tags and chorus references alone leave the chord on the baseline.
     */
    private static boolean hasLyricText(List<Inline> inlines) {
        for (Inline inline : inlines) {
            if (inline instanceof Text) {
                if (!((Text) inline).getText().isBlank()) {
                    return true;
                }
            } else if (!(inline instanceof Break) && !(inline instanceof Tag) && !(inline instanceof ChorusRef)) {
                return true;
            }
        }
        return false;
    }

    private static String unquote(String value) {
        if (value == null) {
            return "";
        }
        if (value.length() >= 2 && (value.charAt(0) == '"' || value.charAt(0) == '\'')) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static int dimension(String value) {
        if (value == null || !DIGITS.matcher(value.strip()).matches()) {
            return 0;
        }
        return Integer.parseInt(value.strip());
    }
}
