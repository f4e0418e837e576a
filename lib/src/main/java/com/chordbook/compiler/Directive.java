package com.chordbook.compiler;

import com.chordbook.ast.SourceLocation;
import com.chordbook.music.Notation;
import com.chordbook.music.UnsupportedNotationException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One control line. {@code !+N}, {@code !-N} and {@code !0} set a transposition offset,
 * {@code !name} selects a notation; a doubled {@code !!} addresses the secondary chord row.
 */
public final class Directive {
    private static final Pattern DIRECTIVE = Pattern.compile("^(!{1,2})(?:([+-]\\d{1,3}|0)|([A-Za-z]+))$");

    public enum Row {
        PRIMARY,
        SECONDARY
    }

    private final Row row;
    private final Integer offset;
    private final Notation notation;
    private final SourceLocation location;

    private Directive(Row row, Integer offset, Notation notation, SourceLocation location) {
        this.row = row;
        this.offset = offset;
        this.notation = notation;
        this.location = location;
    }

    /** Lines starting with {@code !} are directives, except images ({@code ![}). */
    public static boolean isDirectiveLine(String line) {
        String text = line.strip();
        return text.startsWith("!") && !text.startsWith("![");
    }

    public static Directive parse(String line, SourceLocation location)
            throws SongSyntaxException, UnsupportedNotationException {
        Objects.requireNonNull(location, "location");
        Matcher matcher = DIRECTIVE.matcher(line.strip());
        if (!matcher.matches()) {
            throw new SongSyntaxException(location, "a directive such as !+2, !0, !german or !!-3");
        }
        Row row = matcher.group(1).length() == 2 ? Row.SECONDARY : Row.PRIMARY;
        if (matcher.group(2) != null) {
            int value = Integer.parseInt(matcher.group(2));
            return new Directive(row, Math.floorMod(value, 12), null, location);
        }
        return new Directive(row, null, Notation.fromName(matcher.group(3)), location);
    }

    public Row getRow() {
        return row;
    }

    public boolean isTransposition() {
        return offset != null;
    }

    /** Offset normalized to [0, 11]; only meaningful for transpositions. */
    public int getOffset() {
        return offset == null ? 0 : offset;
    }

    /** Target notation, or {@code null} for transpositions. */
    public Notation getNotation() {
        return notation;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return (row == Row.SECONDARY ? "!!" : "!") + (offset != null ? "+" + offset : notation.getName());
    }
}
