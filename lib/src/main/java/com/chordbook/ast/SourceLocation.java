package com.chordbook.ast;

import java.util.Objects;

/** A 1-based line/column position inside a named song source. */
public final class SourceLocation implements Comparable<SourceLocation> {
    private final String sourceName;
    private final int line;
    private final int column;

    public SourceLocation(String sourceName, int line, int column) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.line = line;
        this.column = column;
    }

    public static SourceLocation lineStart(String sourceName, int line) {
        return new SourceLocation(sourceName, line, 1);
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** Same line, shifted {@code columns} to the right. */
    public SourceLocation shift(int columns) {
        return new SourceLocation(sourceName, line, column + columns);
    }

    @Override
    public int compareTo(SourceLocation other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceLocation)) {
            return false;
        }
        SourceLocation other = (SourceLocation) obj;
        return line == other.line && column == other.column && sourceName.equals(other.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, line, column);
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
