package com.chordbook.compiler;

import com.chordbook.ast.SourceLocation;
import java.util.ArrayList;
import java.util.List;

/** A physical source line with the terminator it ended with ({@code ""} for the last line). */
final class SourceLine {
    private final String text;
    private final String terminator;
    private final int lineNumber;

    SourceLine(String text, String terminator, int lineNumber) {
        this.text = text;
        this.terminator = terminator;
        this.lineNumber = lineNumber;
    }

    static List<SourceLine> split(String source) {
        List<SourceLine> lines = new ArrayList<>();
        int start = 0;
        int number = 1;
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                int end = i;
                if (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                    i++;
                }
                lines.add(new SourceLine(source.substring(start, end), source.substring(end, i + 1), number++));
                start = i + 1;
            }
            i++;
        }
        if (start < source.length()) {
            lines.add(new SourceLine(source.substring(start), "", number));
        }
        return lines;
    }

    String getText() {
        return text;
    }

    String getTerminator() {
        return terminator;
    }

    int getLineNumber() {
        return lineNumber;
    }

    boolean isBlank() {
        return text.isBlank();
    }

    SourceLocation location(String sourceName) {
        return SourceLocation.lineStart(sourceName, lineNumber);
    }

    SourceLocation location(String sourceName, int index) {
        return new SourceLocation(sourceName, lineNumber, index + 1);
    }

    @Override
    public String toString() {
        return lineNumber + ": " + text;
    }
}
