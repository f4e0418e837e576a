package com.chordbook.compiler;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** An open code fence: three or more backticks or tildes, closed by at least as many. */
final class Fence {
    private static final Pattern OPEN = Pattern.compile("^ {0,3}(`{3,}|~{3,})(.*)$");

    private final char marker;
    private final int length;

    private Fence(char marker, int length) {
        this.marker = marker;
        this.length = length;
    }

    /** The fence opened by {@code line}, or {@code null}. */
    static Fence open(String line) {
        Matcher matcher = OPEN.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        String run = matcher.group(1);
        if (run.charAt(0) == '`' && matcher.group(2).indexOf('`') >= 0) {
            return null;
        }
        return new Fence(run.charAt(0), run.length());
    }

    boolean isClosedBy(String line) {
        int i = 0;
        while (i < line.length() && i < 3 && line.charAt(i) == ' ') {
            i++;
        }
        int run = 0;
        while (i < line.length() && line.charAt(i) == marker) {
            run++;
            i++;
        }
        return run >= length && line.substring(i).isBlank();
    }
}
