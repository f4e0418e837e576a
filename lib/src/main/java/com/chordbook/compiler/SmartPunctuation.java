package com.chordbook.compiler;

/**
 * Typographic replacements applied to lyric text: ellipses, en/em dashes and curly quotes. A
 * quote opens when it starts the text or follows whitespace or an opening bracket.
 */
final class SmartPunctuation {

    private SmartPunctuation() {}

    static String apply(String text, boolean afterWordChar) {
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (text.startsWith("...", i)) {
                sb.append('…');
                i += 3;
            } else if (text.startsWith("---", i)) {
                sb.append('—');
                i += 3;
            } else if (text.startsWith("--", i)) {
                sb.append('–');
                i += 2;
            } else if (c == '"') {
                sb.append(opens(sb, afterWordChar) ? '“' : '”');
                i++;
            } else if (c == '\'') {
                sb.append(opens(sb, afterWordChar) ? '‘' : '’');
                i++;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static boolean opens(StringBuilder done, boolean afterWordChar) {
        if (done.length() == 0) {
            return !afterWordChar;
        }
        char prev = done.charAt(done.length() - 1);
        return Character.isWhitespace(prev)
                || prev == '('
                || prev == '['
                || prev == '—'
                || prev == '–';
    }
}
