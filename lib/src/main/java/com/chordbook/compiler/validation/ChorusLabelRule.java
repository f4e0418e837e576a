package com.chordbook.compiler.validation;

import com.chordbook.ast.Paragraph;
import com.chordbook.ast.Song;
import com.chordbook.ast.VerseLabel;
import com.chordbook.compiler.Diagnostic;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Chorus numbers are unique within a song and appear in increasing order. */
final class ChorusLabelRule implements ValidationRule {

    @Override
    public List<Diagnostic> validate(Song song) {
        Set<Integer> seen = new HashSet<>();
        int previous = 0;
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Paragraph paragraph : SongWalker.paragraphs(song)) {
            VerseLabel label = paragraph.getLabel();
            if (label.getKind() != VerseLabel.Kind.CHORUS) {
                continue;
            }
            int number = label.getNumber();
            if (!seen.add(number)) {
                diagnostics.add(
                        Diagnostic.error(
                                Diagnostic.Kind.DUPLICATE_CHORUS_LABEL,
                                "Chorus " + number + " is declared more than once",
                                paragraph.getLocation()));
            } else if (number < previous) {
                diagnostics.add(
                        Diagnostic.warning(
                                Diagnostic.Kind.LABEL_ORDER,
                                "Chorus " + number + " follows chorus " + previous,
                                paragraph.getLocation()));
            }
            previous = Math.max(previous, number);
        }
        return diagnostics;
    }
}
