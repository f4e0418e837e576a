package com.chordbook.compiler.validation;

import com.chordbook.ast.Paragraph;
import com.chordbook.ast.Song;
import com.chordbook.ast.VerseLabel;
import com.chordbook.compiler.Diagnostic;
import java.util.ArrayList;
import java.util.List;

/** Verse numbers never decrease within a song. Repeating a number is allowed. */
final class VerseNumberRule implements ValidationRule {

    @Override
    public List<Diagnostic> validate(Song song) {
        int previous = 0;
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Paragraph paragraph : SongWalker.paragraphs(song)) {
            VerseLabel label = paragraph.getLabel();
            if (label.getKind() != VerseLabel.Kind.VERSE) {
                continue;
            }
            if (label.getNumber() < previous) {
                diagnostics.add(
                        Diagnostic.warning(
                                Diagnostic.Kind.LABEL_ORDER,
                                "Verse " + label.getNumber() + " follows verse " + previous,
                                paragraph.getLocation()));
            }
            previous = Math.max(previous, label.getNumber());
        }
        return diagnostics;
    }
}
