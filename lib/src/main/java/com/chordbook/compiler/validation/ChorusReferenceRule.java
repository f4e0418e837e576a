package com.chordbook.compiler.validation;

import com.chordbook.ast.Block;
import com.chordbook.ast.Chord;
import com.chordbook.ast.ChorusRef;
import com.chordbook.ast.Emph;
import com.chordbook.ast.HtmlBlock;
import com.chordbook.ast.Inline;
import com.chordbook.ast.Paragraph;
import com.chordbook.ast.Song;
import com.chordbook.ast.SourceLocation;
import com.chordbook.ast.Strong;
import com.chordbook.ast.Verse;
import com.chordbook.ast.VerseLabel;
import com.chordbook.compiler.Diagnostic;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Every chorus reference must name a chorus declared earlier in the same song. A chorus paragraph
 * is declared only after its own content, so it cannot refer to itself.
 */
final class ChorusReferenceRule implements ValidationRule {

    @Override
    public List<Diagnostic> validate(Song song) {
        Set<Integer> declared = new HashSet<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Block block : song.getBlocks()) {
            if (block instanceof Verse) {
                for (Paragraph paragraph : ((Verse) block).getParagraphs()) {
                    check(paragraph.getInlines(), declared, paragraph.getLocation(), diagnostics);
                    if (paragraph.getLabel().getKind() == VerseLabel.Kind.CHORUS) {
                        declared.add(paragraph.getLabel().getNumber());
                    }
                }
            } else if (block instanceof HtmlBlock) {
                check(((HtmlBlock) block).getInlines(), declared, block.getLocation(), diagnostics);
            }
        }
        return diagnostics;
    }

    private static void check(
            List<Inline> inlines, Set<Integer> declared, SourceLocation location, List<Diagnostic> out) {
        for (Inline inline : inlines) {
            if (inline instanceof ChorusRef) {
                int number = ((ChorusRef) inline).getNumber();
                if (!declared.contains(number)) {
                    out.add(
                            Diagnostic.error(
                                    Diagnostic.Kind.UNKNOWN_CHORUS_REFERENCE,
                                    "Unknown chorus reference: " + number,
                                    location));
                }
            } else if (inline instanceof Chord) {
                check(((Chord) inline).getInlines(), declared, location, out);
            } else if (inline instanceof Emph) {
                check(((Emph) inline).getInlines(), declared, location, out);
            } else if (inline instanceof Strong) {
                check(((Strong) inline).getInlines(), declared, location, out);
            }
        }
    }
}
