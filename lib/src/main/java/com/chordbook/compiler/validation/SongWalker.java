package com.chordbook.compiler.validation;

import com.chordbook.ast.Block;
import com.chordbook.ast.Paragraph;
import com.chordbook.ast.Song;
import com.chordbook.ast.Verse;
import java.util.ArrayList;
import java.util.List;

/** Paragraphs of a song in document order. */
final class SongWalker {

    private SongWalker() {}

    static List<Paragraph> paragraphs(Song song) {
        List<Paragraph> paragraphs = new ArrayList<>();
        for (Block block : song.getBlocks()) {
            if (block instanceof Verse) {
                paragraphs.addAll(((Verse) block).getParagraphs());
            }
        }
        return paragraphs;
    }
}
