package com.chordbook.compiler;

import com.chordbook.ast.Break;
import com.chordbook.ast.Chord;
import com.chordbook.ast.ChorusRef;
import com.chordbook.ast.Emph;
import com.chordbook.ast.Image;
import com.chordbook.ast.Inline;
import com.chordbook.ast.InlineVisitor;
import com.chordbook.ast.Link;
import com.chordbook.ast.Strong;
import com.chordbook.ast.Tag;
import com.chordbook.ast.Text;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens inlines to plain text for bullet items and link captions. Chords contribute only
 * their lyrics; tags and images contribute nothing. Chorus references become label text, and
 * their numbers are kept so callers can still check them.
 */
final class PlainTextRenderer implements InlineVisitor<Void> {
    private final String chorusLabel;
    private final StringBuilder out = new StringBuilder();
    private final List<Integer> chorusReferences = new ArrayList<>();

    private PlainTextRenderer(String chorusLabel) {
        this.chorusLabel = chorusLabel;
    }

    static String render(List<Inline> inlines, String chorusLabel) {
        return of(inlines, chorusLabel).getText();
    }

    static PlainTextRenderer of(List<Inline> inlines, String chorusLabel) {
        PlainTextRenderer renderer = new PlainTextRenderer(chorusLabel);
        renderer.renderAll(inlines);
        return renderer;
    }

    String getText() {
        return out.toString();
    }

    /** Numbers of the chorus references rendered, in order. */
    List<Integer> getChorusReferences() {
        return List.copyOf(chorusReferences);
    }

    private void renderAll(List<Inline> inlines) {
        for (Inline inline : inlines) {
            inline.accept(this);
        }
    }

    @Override
    public Void visitText(Text text) {
        out.append(text.getText());
        return null;
    }

    @Override
    public Void visitChord(Chord chord) {
        renderAll(chord.getInlines());
        return null;
    }

    @Override
    public Void visitBreak(Break lineBreak) {
        out.append(' ');
        return null;
    }

    @Override
    public Void visitEmph(Emph emph) {
        renderAll(emph.getInlines());
        return null;
    }

    @Override
    public Void visitStrong(Strong strong) {
        renderAll(strong.getInlines());
        return null;
    }

    @Override
    public Void visitLink(Link link) {
        out.append(link.getText());
        return null;
    }

    @Override
    public Void visitImage(Image image) {
        return null;
    }

    @Override
    public Void visitChorusRef(ChorusRef chorusRef) {
        if (chorusRef.isPrefixSpace()) {
            out.append(' ');
        }
        out.append(chorusLabel).append(chorusRef.getNumber());
        chorusReferences.add(chorusRef.getNumber());
        return null;
    }

    @Override
    public Void visitTag(Tag tag) {
        return null;
    }
}
