package com.chordbook.ast;

import com.chordbook.music.Notation;
import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Root of the tree handed to renderers. Immutable once assembled. */
public final class Book {
    private final String title;
    private final String subtitle;
    private final String frontImage;
    private final String titleNote;
    private final String chorusLabel;
    private final Notation notation;
    private final List<Song> songs;

    public Book(
            String title,
            String subtitle,
            String frontImage,
            String titleNote,
            String chorusLabel,
            Notation notation,
            List<Song> songs) {
        this.title = Objects.requireNonNull(title, "title");
        this.subtitle = subtitle;
        this.frontImage = frontImage;
        this.titleNote = titleNote;
        this.chorusLabel = Objects.requireNonNull(chorusLabel, "chorusLabel");
        this.notation = Objects.requireNonNull(notation, "notation");
        this.songs = List.copyOf(songs);
    }

    public String getTitle() {
        return title;
    }

    public String getSubtitle() {
        return subtitle;
    }

    public String getFrontImage() {
        return frontImage;
    }

    public String getTitleNote() {
        return titleNote;
    }

    public String getChorusLabel() {
        return chorusLabel;
    }

    public Notation getNotation() {
        return notation;
    }

    /** Songs in input order. */
    public List<Song> getSongs() {
        return songs;
    }

    /** Songs ordered by title for indexes; songs with equal titles keep input order. */
    public List<Song> getSongsSorted() {
        Collator collator = Collator.getInstance(Locale.ROOT);
        List<Song> sorted = new ArrayList<>(songs);
        sorted.sort(Comparator.comparing(Song::getTitle, collator));
        return List.copyOf(sorted);
    }
}
