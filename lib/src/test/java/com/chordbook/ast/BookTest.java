package com.chordbook.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.chordbook.music.Notation;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class BookTest {

    @Test
    void sortedViewKeepsSourceOrderForEqualTitles() {
        Song first = song("Amazing Grace", 1);
        Song second = song("Zither Song", 5);
        Song third = song("Amazing Grace", 9);
        Book book = new Book("Songs", null, null, null, "Ch", Notation.ENGLISH, List.of(second, first, third));

        List<Song> sorted = book.getSongsSorted();

        assertEquals(List.of(first, third, second), sorted);
        assertEquals(List.of(second, first, third), book.getSongs());
    }

    @Test
    void sortIgnoresCase() {
        Book book =
                new Book(
                        "Songs",
                        null,
                        null,
                        null,
                        "Ch",
                        Notation.ENGLISH,
                        List.of(song("banjo", 1), song("Accordion", 2), song("Cello", 3)));

        assertEquals(
                List.of("Accordion", "banjo", "Cello"),
                book.getSongsSorted().stream().map(Song::getTitle).collect(Collectors.toList()));
    }

    @Test
    void songsAreImmutable() {
        Book book = new Book("Songs", null, null, null, "Ch", Notation.ENGLISH, List.of(song("A", 1)));

        assertThrows(UnsupportedOperationException.class, () -> book.getSongs().clear());
    }

    private static Song song(String title, int line) {
        return new Song(title, List.of(), List.of(), SourceLocation.lineStart("b.md", line));
    }
}
