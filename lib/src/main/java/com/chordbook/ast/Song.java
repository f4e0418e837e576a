package com.chordbook.ast;

import java.util.List;
import java.util.Objects;

public final class Song {
    private final String title;
    private final List<String> subtitles;
    private final List<Block> blocks;
    private final SourceLocation location;

    public Song(String title, List<String> subtitles, List<Block> blocks, SourceLocation location) {
        this.title = Objects.requireNonNull(title, "title");
        this.subtitles = List.copyOf(subtitles);
        this.blocks = List.copyOf(blocks);
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getTitle() {
        return title;
    }

    public List<String> getSubtitles() {
        return subtitles;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    /** Location of the song's title line. */
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "Song[" + title + ", " + blocks.size() + " blocks]";
    }
}
