package com.chordbook.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class SongSplitterTest {

    @Test
    void splitsAtTitlesAndKeepsPreamble() {
        SongSplitter.Split split = SongSplitter.split(new SourceText("b.md", "intro\r\n# One\r\nla\r\n# Two\nlo"));

        assertEquals(1, split.getPreamble().size());
        assertEquals("intro", split.getPreamble().get(0).getText());
        assertEquals(2, split.getSongs().size());
        List<SourceLine> second = split.getSongs().get(1).getLines();
        assertEquals("# Two", second.get(0).getText());
        assertEquals(4, second.get(0).getLineNumber());
        assertEquals("\n", second.get(0).getTerminator());
        assertEquals("", second.get(1).getTerminator());
        assertEquals("\r\n", split.getSongs().get(0).getTitleLine().getTerminator());
    }

    @Test
    void hashWithoutSpaceIsNotATitle() {
        SongSplitter.Split split = SongSplitter.split(new SourceText("b.md", "# One\n#hashtag"));

        assertEquals(1, split.getSongs().size());
        assertEquals(2, split.getSongs().get(0).getLines().size());
    }
}
