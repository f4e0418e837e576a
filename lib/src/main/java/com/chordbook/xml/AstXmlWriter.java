package com.chordbook.xml;

import com.chordbook.ast.AstVersion;
import com.chordbook.ast.Block;
import com.chordbook.ast.BlockVisitor;
import com.chordbook.ast.Book;
import com.chordbook.ast.Break;
import com.chordbook.ast.BulletList;
import com.chordbook.ast.Chord;
import com.chordbook.ast.ChorusRef;
import com.chordbook.ast.Emph;
import com.chordbook.ast.HorizontalLine;
import com.chordbook.ast.HtmlBlock;
import com.chordbook.ast.Image;
import com.chordbook.ast.Inline;
import com.chordbook.ast.InlineVisitor;
import com.chordbook.ast.Link;
import com.chordbook.ast.Paragraph;
import com.chordbook.ast.Pre;
import com.chordbook.ast.Song;
import com.chordbook.ast.Strong;
import com.chordbook.ast.Tag;
import com.chordbook.ast.Text;
import com.chordbook.ast.Verse;
import com.chordbook.ast.VerseLabel;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Serializes a {@link Book} to XML using the block and inline tag names renderers rely on. The
 * root element carries the AST version so templates can check compatibility.
 */
public final class AstXmlWriter {
    private static final XMLOutputFactory FACTORY = XMLOutputFactory.newFactory();

    private AstXmlWriter() {}

    public static String toXml(Book book) throws XMLStreamException {
        StringWriter out = new StringWriter();
        write(book, out);
        return out.toString();
    }

    public static void write(Book book, Writer out) throws XMLStreamException {
        Objects.requireNonNull(book, "book");
        Objects.requireNonNull(out, "out");
        XMLStreamWriter xml = FACTORY.createXMLStreamWriter(out);
        try {
            xml.writeStartDocument("UTF-8", "1.0");
            new TreeWriter(xml).writeBook(book);
            xml.writeEndDocument();
            xml.flush();
        } finally {
            xml.close();
        }
    }

    /** Carries {@link XMLStreamException} out of the visitor methods. */
    private static final class UncheckedXmlException extends RuntimeException {
        UncheckedXmlException(XMLStreamException cause) {
            super(cause);
        }

        @Override
        public synchronized XMLStreamException getCause() {
            return (XMLStreamException) super.getCause();
        }
    }

    private static final class TreeWriter implements BlockVisitor<Void>, InlineVisitor<Void> {
        private final XMLStreamWriter xml;

        TreeWriter(XMLStreamWriter xml) {
            this.xml = xml;
        }

        void writeBook(Book book) throws XMLStreamException {
            xml.writeStartElement("book");
            xml.writeAttribute("ast-version", AstVersion.current().toVersionString());
            textElement("title", book.getTitle());
            textElement("subtitle", book.getSubtitle());
            textElement("front-img", book.getFrontImage());
            textElement("title-note", book.getTitleNote());
            textElement("chorus-label", book.getChorusLabel());
            textElement("notation", book.getNotation().getName());
            xml.writeStartElement("songs");
            for (Song song : book.getSongs()) {
                writeSong(song);
            }
            xml.writeEndElement();
            xml.writeEndElement();
        }

        private void writeSong(Song song) throws XMLStreamException {
            xml.writeStartElement("song");
            textElement("title", song.getTitle());
            xml.writeStartElement("subtitles");
            for (String subtitle : song.getSubtitles()) {
                textElement("subtitle", subtitle);
            }
            xml.writeEndElement();
            xml.writeStartElement("blocks");
            try {
                for (Block block : song.getBlocks()) {
                    block.accept(this);
                }
            } catch (UncheckedXmlException ex) {
                throw ex.getCause();
            }
            xml.writeEndElement();
            xml.writeEndElement();
        }

        private void textElement(String name, String value) throws XMLStreamException {
            if (value == null) {
                return;
            }
            xml.writeStartElement(name);
            xml.writeCharacters(value);
            xml.writeEndElement();
        }

        @Override
        public Void visitVerse(Verse verse) {
            start(verse.getKind().getTag());
            for (Paragraph paragraph : verse.getParagraphs()) {
                start("paragraph");
                VerseLabel label = paragraph.getLabel();
                if (label.getKind() != VerseLabel.Kind.NONE) {
                    attribute("label", label.getKind().name().toLowerCase(Locale.ROOT));
                    if (label.getKind() == VerseLabel.Kind.CUSTOM) {
                        attribute("text", label.getText());
                    } else {
                        attribute("num", Integer.toString(label.getNumber()));
                    }
                }
                inlines(paragraph.getInlines());
                end();
            }
            end();
            return null;
        }

        @Override
        public Void visitBulletList(BulletList list) {
            start(list.getKind().getTag());
            for (String item : list.getItems()) {
                start("item");
                characters(item);
                end();
            }
            end();
            return null;
        }

        @Override
        public Void visitHorizontalLine(HorizontalLine line) {
            empty(line.getKind().getTag());
            return null;
        }

        @Override
        public Void visitPre(Pre pre) {
            start(pre.getKind().getTag());
            characters(pre.getText());
            end();
            return null;
        }

        @Override
        public Void visitHtmlBlock(HtmlBlock block) {
            start(block.getKind().getTag());
            inlines(block.getInlines());
            end();
            return null;
        }

        @Override
        public Void visitText(Text text) {
            start(text.getKind().getTag());
            characters(text.getText());
            end();
            return null;
        }

        @Override
        public Void visitChord(Chord chord) {
            start(chord.getKind().getTag());
            attribute("chord", chord.getChord());
            if (chord.getAltChord() != null) {
                attribute("alt-chord", chord.getAltChord());
            }
            attribute("backticks", Integer.toString(chord.getBackticks()));
            attribute("baseline", Boolean.toString(chord.isBaseline()));
            inlines(chord.getInlines());
            end();
            return null;
        }

        @Override
        public Void visitBreak(Break lineBreak) {
            empty(lineBreak.getKind().getTag());
            return null;
        }

        @Override
        public Void visitEmph(Emph emph) {
            start(emph.getKind().getTag());
            inlines(emph.getInlines());
            end();
            return null;
        }

        @Override
        public Void visitStrong(Strong strong) {
            start(strong.getKind().getTag());
            inlines(strong.getInlines());
            end();
            return null;
        }

        @Override
        public Void visitLink(Link link) {
            start(link.getKind().getTag());
            attribute("url", link.getUrl());
            if (link.getTitle() != null) {
                attribute("title", link.getTitle());
            }
            characters(link.getText());
            end();
            return null;
        }

        @Override
        public Void visitImage(Image image) {
            empty(image.getKind().getTag());
            attribute("path", image.getPath());
            attribute("width", Integer.toString(image.getWidth()));
            attribute("height", Integer.toString(image.getHeight()));
            if (image.getClassName() != null) {
                attribute("class", image.getClassName());
            }
            return null;
        }

        @Override
        public Void visitChorusRef(ChorusRef chorusRef) {
            empty(chorusRef.getKind().getTag());
            attribute("num", Integer.toString(chorusRef.getNumber()));
            attribute("prefix-space", Boolean.toString(chorusRef.isPrefixSpace()));
            return null;
        }

        @Override
        public Void visitTag(Tag tag) {
            start(tag.getKind().getTag());
            attribute("name", tag.getName());
            for (Map.Entry<String, String> entry : tag.getAttributes().entrySet()) {
                start("attr");
                attribute("name", entry.getKey());
                characters(entry.getValue());
                end();
            }
            end();
            return null;
        }

        private void inlines(List<Inline> inlines) {
            for (Inline inline : inlines) {
                inline.accept(this);
            }
        }

        private void start(String name) {
            try {
                xml.writeStartElement(name);
            } catch (XMLStreamException ex) {
                throw new UncheckedXmlException(ex);
            }
        }

        private void empty(String name) {
            try {
                xml.writeEmptyElement(name);
            } catch (XMLStreamException ex) {
                throw new UncheckedXmlException(ex);
            }
        }

        private void attribute(String name, String value) {
            try {
                xml.writeAttribute(name, value);
            } catch (XMLStreamException ex) {
                throw new UncheckedXmlException(ex);
            }
        }

        private void characters(String text) {
            try {
                xml.writeCharacters(text);
            } catch (XMLStreamException ex) {
                throw new UncheckedXmlException(ex);
            }
        }

        private void end() {
            try {
                xml.writeEndElement();
            } catch (XMLStreamException ex) {
                throw new UncheckedXmlException(ex);
            }
        }
    }
}
