package com.chordbook.compiler;

import com.chordbook.music.Notation;
import com.chordbook.music.UnsupportedNotationException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Book-level settings owned by the caller: metadata copied onto the {@link com.chordbook.ast.Book}
 * and the options songs are parsed with.
 */
public final class BookConfig {
    public static final String DEFAULT_CHORUS_LABEL = "Ch";

    static final String TITLE_PROPERTY = "book.title";
    static final String SUBTITLE_PROPERTY = "book.subtitle";
    static final String FRONT_IMAGE_PROPERTY = "book.front_img";
    static final String TITLE_NOTE_PROPERTY = "book.title_note";
    static final String CHORUS_LABEL_PROPERTY = "book.chorus_label";
    static final String NOTATION_PROPERTY = "notation";
    static final String SMART_PUNCTUATION_PROPERTY = "smart_punctuation";

    private final String title;
    private final String subtitle;
    private final String frontImage;
    private final String titleNote;
    private final String chorusLabel;
    private final Notation notation;
    private final boolean smartPunctuation;

    private BookConfig(Builder builder) {
        this.title = builder.title;
        this.subtitle = builder.subtitle;
        this.frontImage = builder.frontImage;
        this.titleNote = builder.titleNote;
        this.chorusLabel = builder.chorusLabel;
        this.notation = builder.notation;
        this.smartPunctuation = builder.smartPunctuation;
    }

    public static Builder builder(String title) {
        return new Builder(title);
    }

    /**
     * Reads settings from properties already loaded by the caller. Only {@code book.title} is
     * required.
     *
     * @throws UnsupportedNotationException when {@code notation} names an unknown system
     */
    public static BookConfig fromProperties(Properties properties) throws UnsupportedNotationException {
        Objects.requireNonNull(properties, "properties");
        String title = properties.getProperty(TITLE_PROPERTY);
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Missing required property: " + TITLE_PROPERTY);
        }
        Builder builder = builder(title.trim())
                .subtitle(properties.getProperty(SUBTITLE_PROPERTY))
                .frontImage(properties.getProperty(FRONT_IMAGE_PROPERTY))
                .titleNote(properties.getProperty(TITLE_NOTE_PROPERTY));
        String chorusLabel = properties.getProperty(CHORUS_LABEL_PROPERTY);
        if (chorusLabel != null) {
            builder.chorusLabel(chorusLabel.trim());
        }
        String notation = properties.getProperty(NOTATION_PROPERTY);
        if (notation != null) {
            builder.notation(Notation.fromName(notation));
        }
        String smart = properties.getProperty(SMART_PUNCTUATION_PROPERTY);
        if (smart != null) {
            builder.smartPunctuation(parseBoolean(SMART_PUNCTUATION_PROPERTY, smart));
        }
        return builder.build();
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException("Property " + key + " must be true or false: " + value);
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

    public boolean isSmartPunctuation() {
        return smartPunctuation;
    }

    public ParserConfig toParserConfig() {
        return new ParserConfig(notation, chorusLabel, smartPunctuation);
    }

    public static final class Builder {
        private final String title;
        private String subtitle;
        private String frontImage;
        private String titleNote;
        private String chorusLabel = DEFAULT_CHORUS_LABEL;
        private Notation notation = Notation.ENGLISH;
        private boolean smartPunctuation = true;

        private Builder(String title) {
            this.title = Objects.requireNonNull(title, "title");
        }

        public Builder subtitle(String subtitle) {
            this.subtitle = subtitle;
            return this;
        }

        public Builder frontImage(String frontImage) {
            this.frontImage = frontImage;
            return this;
        }

        public Builder titleNote(String titleNote) {
            this.titleNote = titleNote;
            return this;
        }

        public Builder chorusLabel(String chorusLabel) {
            this.chorusLabel = Objects.requireNonNull(chorusLabel, "chorusLabel");
            return this;
        }

        public Builder notation(Notation notation) {
            this.notation = Objects.requireNonNull(notation, "notation");
            return this;
        }

        public Builder smartPunctuation(boolean smartPunctuation) {
            this.smartPunctuation = smartPunctuation;
            return this;
        }

        public BookConfig build() {
            return new BookConfig(this);
        }
    }
}
