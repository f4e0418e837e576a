package com.chordbook.ast;

import java.util.Objects;

public final class Link implements Inline {
    private final String url;
    private final String title;
    private final String text;

    public Link(String url, String title, String text) {
        this.url = Objects.requireNonNull(url, "url");
        this.title = title;
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getUrl() {
        return url;
    }

    /** Link title, or {@code null}. */
    public String getTitle() {
        return title;
    }

    public String getText() {
        return text;
    }

    @Override
    public InlineKind getKind() {
        return InlineKind.LINK;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitLink(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Link)) {
            return false;
        }
        Link other = (Link) obj;
        return url.equals(other.url) && Objects.equals(title, other.title) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, title, text);
    }

    @Override
    public String toString() {
        return "Link[" + text + " -> " + url + "]";
    }
}
