package com.chordbook.ast;

import java.util.Objects;

/**
 * An image reference. The path is stored as written; width and height are 0 when the source
 * does not state them and are left for the renderer to resolve.
 */
public final class Image implements Inline {
    private final String path;
    private final int width;
    private final int height;
    private final String className;

    public Image(String path, int width, int height, String className) {
        this.path = Objects.requireNonNull(path, "path");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image dimensions must not be negative");
        }
        this.width = width;
        this.height = height;
        this.className = className;
    }

    public String getPath() {
        return path;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /** Alignment class, or {@code null}. */
    public String getClassName() {
        return className;
    }

    @Override
    public InlineKind getKind() {
        return InlineKind.IMAGE;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitImage(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Image)) {
            return false;
        }
        Image other = (Image) obj;
        return width == other.width
                && height == other.height
                && path.equals(other.path)
                && Objects.equals(className, other.className);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, width, height, className);
    }

    @Override
    public String toString() {
        return "Image[" + path + "]";
    }
}
