package com.chordbook.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Version of the tree format renderers consume. Templates declare the version they were written
 * against; {@link #compatibility(AstVersion)} tells a renderer how to treat a mismatch.
 */
public final class AstVersion implements Comparable<AstVersion> {

    public enum Compatibility {
        CURRENT,
        /** The template targets a newer tree than this compiler produces. */
        NEWER_TEMPLATE,
        OLDER_COMPATIBLE,
        OLDER_INCOMPATIBLE
    }

    public static final List<AstVersion> LOG =
            List.of(
                    new AstVersion(1, 0, 0, "Initial version"),
                    new AstVersion(
                            1,
                            1,
                            0,
                            "New style, added support for HTML snippets and baseline chords"),
                    new AstVersion(
                            1,
                            2,
                            0,
                            "Width and height are now provided in i-image elements"));

    private final int major;
    private final int minor;
    private final int patch;
    private final String description;

    public AstVersion(int major, int minor, int patch, String description) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.description = Objects.requireNonNull(description, "description");
    }

    public static AstVersion current() {
        return LOG.get(LOG.size() - 1);
    }

    /** Parses {@code major.minor[.patch]}. */
    public static AstVersion parse(String text) {
        Objects.requireNonNull(text, "text");
        String[] parts = text.trim().split("\\.");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Invalid version: " + text);
        }
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = Integer.parseInt(parts[1]);
            int patch = parts.length == 3 ? Integer.parseInt(parts[2]) : 0;
            return new AstVersion(major, minor, patch, "");
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid version: " + text, ex);
        }
    }

    public static Compatibility compatibility(AstVersion templateVersion) {
        AstVersion current = current();
        int cmp = current.compareTo(templateVersion);
        if (cmp < 0) {
            return Compatibility.NEWER_TEMPLATE;
        }
        if (current.major > templateVersion.major) {
            return Compatibility.OLDER_INCOMPATIBLE;
        }
        if (cmp > 0) {
            return Compatibility.OLDER_COMPATIBLE;
        }
        return Compatibility.CURRENT;
    }

    /** Log entries newer than {@code since}, oldest first. */
    public static List<AstVersion> changesSince(AstVersion since) {
        List<AstVersion> changes = new ArrayList<>();
        for (AstVersion version : LOG) {
            if (version.compareTo(since) > 0) {
                changes.add(version);
            }
        }
        return changes;
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public String getDescription() {
        return description;
    }

    public String toVersionString() {
        return major + "." + minor + "." + patch;
    }

    @Override
    public int compareTo(AstVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof AstVersion)) {
            return false;
        }
        return compareTo((AstVersion) obj) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch);
    }

    @Override
    public String toString() {
        return description.isEmpty() ? toVersionString() : toVersionString() + ": " + description + ".";
    }
}
