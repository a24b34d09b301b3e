// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.source;

/**
 * A single line of input.
 *
 * @param source     The path of the file the line comes from, or {@link #STRING_SOURCE} for string input.
 * @param lineNumber The 1-based line number within the source.
 * @param content    The raw text of the line, without the line terminator.
 */
public record SourceLine(String source, int lineNumber, String content) {
    /**
     * The source identifier of lines read from a string rather than a file.
     */
    public static final String STRING_SOURCE = "string";

    public SourceLine {
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Negative line number: " + lineNumber);
        }
    }

    /**
     * Returns a copy of this line with the same origin but different content.
     */
    public SourceLine withContent(final String newContent) {
        return new SourceLine(source, lineNumber, newContent);
    }

    /**
     * Returns {@code true} iff this line was read from a string rather than a file.
     */
    public boolean isFromString() {
        return STRING_SOURCE.equals(source);
    }

    /**
     * Returns the location of this line as {@code source:lineNumber}.
     */
    public String location() {
        return source + ":" + lineNumber;
    }
}
