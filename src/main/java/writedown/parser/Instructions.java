// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import java.util.regex.Pattern;
import writedown.source.LineSource;

/**
 * The Writedown token grammar.
 * <p>
 * An instruction line starts with {@link #LEAD}; its keyword is the leading run of non-whitespace characters, and its
 * argument is whatever follows, trimmed. Keywords are matched exactly and case-sensitively.
 */
public final class Instructions {
    private Instructions() {
    }

    public static final String LEAD = "@";

    public static final String ACT = "@act";
    public static final String PART = "@part";
    public static final String CHAPTER = "@chapter";
    public static final String SCENE = "@scene";
    public static final String SECTION = "@section";

    public static final String AUTHOR = "@author";
    public static final String TITLE = "@title";
    public static final String STATUS = "@status";
    public static final String TAG = "@tag";
    public static final String TARGET = "@target";
    public static final String TODO = "@todo";

    public static final String COMMENT = "@comment";
    public static final String COMMENT_SHORTHAND = "@#";
    public static final String COMMENT_BLOCK_START = "@*";
    public static final String COMMENT_BLOCK_END = "*@";

    public static final String INCLUDE = "@include";
    public static final String SESSION = "@session";
    public static final String END_SESSION = "@endsession";
    public static final String LOCATION = "@location";
    public static final String PLACE = "@place";
    public static final String CHARACTER = "@character";
    public static final String TABLE_OF_CONTENTS = "@tableofcontents";
    public static final String TOC = "@toc";
    public static final String PAGEBREAK = "@pagebreak";

    /**
     * The synthetic line ending every file or string.
     */
    public static final String END_OF_STREAM = LineSource.END_MARKER;

    /**
     * Returns {@code true} iff the given line content is an instruction line.
     */
    public static boolean isInstruction(final String content) {
        return content.startsWith(LEAD);
    }

    /**
     * Returns the instruction keyword of the given line content, e.g. {@code @chapter} for {@code @chapter 1 One}.
     *
     * @return The keyword, or an empty string if the content doesn't start with one.
     */
    public static String keyword(final String content) {
        final var matcher = keywordPattern.matcher(content);
        return matcher.find() ? matcher.group(1) : "";
    }

    /**
     * Removes the leading instruction keyword, if any, and trims the result, e.g. {@code One} for
     * {@code @chapter One}.
     */
    public static String strip(final String content) {
        return stripPattern.matcher(content).replaceFirst("").strip();
    }

    private static final Pattern keywordPattern = Pattern.compile("^(@\\S+)");
    private static final Pattern stripPattern = Pattern.compile("^@\\S+\\s*");
}
