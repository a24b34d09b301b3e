// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.source;

import java.nio.file.Path;
import java.util.List;
import writedown.util.annotation.Nullable;

/**
 * A one-pass, pull-based stream of {@link SourceLine}s.
 * <p>
 * Every logical read, that is the contents of one string or one file, is terminated by a synthetic end marker line
 * whose content is {@link #END_MARKER} and whose line number follows the last real line. Sources built from several
 * files continue with the next file after each end marker, in the given order.
 * <p>
 * Reading is strictly sequential; {@link LineBuffer} provides random access on top of it.
 */
public interface LineSource extends AutoCloseable {
    /**
     * The content of the synthetic line terminating each logical read.
     */
    String END_MARKER = "@eof";

    /**
     * Pulls the next line.
     *
     * @return The next line, or {@code null} if the source is exhausted.
     */
    @Nullable SourceLine next();

    /**
     * Releases any file still open. Failures are signaled as suppressed exceptions rather than thrown.
     */
    @Override
    void close();

    /**
     * Returns a source over the lines of the given string, split on {@code '\n'}, tagged with
     * {@link SourceLine#STRING_SOURCE}.
     */
    static LineSource ofString(final String text) {
        return new StringLineSource(text);
    }

    /**
     * Returns a source over the lines of a single file.
     * <p>
     * The file is opened on the first pull; if it doesn't exist, a fatal {@link NoMatchingFilesCondition} is signaled
     * at that point.
     */
    static LineSource ofFile(final Path path) {
        return new FileLineSource(List.of(path));
    }

    /**
     * Returns a source over the concatenated lines of the given files, each opened lazily in turn.
     */
    static LineSource ofFiles(final List<Path> paths) {
        return new FileLineSource(paths);
    }
}
