// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import writedown.util.annotation.Nullable;
import writedown.util.condition.ConditionContext;
import writedown.util.condition.exception.IOExceptionCondition;

final class FileLineSource implements LineSource {
    FileLineSource(final List<Path> paths) {
        this.paths = List.copyOf(paths);
    }

    @Override
    public @Nullable SourceLine next() {
        if (reader == null) {
            if (nextPathIndex >= paths.size()) {
                return null;
            }
            open(paths.get(nextPathIndex));
            nextPathIndex += 1;
        }
        final var line = readLine();
        if (line != null) {
            lineNumber += 1;
            return new SourceLine(currentSource, lineNumber, line);
        }
        closeCurrent();
        return new SourceLine(currentSource, lineNumber + 1, END_MARKER);
    }

    @Override
    public void close() {
        closeCurrent();
        nextPathIndex = paths.size();
    }

    private void open(final Path path) {
        if (!Files.isRegularFile(path)) {
            throw ConditionContext.error(new NoMatchingFilesCondition(path.toString()));
        }
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (final NoSuchFileException e) {
            throw ConditionContext.error(new NoMatchingFilesCondition(path.toString()));
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
        currentSource = path.toString();
        lineNumber = 0;
    }

    private @Nullable String readLine() {
        assert reader != null : "readLine called with no open file";
        try {
            return reader.readLine();
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private void closeCurrent() {
        final var current = reader;
        if (current == null) {
            return;
        }
        reader = null;
        try {
            current.close();
        } catch (final IOException e) {
            ConditionContext.signalSuppressedException(e);
        }
    }

    private final List<Path> paths;
    private int nextPathIndex = 0;
    private @Nullable BufferedReader reader = null;
    private String currentSource = "";
    private int lineNumber = 0;
}
