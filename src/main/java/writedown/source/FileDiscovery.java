// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.source;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import writedown.util.Trace;
import writedown.util.annotation.Nullable;
import writedown.util.condition.ConditionContext;
import writedown.util.condition.exception.IOExceptionCondition;

/**
 * Resolves paths and glob patterns to the ordered list of Writedown files they name.
 * <p>
 * A path naming a directory, or no path at all, means the default discovery: {@code index.wd} in that directory if
 * it exists, otherwise every {@code .wd} file below it. Any other path is a glob pattern, where {@code **} matches any
 * number of directories, including none. Matches are returned in glob order: within a directory, files sorted by name
 * come before the contents of sub-directories sorted by name. Hidden files and directories are skipped.
 */
public final class FileDiscovery {
    private FileDiscovery() {
    }

    /**
     * The patterns tried in order by default discovery; the first one matching anything wins.
     */
    public static final List<String> DEFAULT_PATTERNS = List.of("index.wd", "**/*.wd");

    /**
     * Resolves the given paths or patterns, concatenating their matches in order.
     * <p>
     * An empty list means default discovery in the working directory.
     */
    public static List<Path> discover(final List<String> pathsOrPatterns) {
        if (pathsOrPatterns.isEmpty()) {
            return discover((String) null);
        }
        final var files = new ArrayList<Path>();
        for (final var pathOrPattern : pathsOrPatterns) {
            files.addAll(discover(pathOrPattern));
        }
        return files;
    }

    /**
     * Resolves a single path or pattern.
     * <p>
     * If the argument is neither a directory nor matches at least one file, a fatal {@link NoMatchingFilesCondition}
     * is signaled. A directory with no Writedown files in it resolves to an empty list.
     *
     * @param pathOrPattern The path or pattern, or {@code null} for default discovery in the working directory.
     */
    public static List<Path> discover(final @Nullable String pathOrPattern) {
        try (final var trace = new Trace(() -> "Discovering files for " + describe(pathOrPattern))) {
            trace.use();
            if (pathOrPattern == null) {
                return discoverDefault(null);
            }
            if (Files.isDirectory(Path.of(pathOrPattern))) {
                return discoverDefault(pathOrPattern);
            }
            final var matches = glob(pathOrPattern);
            if (matches.isEmpty()) {
                throw ConditionContext.error(new NoMatchingFilesCondition(pathOrPattern));
            }
            return matches;
        }
    }

    private static List<Path> discoverDefault(final @Nullable String directory) {
        for (final var pattern : DEFAULT_PATTERNS) {
            final var matches = glob((directory == null) ? pattern : join(directory, pattern));
            if (!matches.isEmpty()) {
                return matches;
            }
        }
        return List.of();
    }

    private static List<Path> glob(final String pattern) {
        final var segments = pattern.split("/", -1);
        var firstWildcard = 0;
        while (firstWildcard < segments.length && !hasWildcard(segments[firstWildcard])) {
            firstWildcard += 1;
        }
        if (firstWildcard == segments.length) {
            final var path = Path.of(pattern);
            return Files.isRegularFile(path) ? List.of(path) : List.of();
        }

        var baseName = String.join("/", List.of(segments).subList(0, firstWildcard));
        if (baseName.isEmpty() && firstWildcard > 0) {
            baseName = "/";
        }
        final var base = Path.of(baseName);
        if (!baseName.isEmpty() && !Files.isDirectory(base)) {
            return List.of();
        }
        final var relativePattern = String.join("/", List.of(segments).subList(firstWildcard, segments.length));
        final var matcher = new GlobMatcher(relativePattern);
        final var matches = new ArrayList<Path>();
        walk(base, Path.of(""), matcher, matches);
        return matches;
    }

    private static void walk(final Path base, final Path relative, final GlobMatcher matcher, final List<Path> matches) {
        final var directory = base.resolve(relative);
        final var files = new ArrayList<Path>();
        final var subdirectories = new ArrayList<Path>();
        try (final var stream = Files.newDirectoryStream(directory.toString().isEmpty() ? Path.of(".") : directory)) {
            for (final var entry : stream) {
                final var name = entry.getFileName();
                if (name == null || name.toString().startsWith(".")) {
                    continue;
                }
                if (Files.isDirectory(entry)) {
                    subdirectories.add(relative.resolve(name.toString()));
                } else if (Files.isRegularFile(entry)) {
                    files.add(relative.resolve(name.toString()));
                }
            }
        } catch (final DirectoryIteratorException e) {
            throw ConditionContext.error(new IOExceptionCondition(e.getCause()));
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
        files.sort(byName);
        subdirectories.sort(byName);
        for (final var file : files) {
            if (matcher.matches(file)) {
                matches.add(base.resolve(file));
            }
        }
        for (final var subdirectory : subdirectories) {
            walk(base, subdirectory, matcher, matches);
        }
    }

    private static boolean hasWildcard(final String segment) {
        for (int i = 0; i < segment.length(); i += 1) {
            switch (segment.charAt(i)) {
                case '*', '?', '[', '{' -> {
                    return true;
                }
                default -> {
                }
            }
        }
        return false;
    }

    private static String join(final String directory, final String pattern) {
        return directory.endsWith("/") ? (directory + pattern) : (directory + "/" + pattern);
    }

    private static String describe(final @Nullable String pathOrPattern) {
        return (pathOrPattern == null) ? "the working directory" : pathOrPattern;
    }

    private static final Comparator<Path> byName = Comparator.comparing(Path::toString);

    private static final class GlobMatcher {
        private GlobMatcher(final String pattern) {
            final var fileSystem = FileSystems.getDefault();
            for (final var variant : expandRecursiveWildcards(pattern)) {
                matchers.add(fileSystem.getPathMatcher("glob:" + variant));
            }
        }

        private boolean matches(final Path relativePath) {
            for (final var matcher : matchers) {
                if (matcher.matches(relativePath)) {
                    return true;
                }
            }
            return false;
        }

        // Java globs require "**/" to match at least one directory, shell globs don't. Every occurrence is tried
        // both kept and dropped, independently of the others.
        private static List<String> expandRecursiveWildcards(final String pattern) {
            final var index = pattern.indexOf(recursiveWildcard);
            if (index < 0) {
                return List.of(pattern);
            }
            final var head = pattern.substring(0, index);
            final var variants = new ArrayList<String>();
            for (final var tail : expandRecursiveWildcards(pattern.substring(index + recursiveWildcard.length()))) {
                variants.add(head + recursiveWildcard + tail);
                variants.add(head + tail);
            }
            return variants;
        }

        private static final String recursiveWildcard = "**/";

        private final ArrayList<PathMatcher> matchers = new ArrayList<>();
    }
}
