// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import writedown.ast.Node;
import writedown.ast.Payload;
import writedown.ast.Session;
import writedown.ast.WritingStatus;
import writedown.source.FileDiscovery;
import writedown.source.LineBuffer;
import writedown.source.LineSource;
import writedown.source.NoMatchingFilesCondition;
import writedown.source.SourceLine;
import writedown.util.Trace;
import writedown.util.annotation.Nullable;
import writedown.util.condition.ConditionContext;

/**
 * Parses Writedown markup into a document tree.
 * <p>
 * Lines that aren't instructions become text nodes. Instructions are dispatched on their keyword: structural
 * instructions open a nested scope that owns the lines up to the next instruction of a stopping kind, everything else
 * produces a single node, or none at all for the instructions that only affect the parser state. Unknown instructions
 * are kept as {@link Payload.UnmappedInstruction} nodes.
 * <p>
 * Sequence anomalies are signaled as non-fatal {@link SequenceWarningCondition}s. An unknown status keyword is a fatal
 * {@link ParseErrorCondition}; paths matching no files are fatal {@link NoMatchingFilesCondition}s.
 * <p>
 * A parser is not thread-safe, and the numbering state it shares with parsers for included files persists across
 * calls: use a fresh parser for each document.
 */
public final class Parser {
    /**
     * Initializes a new parser with fresh numbering state.
     */
    public Parser() {
        this(new SequenceTracker());
    }

    /**
     * Initializes a new parser numbering structural elements with the given tracker.
     */
    public Parser(final SequenceTracker tracker) {
        this.tracker = tracker;
        structural = new StructuralParser(this, tracker);
    }

    /**
     * Retrieves the tracker this parser numbers structural elements with.
     */
    public SequenceTracker tracker() {
        return tracker;
    }

    /**
     * Parses the given string.
     */
    public Node parseString(final String text) {
        try (final var source = LineSource.ofString(text)) {
            return parseDocument(source);
        }
    }

    /**
     * Parses a single file.
     * <p>
     * If the file doesn't exist, a fatal {@link NoMatchingFilesCondition} is signaled.
     */
    public Node parseFile(final Path path) {
        try (final var trace = new Trace(() -> "Parsing file " + path)) {
            trace.use();
            try (final var source = LineSource.ofFile(path)) {
                return parseDocument(source);
            }
        }
    }

    /**
     * Parses the files found by discovering the given path or glob pattern, concatenated in discovery order.
     *
     * @param pathOrPattern The file, directory or pattern, or {@code null} for default discovery in the working
     *                      directory.
     * @see FileDiscovery#discover(String)
     */
    public Node parsePath(final @Nullable String pathOrPattern) {
        return parseFiles(FileDiscovery.discover(pathOrPattern));
    }

    /**
     * Parses the files found by discovering each of the given paths or glob patterns, concatenated in order.
     *
     * @see FileDiscovery#discover(List)
     */
    public Node parsePaths(final List<String> pathsOrPatterns) {
        return parseFiles(FileDiscovery.discover(pathsOrPatterns));
    }

    private Node parseFiles(final List<Path> files) {
        try (final var trace = new Trace(() -> "Parsing " + files.size() + " file(s)")) {
            trace.use();
            try (final var source = LineSource.ofFiles(files)) {
                return parseDocument(source);
            }
        }
    }

    private Node parseDocument(final LineSource source) {
        final var document = Node.document();
        parse(document, new LineBuffer(source), 0, UNBOUNDED, null);
        return document;
    }

    /**
     * Parses the lines in {@code [position, end)}, appending the resulting nodes to {@code holder}.
     * <p>
     * Lines before the returned position are discarded from the buffer.
     *
     * @param end      The exclusive end of the window, or {@link #UNBOUNDED} to parse up to the end of the stream.
     * @param template The session template in force at {@code position}.
     */
    Resume parse(
        final Node holder,
        final LineBuffer lines,
        final int position,
        final int end,
        final @Nullable Session template
    ) {
        var pos = position;
        var session = template;
        while (pos < end && lines.isValid(pos)) {
            final var line = lines.get(pos);
            final var content = line.content();
            if (!Instructions.isInstruction(content)) {
                holder.append(new Node(line, new Payload.Text(content)), session);
                pos += 1;
                continue;
            }

            final var keyword = Instructions.keyword(content);
            final var kind = StructuralParser.kindOf(keyword);
            if (kind != null) {
                final var resume = structural.parse(kind, holder, lines, pos, end, session);
                pos = resume.position();
                session = resume.template();
                continue;
            }

            switch (keyword) {
                case Instructions.END_OF_STREAM, Instructions.END_SESSION -> session = null;
                case Instructions.SESSION -> session = SessionParser.parse(line);
                case Instructions.INCLUDE -> include(holder, line, session);
                case Instructions.COMMENT_BLOCK_START -> {
                    pos = CommentBlockParser.parse(holder, lines, pos, end, session);
                    continue;
                }
                case Instructions.CHARACTER -> {
                    pos = EntityParser.parseCharacter(holder, lines, pos, end, session);
                    continue;
                }
                case Instructions.PLACE -> {
                    pos = EntityParser.parsePlace(holder, lines, pos, end, session);
                    continue;
                }
                case Instructions.LOCATION -> EntityParser.parseLocation(holder, line, session);
                default -> holder.append(new Node(line, leafPayload(keyword, line)), session);
            }
            pos += 1;
        }

        lines.truncate(pos);
        return new Resume(pos, session);
    }

    private static Payload leafPayload(final String keyword, final SourceLine line) {
        final var argument = Instructions.strip(line.content());
        return switch (keyword) {
            case Instructions.AUTHOR -> new Payload.Author(argument);
            case Instructions.TITLE -> new Payload.Title(argument);
            case Instructions.TODO -> new Payload.Todo(argument);
            case Instructions.COMMENT, Instructions.COMMENT_SHORTHAND -> new Payload.Comment(argument);
            case Instructions.PAGEBREAK -> new Payload.PageBreak();
            case Instructions.TABLE_OF_CONTENTS, Instructions.TOC -> new Payload.TableOfContents();
            case Instructions.STATUS -> statusPayload(line, argument);
            case Instructions.TAG -> new Payload.Tag(splitTags(argument));
            case Instructions.TARGET -> targetPayload(keyword, argument);
            default -> new Payload.UnmappedInstruction(keyword, argument);
        };
    }

    private static Payload.Status statusPayload(final SourceLine line, final String argument) {
        final var status = WritingStatus.fromKeyword(argument);
        if (status == null) {
            throw ConditionContext.error(new ParseErrorCondition(line, "Unknown status '" + argument + "'"));
        }
        return new Payload.Status(status);
    }

    private static Payload targetPayload(final String keyword, final String argument) {
        try {
            return new Payload.Target(Integer.parseInt(argument));
        } catch (final NumberFormatException e) {
            return new Payload.UnmappedInstruction(keyword, argument);
        }
    }

    private static List<String> splitTags(final String argument) {
        final var tags = new ArrayList<String>();
        for (final var tag : whitespace.split(argument)) {
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    /**
     * Parses the files named by an include instruction directly into {@code holder}.
     * <p>
     * The path is relative to the directory of the including file, or to the working directory for string input. The
     * included files start out in the session of the including scope, but sessions they open or close don't affect
     * it. Including a directory with no Writedown files in it is an error.
     */
    private void include(final Node holder, final SourceLine line, final @Nullable Session template) {
        final var argument = Instructions.strip(line.content());
        final var path = line.isFromString() ? argument : Path.of(line.source()).resolveSibling(argument).toString();
        try (final var trace = new Trace(() -> "Including " + path + " from " + line.location())) {
            trace.use();
            final var files = FileDiscovery.discover(path);
            if (files.isEmpty()) {
                throw ConditionContext.error(new NoMatchingFilesCondition(path));
            }
            try (final var source = LineSource.ofFiles(files)) {
                new Parser(tracker).parse(holder, new LineBuffer(source), 0, UNBOUNDED, template);
            }
        }
    }

    /**
     * The window end meaning "up to the end of the stream".
     */
    static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final Pattern whitespace = Pattern.compile("\\s+");

    private final SequenceTracker tracker;
    private final StructuralParser structural;
}
