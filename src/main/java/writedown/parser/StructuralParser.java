// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import writedown.ast.Node;
import writedown.ast.Payload;
import writedown.ast.Session;
import writedown.ast.StructuralKind;
import writedown.source.LineBuffer;
import writedown.source.SourceLine;
import writedown.util.annotation.Nullable;

/**
 * Parses acts, parts, chapters, scenes and sections.
 * <p>
 * A structural element owns every line after its instruction up to, but not including, the first line whose keyword
 * is in the element's stop set. That stop line is left for the caller to dispatch. Chapters and larger elements don't
 * stop at the end of a file, so they may span several files.
 */
final class StructuralParser {
    StructuralParser(final Parser dispatcher, final SequenceTracker tracker) {
        this.dispatcher = dispatcher;
        this.tracker = tracker;
    }

    /**
     * Returns the structural kind introduced by the given keyword, or {@code null} if it doesn't introduce one.
     */
    static @Nullable StructuralKind kindOf(final String keyword) {
        return switch (keyword) {
            case Instructions.ACT -> StructuralKind.ACT;
            case Instructions.PART -> StructuralKind.PART;
            case Instructions.CHAPTER -> StructuralKind.CHAPTER;
            case Instructions.SCENE -> StructuralKind.SCENE;
            case Instructions.SECTION -> StructuralKind.SECTION;
            default -> null;
        };
    }

    /**
     * Parses the structural element whose instruction is at {@code position}, appending it to {@code holder}.
     * <p>
     * The element's content is scanned no further than {@code end}.
     */
    Resume parse(
        final StructuralKind kind,
        final Node holder,
        final LineBuffer lines,
        final int position,
        final int end,
        final @Nullable Session template
    ) {
        final var line = lines.get(position);
        final var node = new Node(line, payload(kind, holder, line));
        holder.append(node, template);

        final var start = position + 1;
        final var stopSet = stopSets.get(kind);
        var stop = start;
        while (stop < end && lines.isValid(stop)) {
            if (stopSet.contains(Instructions.keyword(lines.get(stop).content()))) {
                break;
            }
            stop += 1;
        }

        final var inner = dispatcher.parse(node, lines, start, stop, template);
        return new Resume(stop, inner.template());
    }

    private Payload.Structural payload(final StructuralKind kind, final Node holder, final SourceLine line) {
        final var argument = Instructions.strip(line.content());
        if (kind == StructuralKind.SECTION) {
            return sectionPayload(holder, line, argument);
        }

        final var matcher = numberedPattern.matcher(argument);
        final var numberText = matcher.lookingAt() ? matcher.group(1) : null;
        var title = (numberText == null) ? emptyToNull(argument) : matcher.group(3);
        Integer explicit = null;
        if (numberText != null) {
            try {
                explicit = Integer.valueOf(numberText);
            } catch (final NumberFormatException e) {
                // Too many digits to be meant as a number, so it's part of the title.
                title = argument;
            }
        }
        final var number = tracker.getOrSet(holder, kind, explicit, line);
        return switch (kind) {
            case ACT -> new Payload.Act(number, title);
            case PART -> new Payload.Part(number, title);
            case CHAPTER -> new Payload.Chapter(number, title);
            case SCENE -> new Payload.Scene(number, title);
            case SECTION -> throw new IllegalArgumentException("Sections carry textual numbers");
        };
    }

    private Payload.Section sectionPayload(final Node holder, final SourceLine line, final String argument) {
        final var matcher = sectionPattern.matcher(argument);
        final var numberText = matcher.lookingAt() ? matcher.group(1) : null;
        final var title = (numberText == null) ? emptyToNull(argument) : matcher.group(3);
        if (numberText == null) {
            return new Payload.Section(Integer.toString(tracker.next(holder, StructuralKind.SECTION, line)), title);
        }
        // Dotted section numbers such as 2.1 are kept as written and left out of the sequence.
        if (digits.matcher(numberText).matches()) {
            try {
                tracker.set(holder, StructuralKind.SECTION, Integer.parseInt(numberText), line);
            } catch (final NumberFormatException e) {
                // Too many digits to track; keep it as written.
            }
        }
        return new Payload.Section(numberText, title);
    }

    private static @Nullable String emptyToNull(final String text) {
        return text.isEmpty() ? null : text;
    }

    private static final Pattern numberedPattern = Pattern.compile("^(\\d+)?(\\s*(.+))?");
    private static final Pattern sectionPattern = Pattern.compile("^(\\d\\S*)?(\\s*(.+))?");
    private static final Pattern digits = Pattern.compile("\\d+");

    private static final Map<StructuralKind, Set<String>> stopSets = new EnumMap<>(Map.of(
        StructuralKind.ACT, Set.of(Instructions.ACT),
        StructuralKind.PART, Set.of(Instructions.PART, Instructions.ACT),
        StructuralKind.CHAPTER, Set.of(Instructions.CHAPTER, Instructions.PART, Instructions.ACT),
        StructuralKind.SCENE, Set.of(
            Instructions.END_OF_STREAM,
            Instructions.SCENE,
            Instructions.CHAPTER,
            Instructions.PART,
            Instructions.ACT
        ),
        StructuralKind.SECTION, Set.of(
            Instructions.END_OF_STREAM,
            Instructions.SECTION,
            Instructions.CHAPTER,
            Instructions.PART,
            Instructions.ACT
        )
    ));

    private final Parser dispatcher;
    private final SequenceTracker tracker;
}
