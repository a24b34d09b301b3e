// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import java.util.ArrayList;
import java.util.List;
import writedown.ast.Node;
import writedown.ast.Payload;
import writedown.ast.Session;
import writedown.source.LineBuffer;
import writedown.source.SourceLine;
import writedown.util.annotation.Nullable;

/**
 * Parses the instructions describing story entities: characters, places and locations.
 * <p>
 * All three take a comma-separated argument whose first element is the main name. Characters and places also take
 * the non-instruction lines that immediately follow as notes; locations are point annotations and take nothing else.
 */
final class EntityParser {
    private EntityParser() {
    }

    /**
     * Parses the character instruction at {@code position}, along with its notes.
     *
     * @return The index of the first line after the notes.
     */
    static int parseCharacter(
        final Node holder,
        final LineBuffer lines,
        final int position,
        final int end,
        final @Nullable Session template
    ) {
        final var line = lines.get(position);
        final var names = splitNames(line);
        final var notes = new ArrayList<String>();
        final var next = collectNotes(lines, position + 1, end, notes);
        final var character = new Payload.Character(
            names.get(0),
            names.subList(1, names.size()),
            String.join("\n", notes)
        );
        holder.append(new Node(line, character), template);
        return next;
    }

    /**
     * Parses the place instruction at {@code position}, along with its notes.
     *
     * @return The index of the first line after the notes.
     */
    static int parsePlace(
        final Node holder,
        final LineBuffer lines,
        final int position,
        final int end,
        final @Nullable Session template
    ) {
        final var line = lines.get(position);
        final var path = splitNames(line);
        final var notes = new ArrayList<String>();
        final var next = collectNotes(lines, position + 1, end, notes);
        final var place = new Payload.Place(path.get(0), path.subList(1, path.size()), String.join("\n", notes));
        holder.append(new Node(line, place), template);
        return next;
    }

    /**
     * Parses a location instruction. Locations span a single line.
     */
    static void parseLocation(final Node holder, final SourceLine line, final @Nullable Session template) {
        final var path = splitNames(line);
        holder.append(new Node(line, new Payload.Location(path.get(0), path.subList(1, path.size()))), template);
    }

    // The result always has at least one element, the main name, possibly empty.
    private static List<String> splitNames(final SourceLine line) {
        final var segments = Instructions.strip(line.content()).split(",", -1);
        final var names = new ArrayList<String>(segments.length);
        names.add(segments[0].strip());
        for (var i = 1; i < segments.length; i += 1) {
            final var segment = segments[i].strip();
            if (!segment.isEmpty()) {
                names.add(segment);
            }
        }
        return names;
    }

    private static int collectNotes(final LineBuffer lines, final int start, final int end, final List<String> notes) {
        var pos = start;
        while (pos < end && lines.isValid(pos)) {
            final var content = lines.get(pos).content();
            if (Instructions.isInstruction(content)) {
                break;
            }
            notes.add(content);
            pos += 1;
        }
        return pos;
    }
}
