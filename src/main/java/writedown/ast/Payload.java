// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.ast;

import java.util.List;
import writedown.util.annotation.Nullable;

/**
 * Base type of the data carried by document tree nodes.
 * <p>
 * Payloads are immutable; the tree shape lives in {@link Node}. The {@link #toString()} of each payload is its
 * user-readable rendering.
 */
public sealed interface Payload {
    /**
     * Base interface for the payloads of structural nodes, that is, the nodes that own the content following them.
     */
    sealed interface Structural extends Payload {
        /**
         * Retrieves the kind of this structural element.
         */
        StructuralKind kind();

        /**
         * Retrieves the number of this element, rendered as text.
         */
        String numberText();

        /**
         * Retrieves the title of this element, or {@code null} if it is untitled.
         */
        @Nullable String title();
    }

    /**
     * The root of every document tree.
     */
    record Document() implements Payload {
        @Override
        public String toString() {
            return "Document";
        }
    }

    record Act(int number, @Nullable String title) implements Structural {
        @Override
        public StructuralKind kind() {
            return StructuralKind.ACT;
        }

        @Override
        public String numberText() {
            return Integer.toString(number);
        }

        @Override
        public String toString() {
            return renderStructural(this);
        }
    }

    record Part(int number, @Nullable String title) implements Structural {
        @Override
        public StructuralKind kind() {
            return StructuralKind.PART;
        }

        @Override
        public String numberText() {
            return Integer.toString(number);
        }

        @Override
        public String toString() {
            return renderStructural(this);
        }
    }

    record Chapter(int number, @Nullable String title) implements Structural {
        @Override
        public StructuralKind kind() {
            return StructuralKind.CHAPTER;
        }

        @Override
        public String numberText() {
            return Integer.toString(number);
        }

        @Override
        public String toString() {
            return renderStructural(this);
        }
    }

    record Scene(int number, @Nullable String title) implements Structural {
        @Override
        public StructuralKind kind() {
            return StructuralKind.SCENE;
        }

        @Override
        public String numberText() {
            return Integer.toString(number);
        }

        @Override
        public String toString() {
            return renderStructural(this);
        }
    }

    /**
     * A section. Unlike the other structural elements, sections may carry non-integer numbers such as
     * {@code 2.1}, so the number is kept as text.
     */
    record Section(String number, @Nullable String title) implements Structural {
        @Override
        public StructuralKind kind() {
            return StructuralKind.SECTION;
        }

        @Override
        public String numberText() {
            return number;
        }

        @Override
        public String toString() {
            return renderStructural(this);
        }
    }

    record Author(String name) implements Payload {
        @Override
        public String toString() {
            return "by " + name;
        }
    }

    /**
     * A character description.
     *
     * @param name      The primary name of the character.
     * @param nameForms Alternate names the character goes by.
     * @param notes     Free-form notes, one line per note line, or an empty string.
     */
    record Character(String name, List<String> nameForms, String notes) implements Payload {
        public Character {
            nameForms = List.copyOf(nameForms);
        }

        @Override
        public String toString() {
            final var rendered = "Character: " + name;
            return nameForms.isEmpty() ? rendered : rendered + "(" + String.join(", ", nameForms) + ")";
        }
    }

    record Comment(String text) implements Payload {
        @Override
        public String toString() {
            return "Comment: " + text;
        }
    }

    /**
     * A location: a point annotation naming where the following text takes place.
     *
     * @param name     The main location name.
     * @param geoPaths Enclosing geographic names, innermost first.
     */
    record Location(String name, List<String> geoPaths) implements Payload {
        public Location {
            geoPaths = List.copyOf(geoPaths);
        }

        /**
         * Renders the full path of the location, e.g. {@code Café, Paris, France}.
         */
        public String path() {
            return joinPath(name, geoPaths);
        }

        @Override
        public String toString() {
            return "Location: " + path();
        }
    }

    record PageBreak() implements Payload {
        @Override
        public String toString() {
            return "[PAGEBREAK]";
        }
    }

    /**
     * A place description: a location followed by free-form notes.
     */
    record Place(String name, List<String> geoPaths, String notes) implements Payload {
        public Place {
            geoPaths = List.copyOf(geoPaths);
        }

        public String path() {
            return joinPath(name, geoPaths);
        }

        @Override
        public String toString() {
            return "Place: " + path();
        }
    }

    record Status(WritingStatus status) implements Payload {
        @Override
        public String toString() {
            return "Status: " + status.keyword();
        }
    }

    record Tag(List<String> tags) implements Payload {
        public Tag {
            tags = List.copyOf(tags);
        }

        @Override
        public String toString() {
            return "Tags: " + String.join(", ", tags);
        }
    }

    record TableOfContents() implements Payload {
        @Override
        public String toString() {
            return "[TABLEOFCONTENTS]";
        }
    }

    record Target(int words) implements Payload {
        @Override
        public String toString() {
            return "Target: " + words + " words";
        }
    }

    /**
     * A line of prose. Blank lines are text too.
     */
    record Text(String text) implements Payload {
        @Override
        public String toString() {
            return text;
        }
    }

    record Title(String text) implements Payload {
        @Override
        public String toString() {
            return text;
        }
    }

    record Todo(String text) implements Payload {
        @Override
        public String toString() {
            return "TODO: " + text;
        }
    }

    /**
     * An instruction with no known meaning, preserved so that nothing the author wrote is lost.
     *
     * @param instruction The instruction keyword, including the lead character.
     * @param text        The rest of the line.
     */
    record UnmappedInstruction(String instruction, String text) implements Payload {
        @Override
        public String toString() {
            return "[NOTMAPPED] " + instruction + " " + text;
        }
    }

    private static String joinPath(final String name, final List<String> geoPaths) {
        return geoPaths.isEmpty() ? name : name + ", " + String.join(", ", geoPaths);
    }

    private static String renderStructural(final Structural structural) {
        final var title = structural.title();
        final var prefix = structural.kind().label() + " " + structural.numberText();
        return title == null ? prefix : prefix + ": " + title;
    }
}
