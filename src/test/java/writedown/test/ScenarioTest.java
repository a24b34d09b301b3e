// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import writedown.ast.Node;
import writedown.ast.Payload;
import writedown.parser.Instructions;
import writedown.parser.Parser;

final class ScenarioTest {
    @Test
    void basicBook() {
        final var outcome = ConditionCapture.run(() -> new Parser().parsePath(basicBook + "/**/*.wd"));
        Assertions.assertThat(outcome.warnings()).isEmpty();
        final var document = outcome.result();
        Assertions.assertThat(document).isNotNull();
        Assertions.assertThat(document.toString()).isEqualTo("Book Title");

        final var children = document.children();
        Assertions.assertThat(children).hasSize(4);
        assertNode(children.get(0), new Payload.Title("Book Title"), "_meta.wd", document);
        assertNode(children.get(1), new Payload.Author("Book Author"), "_meta.wd", document);

        final var one = children.get(2);
        assertNode(one, new Payload.Chapter(1, "One"), "ch1.wd", document);
        Assertions.assertThat(one.children()).hasSize(2);
        assertNode(one.children().get(0), new Payload.Scene(1, "One"), "ch1.wd", one);
        assertNode(one.children().get(1), new Payload.Scene(2, "Two"), "ch1.wd", one);
        assertNode(
            one.children().get(0).children().get(0),
            new Payload.Text("Text in chapter one scene one."),
            "ch1.wd",
            one.children().get(0)
        );

        final var two = children.get(3);
        assertNode(two, new Payload.Chapter(2, "Two"), "ch2.wd", document);
        Assertions.assertThat(two.children())
            .extracting(Node::payload)
            .containsExactly(new Payload.Scene(1, "One"), new Payload.Scene(2, "Two"));
        Assertions.assertThat(two.children().get(1).children())
            .extracting(Node::toString)
            .containsExactly("Text in chapter two scene two.");

        Assertions.assertThat(document.wordCount()).isEqualTo(24);
    }

    @Test
    void chapterSpansFiles() {
        final var document = new Parser().parsePath(spanningChapter + "/**/*.wd");
        final var chapters = document.children();
        Assertions.assertThat(chapters).hasSize(2);

        final var one = chapters.get(0);
        Assertions.assertThat(one.payload()).isEqualTo(new Payload.Chapter(1, "ch1"));
        Assertions.assertThat(one.source()).isEqualTo(spanningChapter.resolve("ch1/_meta.wd").toString());
        Assertions.assertThat(one.children())
            .extracting(Node::toString)
            .containsExactly("Scene 1: ch1scene1", "Scene 2: ch1scene2");
        Assertions.assertThat(one.children())
            .extracting(Node::source)
            .containsExactly(
                spanningChapter.resolve("ch1/scene1.wd").toString(),
                spanningChapter.resolve("ch1/scene2.wd").toString()
            );

        final var two = chapters.get(1);
        Assertions.assertThat(two.payload()).isEqualTo(new Payload.Chapter(2, "ch2"));
        Assertions.assertThat(two.children())
            .extracting(Node::toString)
            .containsExactly("Scene 1: ch2scene1");
        Assertions.assertThat(two.children().get(0).children())
            .extracting(Node::toString)
            .containsExactly("The third scene.");
    }

    @Test
    void directoryUsesDefaultDiscovery() {
        final var viaDirectory = new Parser().parsePath(spanningChapter.toString());
        Assertions.assertThat(viaDirectory.find(Payload.Scene.class)).hasSize(3);
    }

    @Test
    void strippedSourcesReproduceInput(@TempDir final Path directory) throws IOException {
        final var included = List.of(
            "@scene Included",
            "Included text."
        );
        final var book = List.of(
            "@title Round Trip",
            "@author Someone",
            "@chapter 1 Start",
            "Opening line.",
            "@scene Arrival",
            "@* a comment",
            "   spanning lines",
            "*@",
            "@include part.wd",
            "@session 5/1/2022 Morning",
            "After the include.",
            "@endsession",
            "@character Alice, Al",
            "Tall and quiet.",
            "@tag one two",
            "Last line."
        );
        Files.writeString(directory.resolve("part.wd"), String.join("\n", included), StandardCharsets.UTF_8);
        final var path = directory.resolve("book.wd");
        Files.writeString(path, String.join("\n", book), StandardCharsets.UTF_8);

        // Session markers produce no nodes and character notes belong to the character node, so neither has a line
        // of its own. Include lines are replaced by the lines of the included file.
        final var withoutNode = Set.of("@session 5/1/2022 Morning", "@endsession", "Tall and quiet.");
        final var expected = new ArrayList<String>();
        for (final var line : book) {
            if (line.startsWith(Instructions.INCLUDE)) {
                for (final var includedLine : included) {
                    expected.add(withoutInstruction(includedLine));
                }
            } else if (!withoutNode.contains(line)) {
                expected.add(withoutInstruction(line));
            }
        }

        final var stripped = new ArrayList<String>();
        for (final var entry : new Parser().parseFile(path).dump()) {
            stripped.add(Instructions.strip(entry.node().raw()));
        }
        Assertions.assertThat(String.join("\n", stripped)).isEqualTo(String.join("\n", expected));
    }

    private static String withoutInstruction(final String line) {
        return Instructions.isInstruction(line) ? Instructions.strip(line) : line;
    }

    private static void assertNode(final Node node, final Payload payload, final String file, final Node parent) {
        Assertions.assertThat(node.payload()).isEqualTo(payload);
        Assertions.assertThat(node.source()).isEqualTo(basicBook.resolve(file).toString());
        Assertions.assertThat(node.parent()).isSameAs(parent);
    }

    private static final Path scenarios = Path.of("src/test/resources/scenarios");
    private static final Path basicBook = scenarios.resolve("basic_book");
    private static final Path spanningChapter = scenarios.resolve("spanning_chapter");
}
