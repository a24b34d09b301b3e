// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.test;

import java.util.List;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import writedown.ast.Node;
import writedown.ast.Payload;
import writedown.ast.WritingStatus;
import writedown.parser.ParseErrorCondition;
import writedown.parser.Parser;

final class MetadataTest {
    @Test
    void title() {
        Assertions.assertThat(single("@title A Title")).isEqualTo(new Payload.Title("A Title"));
    }

    @Test
    void author() {
        Assertions.assertThat(single("@author Jane Doe")).isEqualTo(new Payload.Author("Jane Doe"));
    }

    @Test
    void todo() {
        Assertions.assertThat(single("@todo Rewrite the ending")).isEqualTo(new Payload.Todo("Rewrite the ending"));
    }

    @ParameterizedTest
    @EnumSource(WritingStatus.class)
    void status(final WritingStatus status) {
        Assertions.assertThat(single("@status " + status.keyword())).isEqualTo(new Payload.Status(status));
    }

    @Test
    void unknownStatusIsFatal() {
        final var outcome = ConditionCapture.run(() -> new Parser().parseString("text\n@status Done"));
        Assertions.assertThat(outcome.result()).isNull();
        Assertions.assertThat(outcome.error())
            .isInstanceOfSatisfying(ParseErrorCondition.class, condition -> {
                Assertions.assertThat(condition.line().lineNumber()).isEqualTo(2);
                Assertions.assertThat(condition.message()).contains("'Done'");
            });
    }

    @Test
    void tags() {
        Assertions.assertThat(single("@tag  draft  needs-work\tlater"))
            .isEqualTo(new Payload.Tag(List.of("draft", "needs-work", "later")));
    }

    @Test
    void target() {
        Assertions.assertThat(single("@target 1000")).isEqualTo(new Payload.Target(1000));
    }

    @Test
    void nonNumericTargetIsUnmapped() {
        Assertions.assertThat(single("@target lots"))
            .isEqualTo(new Payload.UnmappedInstruction("@target", "lots"));
    }

    @Test
    void placeholders() {
        final var document = new Parser().parseString("@tableofcontents\n@toc\n@pagebreak");
        Assertions.assertThat(document.children())
            .extracting(Node::payload)
            .containsExactly(new Payload.TableOfContents(), new Payload.TableOfContents(), new Payload.PageBreak());
    }

    @Test
    void unknownInstructionIsKept() {
        final var document = new Parser().parseString("@foo bar baz");
        Assertions.assertThat(document.children()).hasSize(1);
        final var node = document.children().get(0);
        Assertions.assertThat(node.payload()).isEqualTo(new Payload.UnmappedInstruction("@foo", "bar baz"));
        Assertions.assertThat(node.toString()).isEqualTo("[NOTMAPPED] @foo bar baz");
    }

    @Test
    void keywordsMatchExactly() {
        Assertions.assertThat(single("@chapters Many"))
            .isEqualTo(new Payload.UnmappedInstruction("@chapters", "Many"));
        Assertions.assertThat(single("@Title Shouting"))
            .isEqualTo(new Payload.UnmappedInstruction("@Title", "Shouting"));
    }

    @Test
    void plainLinesAreText() {
        final var document = new Parser().parseString("First line.\n\n  Indented @ line.");
        Assertions.assertThat(document.children())
            .extracting(Node::payload)
            .containsExactly(
                new Payload.Text("First line."),
                new Payload.Text(""),
                new Payload.Text("  Indented @ line.")
            );
    }

    @Test
    void nodesKeepTheirLines() {
        final var document = new Parser().parseString("one\n@title Two");
        final var title = document.children().get(1);
        Assertions.assertThat(title.source()).isEqualTo("string");
        Assertions.assertThat(title.lineNumber()).isEqualTo(2);
        Assertions.assertThat(title.raw()).isEqualTo("@title Two");
        Assertions.assertThat(title.parent()).isSameAs(document);
    }

    private static Payload single(final String text) {
        final var document = new Parser().parseString(text);
        Assertions.assertThat(document.children()).hasSize(1);
        return document.children().get(0).payload();
    }
}
