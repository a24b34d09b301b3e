// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.test;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import writedown.parser.Instructions;

final class InstructionsTest {
    @Test
    void keywordIsLeadingToken() {
        Assertions.assertThat(Instructions.keyword("@chapter 1 One")).isEqualTo("@chapter");
        Assertions.assertThat(Instructions.keyword("@toc")).isEqualTo("@toc");
        Assertions.assertThat(Instructions.keyword("@#comment")).isEqualTo("@#comment");
    }

    @Test
    void textHasNoKeyword() {
        Assertions.assertThat(Instructions.keyword("plain text")).isEmpty();
        Assertions.assertThat(Instructions.keyword("@ spaced")).isEmpty();
        Assertions.assertThat(Instructions.isInstruction("plain @text")).isFalse();
    }

    @Test
    void stripRemovesKeyword() {
        Assertions.assertThat(Instructions.strip("@chapter One")).isEqualTo("One");
        Assertions.assertThat(Instructions.strip("@title   Padded title  ")).isEqualTo("Padded title");
        Assertions.assertThat(Instructions.strip("@pagebreak")).isEmpty();
    }

    @Test
    void stripKeepsText() {
        Assertions.assertThat(Instructions.strip("  Just prose. ")).isEqualTo("Just prose.");
    }
}
