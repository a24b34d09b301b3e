// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.test;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import writedown.ast.Node;
import writedown.ast.Payload;
import writedown.ast.StructuralKind;
import writedown.parser.SequenceTracker;
import writedown.parser.SequenceWarningCondition;
import writedown.source.SourceLine;

final class SequenceTrackerTest {
    @Test
    void numbersStartAtOne() {
        final var tracker = new SequenceTracker();
        final var document = Node.document();
        Assertions.assertThat(tracker.next(document, StructuralKind.CHAPTER, line)).isEqualTo(1);
        Assertions.assertThat(tracker.next(document, StructuralKind.CHAPTER, line)).isEqualTo(2);
    }

    @Test
    void kindsAreNumberedSeparately() {
        final var tracker = new SequenceTracker();
        final var document = Node.document();
        tracker.next(document, StructuralKind.CHAPTER, line);
        tracker.next(document, StructuralKind.CHAPTER, line);
        Assertions.assertThat(tracker.next(document, StructuralKind.SCENE, line)).isEqualTo(1);
    }

    @Test
    void lineagesAreNumberedSeparately() {
        final var tracker = new SequenceTracker();
        final var document = Node.document();
        final var first = new Node(line, new Payload.Part(1, "First"));
        final var second = new Node(line, new Payload.Part(2, "Second"));
        document.append(first);
        document.append(second);
        Assertions.assertThat(tracker.next(first, StructuralKind.CHAPTER, line)).isEqualTo(1);
        Assertions.assertThat(tracker.next(first, StructuralKind.CHAPTER, line)).isEqualTo(2);
        Assertions.assertThat(tracker.next(second, StructuralKind.CHAPTER, line)).isEqualTo(1);
    }

    @Test
    void documentTitleDoesNotAffectNumbering() {
        final var tracker = new SequenceTracker();
        final var document = Node.document();
        tracker.next(document, StructuralKind.CHAPTER, line);
        document.append(new Node(line, new Payload.Title("A Title")));
        Assertions.assertThat(tracker.next(document, StructuralKind.CHAPTER, line)).isEqualTo(2);
    }

    @Test
    void explicitNumberContinuesSequence() {
        final var tracker = new SequenceTracker();
        final var document = Node.document();
        final var outcome = ConditionCapture.run(() -> {
            tracker.set(document, StructuralKind.CHAPTER, 5, line);
            return tracker.next(document, StructuralKind.CHAPTER, line);
        });
        Assertions.assertThat(outcome.result()).isEqualTo(6);
        Assertions.assertThat(outcome.warnings()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "3, 2, REGRESSION",
        "3, 3, REPEAT",
        "3, 5, GAP",
    })
    void anomaliesAreWarnings(final int previous, final int number, final SequenceWarningCondition.Anomaly anomaly) {
        final var tracker = new SequenceTracker();
        final var document = Node.document();
        final var outcome = ConditionCapture.run(() -> {
            tracker.set(document, StructuralKind.SCENE, previous, line);
            return tracker.getOrSet(document, StructuralKind.SCENE, number, line);
        });
        Assertions.assertThat(outcome.error()).isNull();
        Assertions.assertThat(outcome.result()).isEqualTo(number);
        final var warnings = outcome.warnings(SequenceWarningCondition.class);
        Assertions.assertThat(warnings).hasSize(1);
        final var warning = warnings.get(0);
        Assertions.assertThat(warning.anomaly()).isEqualTo(anomaly);
        Assertions.assertThat(warning.kind()).isEqualTo(StructuralKind.SCENE);
        Assertions.assertThat(warning.number()).isEqualTo(number);
        Assertions.assertThat(warning.previous()).isEqualTo(previous);
        Assertions.assertThat(warning.line()).isEqualTo(line);
    }

    @Test
    void anomalousNumberIsStillRecorded() {
        final var tracker = new SequenceTracker();
        final var document = Node.document();
        final var outcome = ConditionCapture.run(() -> {
            tracker.set(document, StructuralKind.ACT, 4, line);
            tracker.set(document, StructuralKind.ACT, 2, line);
            return tracker.next(document, StructuralKind.ACT, line);
        });
        Assertions.assertThat(outcome.result()).isEqualTo(3);
    }

    @Test
    void numberingStopsAtLargestNumber() {
        final var tracker = new SequenceTracker();
        final var document = Node.document();
        final var outcome = ConditionCapture.run(() -> {
            tracker.set(document, StructuralKind.CHAPTER, Integer.MAX_VALUE, line);
            return tracker.next(document, StructuralKind.CHAPTER, line);
        });
        Assertions.assertThat(outcome.result()).isEqualTo(Integer.MAX_VALUE);
        final var warnings = outcome.warnings(SequenceWarningCondition.class);
        Assertions.assertThat(warnings).hasSize(1);
        Assertions.assertThat(warnings.get(0).anomaly()).isEqualTo(SequenceWarningCondition.Anomaly.REPEAT);
    }

    private static final SourceLine line = new SourceLine("string", 1, "@scene");
}
