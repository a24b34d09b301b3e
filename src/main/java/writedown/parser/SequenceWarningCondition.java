// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import writedown.ast.StructuralKind;
import writedown.source.SourceLine;
import writedown.util.condition.Condition;

/**
 * A non-fatal condition indicating that an explicit structural number doesn't follow the previous one.
 * <p>
 * The explicit number is honored regardless; this condition exists only to let the author know.
 */
public final class SequenceWarningCondition extends Condition {
    SequenceWarningCondition(
        final SourceLine line,
        final StructuralKind kind,
        final int number,
        final int previous,
        final Anomaly anomaly
    ) {
        super(line.location() + ": " + kind.label() + " " + number + ": " + anomaly.describe(kind, previous));
        this.line = line;
        this.kind = kind;
        this.number = number;
        this.previous = previous;
        this.anomaly = anomaly;
    }

    /**
     * Retrieves the instruction line carrying the offending number.
     */
    public SourceLine line() {
        return line;
    }

    public StructuralKind kind() {
        return kind;
    }

    public int number() {
        return number;
    }

    /**
     * Retrieves the number recorded before the offending one.
     */
    public int previous() {
        return previous;
    }

    public Anomaly anomaly() {
        return anomaly;
    }

    /**
     * The ways an explicit number can break a sequence.
     */
    public enum Anomaly {
        /**
         * The number is less than the previous one.
         */
        REGRESSION("Sequence is less than previous sequence"),
        /**
         * The number is equal to the previous one.
         */
        REPEAT("Sequence is the same as previous sequence"),
        /**
         * The number skips at least one number after the previous one.
         */
        GAP("Sequence contains a gap from previous sequence");

        Anomaly(final String description) {
            this.description = description;
        }

        private String describe(final StructuralKind kind, final int previous) {
            return description + " " + kind.label() + " " + previous;
        }

        private final String description;
    }

    private final SourceLine line;
    private final StructuralKind kind;
    private final int number;
    private final int previous;
    private final Anomaly anomaly;
}
