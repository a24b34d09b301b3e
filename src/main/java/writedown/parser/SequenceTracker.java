// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import java.util.HashMap;
import writedown.ast.Node;
import writedown.ast.Payload;
import writedown.ast.StructuralKind;
import writedown.source.SourceLine;
import writedown.util.annotation.Nullable;
import writedown.util.condition.ConditionContext;

/**
 * Numbers structural elements.
 * <p>
 * Every structural kind is numbered separately under each structural lineage, so that e.g. chapter numbering restarts
 * in every part. Explicit numbers given by the author are honored, but checked against the previous number under the
 * same key; anything other than the successor signals a {@link SequenceWarningCondition}.
 * <p>
 * A tracker is shared by every parser taking part in the same parse, including parsers for included files.
 */
public final class SequenceTracker {
    /**
     * Returns the next number for the given kind of structural element appended to {@code holder}.
     * <p>
     * Numbering stops at {@link Integer#MAX_VALUE}: once there, every further element gets that number again and a
     * {@link SequenceWarningCondition.Anomaly#REPEAT} warning is signaled.
     *
     * @param line The instruction line the element comes from, reported in warnings.
     */
    public int next(final Node holder, final StructuralKind kind, final SourceLine line) {
        final var key = key(holder, kind);
        final var previous = last.get(key);
        if (previous == null) {
            last.put(key, 1);
            return 1;
        }
        if (previous == Integer.MAX_VALUE) {
            ConditionContext.signal(new SequenceWarningCondition(
                line,
                kind,
                previous,
                previous,
                SequenceWarningCondition.Anomaly.REPEAT
            ));
            return previous;
        }
        last.put(key, previous + 1);
        return previous + 1;
    }

    /**
     * Records an explicit number for the given kind of structural element appended to {@code holder}.
     * <p>
     * If the number is not the successor of the previous number recorded under the same key, a non-fatal
     * {@link SequenceWarningCondition} is signaled. The number is recorded either way.
     *
     * @param line The instruction line the number comes from, reported in warnings.
     */
    public void set(final Node holder, final StructuralKind kind, final int number, final SourceLine line) {
        final var previous = last.put(key(holder, kind), number);
        if (previous == null) {
            return;
        }
        final SequenceWarningCondition.Anomaly anomaly;
        if (number < previous) {
            anomaly = SequenceWarningCondition.Anomaly.REGRESSION;
        } else if (number == previous) {
            anomaly = SequenceWarningCondition.Anomaly.REPEAT;
        } else if (number > previous + 1) {
            anomaly = SequenceWarningCondition.Anomaly.GAP;
        } else {
            return;
        }
        ConditionContext.signal(new SequenceWarningCondition(line, kind, number, previous, anomaly));
    }

    /**
     * Records {@code number} if the author supplied one, otherwise generates the next number.
     *
     * @return The number the structural element gets.
     */
    public int getOrSet(
        final Node holder,
        final StructuralKind kind,
        final @Nullable Integer number,
        final SourceLine line
    ) {
        if (number == null) {
            return next(holder, kind, line);
        }
        set(holder, kind, number, line);
        return number;
    }

    /**
     * Returns the key numbers are tracked under, such as {@code Document > Part 1: Beginnings [Chapter]}.
     * <p>
     * The document root always appears as {@code Document}, regardless of its title.
     */
    static String key(final Node holder, final StructuralKind kind) {
        final var builder = new StringBuilder();
        for (final var node : holder.structuralLineage()) {
            if (builder.length() != 0) {
                builder.append(" > ");
            }
            builder.append(node.payload() instanceof Payload.Document ? "Document" : node.toString());
        }
        return builder.append(" [").append(kind.label()).append(']').toString();
    }

    private final HashMap<String, Integer> last = new HashMap<>();
}
