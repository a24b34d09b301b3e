// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import writedown.util.annotation.Nullable;
import writedown.util.condition.Condition;
import writedown.util.condition.ConditionContext;
import writedown.util.condition.Handler;

/**
 * Runs code with a handler recording every signaled condition. Fatal conditions abort the code.
 */
final class ConditionCapture {
    private ConditionCapture() {
    }

    static <T> Outcome<T> run(final Supplier<? extends T> body) {
        final var warnings = new ArrayList<Condition>();
        final var errors = new ArrayList<Condition>();
        try (final var handler = new Handler(signaled -> {
            if (!signaled.isFatal()) {
                warnings.add(signaled.condition());
                return;
            }
            errors.add(signaled.condition());
            for (final var restart : ConditionContext.restarts()) {
                if (restart.name().equals(ABORT_RESTART)) {
                    restart.unwindTo();
                }
            }
        })) {
            handler.use();
            final T result = ConditionContext.withRestart(ABORT_RESTART, restart -> body.get());
            return new Outcome<>(result, warnings, errors.isEmpty() ? null : errors.get(0));
        }
    }

    /**
     * What running the code produced.
     *
     * @param result   The value returned, or {@code null} if the code was aborted.
     * @param warnings The non-fatal conditions signaled, in order.
     * @param error    The fatal condition that aborted the code, if any.
     */
    record Outcome<T>(@Nullable T result, List<Condition> warnings, @Nullable Condition error) {
        <C extends Condition> List<C> warnings(final Class<C> type) {
            final var matching = new ArrayList<C>();
            for (final var warning : warnings) {
                if (type.isInstance(warning)) {
                    matching.add(type.cast(warning));
                }
            }
            return matching;
        }
    }

    private static final String ABORT_RESTART = "abort-test";
}
