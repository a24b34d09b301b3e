// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.cli;

import writedown.util.Trace;
import writedown.util.condition.Condition;
import writedown.util.condition.ConditionContext;
import writedown.util.condition.HandlerProcedure;
import writedown.util.condition.SignaledCondition;

/**
 * The outermost handler: reports every condition on standard error, and aborts the parse on fatal ones.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Warning: " + condition.condition().message());
            }
            return;
        }
        try (final var streams = Streams.acquire()) {
            showCondition(streams, condition.condition());
        }
        for (final var restart : ConditionContext.restarts()) {
            if (restart.name().equals(ABORT_RESTART)) {
                restart.unwindTo();
            }
        }
        // No abort restart: let the signaling code throw UnhandledErrorError.
    }

    private static void showCondition(final Streams streams, final Condition condition) {
        final var err = streams.err();
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    /**
     * The name of the restart abandoning the parse in progress.
     */
    static final String ABORT_RESTART = "abort-parse";

    private static final FallbackHandler instance = new FallbackHandler();
}
