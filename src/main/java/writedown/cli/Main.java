// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.cli;

import java.util.List;
import writedown.ast.Node;
import writedown.parser.Parser;
import writedown.util.condition.ConditionContext;
import writedown.util.condition.Handler;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        for (final var arg : args) {
            if (arg.startsWith("-")) {
                try (final var streams = Streams.acquire()) {
                    streams.err().println("Unknown option " + arg);
                    streams.err().println("Usage: writedown [path-or-glob...]");
                    return ExitCode.USAGE;
                }
            }
        }

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart(FallbackHandler.ABORT_RESTART, restart -> {
                final var document = new Parser().parsePaths(List.of(args));
                printOutline(document);
                return ExitCode.SUCCESS;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static void printOutline(final Node document) {
        try (final var streams = Streams.acquire()) {
            final var out = streams.out();
            out.println(document);
            for (final var entry : document.dump()) {
                out.println(entry.node().sourceInfo(entry.level()) + " " + entry.node());
            }
            out.flush();
        }
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
