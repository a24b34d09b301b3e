// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.util.condition;

import java.util.ArrayList;
import java.util.List;
import writedown.util.SneakyThrow;
import writedown.util.annotation.Nullable;

/**
 * Keeps track of the handlers and restart points installed on the calling thread.
 * <p>
 * Instances are thread-local and not directly accessible; the static methods operate on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as non-fatal.
     * <p>
     * Installed handlers are invoked from the newest to the oldest. If every handler returns normally, so does this
     * method, and the caller carries on. A handler may instead unwind to a restart point, in which case this method
     * throws {@link Unwind}.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given exception as a non-fatal {@link SuppressedExceptionCondition}.
     * <p>
     * Handlers must not unwind in response, since this is called during cleanup.
     */
    public static void signalSuppressedException(final Exception exception) {
        signal(new SuppressedExceptionCondition(exception));
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if every handler returns normally, an
     * {@link UnhandledErrorError} is thrown. Never returns normally; declared to return {@link UnhandledErrorError} so
     * call sites can write {@code throw ConditionContext.error(...)}.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs the given callback with a restart point around it.
     *
     * @param restartName The user-readable name of the restart point.
     * @param callback    The body, which receives the restart object.
     * @return The value returned by {@code callback}, or {@code null} if control was transferred to this restart.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the active restart points, newest first.
     */
    public static List<Restart> restarts() {
        final var restarts = new ArrayList<Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            restarts.add(restart);
        }
        return restarts;
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        for (var handler = firstCandidate(); handler != null; handler = handler.next) {
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = saved;
            }
        }
    }

    private @Nullable Handler firstCandidate() {
        // A condition signaled from inside a handler is only offered to the handlers older than that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);
}
