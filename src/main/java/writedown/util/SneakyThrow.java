// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.util;

/**
 * Throws checked throwables without declaring them.
 * <p>
 * Used for {@link writedown.util.condition.Unwind}, which restarts use to transfer control flow and which no caller
 * is expected to catch, and for interruptions of code that has no way to report them.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as if it were unchecked.
     * <p>
     * Declared to return {@link UnreachableCodeReachedError} so call sites can write {@code throw doThrow(t)}.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast doesn't exist in bytecode, while javac infers E as RuntimeException.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
