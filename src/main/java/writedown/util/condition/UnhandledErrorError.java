// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler unwound in response to a fatal condition.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the fatal condition nobody handled.
     */
    public Condition condition() {
        return condition;
    }

    private final transient Condition condition;
}
