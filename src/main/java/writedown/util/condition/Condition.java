// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that code further up the call stack may care about: a warning about suspicious
 * input, or a fatal error. Unlike exceptions, conditions are delivered to handlers <em>before</em> the stack is
 * unwound, so a handler can record a warning and let the signaling code continue, or unwind to a restart point that
 * was established after the handler itself.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the user-readable message describing this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves a longer user-readable description of this condition. Defaults to {@link #message()}.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
