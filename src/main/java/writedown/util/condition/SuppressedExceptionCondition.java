// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.util.condition;

/**
 * A non-fatal condition reporting an exception swallowed during cleanup, such as a failure to close an input file
 * that has already been read to the end.
 */
public final class SuppressedExceptionCondition extends Condition {
    public SuppressedExceptionCondition(final Exception exception) {
        super("Suppressed exception: " + exception);
    }
}
