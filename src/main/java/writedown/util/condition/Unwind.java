// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.util.condition;

/**
 * The throwable carrying a control flow transfer to a {@link Restart}.
 * <p>
 * Code should neither catch nor throw it directly. It extends {@link Throwable} rather than {@link Exception} so that
 * ordinary {@code catch (Exception e)} blocks let it through.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
