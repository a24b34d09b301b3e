// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.util;

import java.util.ArrayList;
import java.util.List;
import writedown.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of the operation in progress, intended to be used within try-with-resources.
 * <p>
 * Traces nest: while a trace is open, any trace opened on the same thread is its child. Front ends print the active
 * traces when reporting a condition, so the user can tell which file or include was being processed when a problem
 * occurred. Traces are not a stack trace and should describe the work in the user's terms.
 * <p>
 * A trace must be closed by the thread that opened it.
 */
public final class Trace implements AutoCloseable {
    /**
     * Opens a trace with the given <em>lazily evaluated</em> message. The supplier is called at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Opens a trace with the given message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var context = context();
        next = context.innermost;
        this.messageOrSupplier = messageOrSupplier;
        owner = context;
        context.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's open traces, innermost first.
     */
    public static List<String> activeTraces() {
        final var messages = new ArrayList<String>();
        for (var trace = context().innermost; trace != null; trace = trace.next) {
            messages.add(trace.message());
        }
        return messages;
    }

    /**
     * Does nothing; silences warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == context() : "Trace closed by a different thread";
        assert owner.innermost == this : "Trace chain corrupt";
        owner.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    private static Context context() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself or a MessageSupplier not yet evaluated.
    private Object messageOrSupplier;
    private final Context owner;

    private static final class Context {
        private @Nullable Trace innermost = null;
    }
}
