// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.util;

import java.util.ArrayList;
import java.util.List;
import scrivener.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of what the current thread is doing, meant for try-with-resources.
 * <p>
 * When a condition is reported, the active traces tell the user where the problem happened in terms of the document
 * being assembled ("Serializing document Foo", "Writing Foo.rtf"), not in terms of Java stack frames.
 * <p>
 * A trace belongs to the thread that created it and must be closed by that thread, in reverse order of creation.
 */
public final class Trace implements AutoCloseable {
    /**
     * Registers a new trace whose message is computed on demand, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Registers a new trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var chain = localChain();
        next = chain.innermost;
        this.messageOrSupplier = messageOrSupplier;
        owner = chain;
        chain.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's active traces, innermost first.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localChain().innermost; trace != null; trace = trace.next) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Does nothing. Exists so that the resource variable counts as used.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Removes this trace from the calling thread's chain.
     */
    @Override
    public void close() {
        assert owner == localChain() : "Trace closed by a different thread";
        assert owner.innermost == this : "Trace closed out of order";
        owner.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var message = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = message;
        return message;
    }

    private static Chain localChain() {
        return chain.get();
    }

    @SuppressWarnings("nullness:type.argument") // Never null, CF doesn't understand withInitial.
    private static final ThreadLocal<Chain> chain = ThreadLocal.withInitial(Chain::new);

    private final @Nullable Trace next;
    // Either the message itself or the MessageSupplier that computes it.
    private Object messageOrSupplier;
    private final Chain owner;

    private static final class Chain {
        private @Nullable Trace innermost = null;
    }
}
