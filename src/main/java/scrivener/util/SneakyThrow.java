// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.util;

/**
 * Escape hatch from checked exceptions, used by the restart mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable without the compiler knowing it is checked.
     * <p>
     * Only {@link scrivener.util.condition.Unwind} is meant to travel this way. Declared to return an
     * {@link AssertionError} so that call sites can write {@code throw SneakyThrow.doThrow(t)} and keep the control
     * flow analysis happy; it never actually returns.
     */
    public static AssertionError doThrow(final Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast disappears from the bytecode; at the call site E is RuntimeException.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> AssertionError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
