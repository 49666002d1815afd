// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that code further up the call stack may care about. Unlike an exception, it is
 * shown to handlers <em>before</em> anything is unwound, and signaling one does not by itself alter control flow.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the short, user-readable message of this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable description of this condition. Defaults to {@link #message()}.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
