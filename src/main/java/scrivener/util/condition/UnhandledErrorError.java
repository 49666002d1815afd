// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.util.condition;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler took care of a fatal condition.
 * <p>
 * This is how a fatal condition reaches a caller that installed no handlers at all: the call fails with this error,
 * carrying the condition. It extends {@link AssertionError} because reaching it without a handler usually means the
 * program forgot to establish one.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the fatal condition nobody handled.
     */
    public @NotNull Condition condition() {
        return condition;
    }

    @SuppressFBWarnings(value = "SE_TRANSIENT_FIELD_NOT_RESTORED", justification = "Conditions aren't serializable")
    private final transient @NotNull Condition condition;
}
