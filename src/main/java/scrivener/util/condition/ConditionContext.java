// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.util.condition;

import java.util.ArrayList;
import java.util.List;
import scrivener.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of installed handlers and active restart points.
 * <p>
 * Contexts are never exposed; the static methods operate on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Offers the given condition to the installed handlers, newest first, and returns normally if all of them
     * decline.
     * <p>
     * A handler may unwind to a restart point, in which case this method throws {@link Unwind}.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().offer(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Like {@link #signal(Condition)}, except that when every handler declines, {@link UnhandledErrorError} is thrown
     * instead of returning. The method therefore never returns normally; it is declared to return the error so that
     * call sites can write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().offer(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs the given callback with a named restart point around it.
     *
     * @return The value returned by {@code callback}, or {@code null} if a handler unwound to this restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the active restart points of the calling thread, newest first.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var result = new ArrayList<@NotNull Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return result;
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void offer(final @NotNull SignaledCondition condition) {
        // A condition signaled from inside a handler is only offered to older handlers, so a handler never sees
        // its own conditions.
        final var start = (currentHandler == null) ? firstHandler : currentHandler.next;
        for (var handler = start; handler != null; handler = handler.next) {
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = saved;
            }
        }
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);
}
