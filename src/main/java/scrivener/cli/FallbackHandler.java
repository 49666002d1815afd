// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.cli;

import java.io.PrintStream;
import scrivener.rtf.AuthoringNoticeCondition;
import scrivener.util.Trace;
import scrivener.util.condition.Condition;
import scrivener.util.condition.ConditionContext;
import scrivener.util.condition.HandlerProcedure;
import scrivener.util.condition.SignaledCondition;

/**
 * The handler of last resort: reports every condition on the given stream, and unwinds to the newest restart on fatal
 * ones.
 */
final class FallbackHandler implements HandlerProcedure {
    FallbackHandler(final PrintStream err) {
        this.err = err;
    }

    @Override
    public void handle(final SignaledCondition signaled) {
        final var condition = signaled.condition();
        if (condition instanceof final AuthoringNoticeCondition notice) {
            err.println(notice.message());
            return;
        }
        if (!signaled.isFatal()) {
            err.println("Warning: " + condition.message());
            return;
        }
        showCondition(condition);
        final var restarts = ConditionContext.restarts();
        if (restarts.isEmpty()) {
            return;
        }
        final var restart = restarts.get(0);
        err.println("Invoking restart " + restart.name() + '.');
        restart.unwindTo();
    }

    private void showCondition(final Condition condition) {
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private final PrintStream err;
}
