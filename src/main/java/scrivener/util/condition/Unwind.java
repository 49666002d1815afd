// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable that carries control to a {@link Restart}.
 * <p>
 * Public only so that methods can declare {@code throws Unwind}; code other than the condition system should neither
 * throw nor catch it. It extends {@link Throwable} directly so that {@code catch (Exception e)} blocks don't intercept
 * it by accident.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
