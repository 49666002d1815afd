// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.util.condition.exception;

import java.io.IOException;

/**
 * Signaled when writing a document file fails.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    /**
     * Wraps the given {@link IOException}.
     */
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
