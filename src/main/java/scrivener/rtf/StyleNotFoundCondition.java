// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import scrivener.util.condition.Condition;

/**
 * A condition type indicating that a style identifier didn't match any style of the template, and a default style
 * was used instead.
 * <p>
 * This condition is never fatal: authoring carries on with the default.
 */
public final class StyleNotFoundCondition extends Condition {
    StyleNotFoundCondition(final String requestedId, final StyleKind kind, final Style fallback) {
        super("Style \"" + requestedId + "\" not found. Defaulting to \"" + fallback.id() + "\".");
        this.requestedId = requestedId;
        this.kind = kind;
        this.fallback = fallback;
    }

    public String requestedId() {
        return requestedId;
    }

    public StyleKind kind() {
        return kind;
    }

    /**
     * Retrieves the style used instead.
     */
    public Style fallback() {
        return fallback;
    }

    private final String requestedId;
    private final StyleKind kind;
    private final Style fallback;
}
