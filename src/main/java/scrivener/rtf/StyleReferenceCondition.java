// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import scrivener.util.condition.Condition;

/**
 * A condition type indicating that a resource registered in a {@link DocumentTemplate} refers to a font, color or
 * style that was not registered before it.
 */
public final class StyleReferenceCondition extends Condition {
    StyleReferenceCondition(final String styleId, final String referenceKind, final String referencedId) {
        super("Style " + styleId + " refers to unregistered " + referenceKind + ' ' + referencedId);
        this.styleId = styleId;
        this.referencedId = referencedId;
    }

    /**
     * Retrieves the identifier of the style with the dangling reference.
     */
    public String styleId() {
        return styleId;
    }

    /**
     * Retrieves the identifier that could not be resolved.
     */
    public String referencedId() {
        return referencedId;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nBase and next styles must be registered before the styles that use them; fonts and "
            + "colors must be registered before any style referring to them.";
    }

    private final String styleId;
    private final String referencedId;
}
