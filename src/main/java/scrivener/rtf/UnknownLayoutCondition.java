// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.util.Arrays;
import java.util.stream.Collectors;
import scrivener.util.condition.Condition;

/**
 * A condition type indicating that a page layout preset name is not known.
 */
public final class UnknownLayoutCondition extends Condition {
    UnknownLayoutCondition(final String presetName) {
        super("Layout preset \"" + presetName + "\" does not exist");
        this.presetName = presetName;
    }

    /**
     * Retrieves the unknown name.
     */
    public String presetName() {
        return presetName;
    }

    @Override
    public String detailedMessage() {
        final var known = Arrays.stream(LayoutPreset.values())
            .map(LayoutPreset::presetName)
            .collect(Collectors.joining(", "));
        return message() + "\nKnown presets: " + known;
    }

    private final String presetName;
}
