// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.util.HashMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named page layouts.
 * <p>
 * Use {@link #byName(String)} to look one up by the name users type, such as {@code A4} or {@code royal}.
 */
public enum LayoutPreset {
    /**
     * A4 paper with 2cm margins.
     */
    A4("A4", new PageLayout(16838, 11906, 1134, 1134, 1134, 1134)),
    /**
     * B5 paper, 3cm top margin, 2.5cm bottom margin and 2cm side margins.
     */
    B5("B5", new PageLayout(14173, 9978, 1701, 1417, 1134, 1134)),
    A5("A5", new PageLayout(11906, 8391, 1151, 720, 567, 862)),
    /**
     * Royal octavo, 15.57cm × 23.39cm.
     */
    ROYAL("royal", new PageLayout(13262, 8827, 1152, 720, 864, 864)),
    /**
     * Digest, 5.5in × 8.5in.
     */
    DIGEST("digest", new PageLayout(12240, 7920, 1151, 720, 567, 862)),
    LAS("LAS", new PageLayout(
        Twips.fromCentimeters(24),
        Twips.fromCentimeters(17),
        Twips.fromCentimeters(2.8),
        Twips.fromCentimeters(2.5),
        Twips.fromCentimeters(2),
        Twips.fromCentimeters(2)
    ));

    LayoutPreset(final String presetName, final PageLayout layout) {
        this.presetName = presetName;
        this.layout = layout;
    }

    /**
     * Returns the preset with the given name, or {@code null} if there's none. Names are case-sensitive.
     */
    public static @Nullable LayoutPreset byName(final String name) {
        return Holder.presetsByName.get(name);
    }

    /**
     * Returns the name of this preset as users type it.
     */
    public String presetName() {
        return presetName;
    }

    public PageLayout layout() {
        return layout;
    }

    private final String presetName;
    private final PageLayout layout;

    // Enum constants can't touch static fields of their own class from the constructor, hence the holder.
    private static final class Holder {
        private static final HashMap<String, LayoutPreset> presetsByName = new HashMap<>();

        static {
            for (final var preset : values()) {
                final var previous = presetsByName.put(preset.presetName, preset);
                assert previous == null : "Duplicate layout preset name";
            }
        }
    }
}
