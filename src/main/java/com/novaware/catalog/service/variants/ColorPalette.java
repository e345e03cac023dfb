package com.novaware.catalog.service.variants;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.model.ColorOption;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes an item's color list: duplicates by hex removed, padded from the default palette
 * up to the minimum (skipping hexes already present) and capped at the maximum.
 */
public class ColorPalette {
    private final List<ColorOption> defaults;
    private final int minColors;
    private final int maxColors;

    public ColorPalette(List<ColorOption> defaults, int minColors, int maxColors) {
        this.defaults = defaults;
        this.minColors = minColors;
        this.maxColors = maxColors;
    }

    public static ColorPalette from(PipelineProperties props) {
        List<ColorOption> defaults = new ArrayList<>();
        for (PipelineProperties.PaletteColor c : props.getDefaultPalette()) {
            defaults.add(new ColorOption(c.getName(), c.getHex()));
        }
        return new ColorPalette(defaults, props.getMinColors(), props.getMaxColors());
    }

    public List<ColorOption> resolve(List<ColorOption> existing) {
        List<ColorOption> out = new ArrayList<>();
        Set<String> hexes = new HashSet<>();
        if (existing != null) {
            for (ColorOption c : existing) {
                if (c == null || c.getHex() == null || c.getHex().isBlank()) continue;
                if (hexes.add(c.getHex().toUpperCase(Locale.ROOT))) out.add(c);
            }
        }
        for (ColorOption d : defaults) {
            if (out.size() >= minColors) break;
            if (hexes.add(d.getHex().toUpperCase(Locale.ROOT))) out.add(new ColorOption(d.getName(), d.getHex()));
        }
        return out.size() > maxColors ? new ArrayList<>(out.subList(0, maxColors)) : out;
    }

    /** Palette hex for a color name, or null when the name is not in the palette. */
    public String hexForName(String name) {
        if (name == null) return null;
        for (ColorOption d : defaults) {
            if (d.getName().equalsIgnoreCase(name.trim())) return d.getHex();
        }
        return null;
    }
}
