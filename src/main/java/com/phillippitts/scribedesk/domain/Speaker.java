package com.phillippitts.scribedesk.domain;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A user-defined speaker.
 *
 * <p>{@code id} is stable for the lifetime of the application and never reused; every internal
 * reference (segment ownership, active speaker, line colour) goes through it. {@code name} and
 * {@code color} change by replacing the record in the registry.
 *
 * @param id    stable identifier (e.g. {@code spk-1})
 * @param name  display name, resolved at render/export time
 * @param color display colour as {@code #rrggbb}
 */
public record Speaker(String id, String name, String color) {

    private static final Pattern HEX_COLOR = Pattern.compile("#[0-9a-fA-F]{6}");

    public Speaker {
        Objects.requireNonNull(id, "Speaker id must not be null");
        Objects.requireNonNull(name, "Speaker name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Speaker name must not be blank");
        }
        if (!isValidColor(color)) {
            throw new IllegalArgumentException("Speaker color must be #rrggbb, got: " + color);
        }
        name = name.strip();
        color = color.toLowerCase(java.util.Locale.ROOT);
    }

    public Speaker withName(String newName) {
        return new Speaker(id, newName, color);
    }

    public Speaker withColor(String newColor) {
        return new Speaker(id, name, newColor);
    }

    public static boolean isValidColor(String color) {
        return color != null && HEX_COLOR.matcher(color).matches();
    }
}
