package com.davisodom.catamap.overmap;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orientation suffix of a rotated overmap type, e.g. {@code house_north}.
 * 
 * The rotation distance counts quarter turns counter-clockwise from north,
 * which is how the game stores orientation for line-drawn structures.
 */
public enum CompassDirection {
    NORTH("north", 0, "^"),
    WEST("west", 1, "<"),
    SOUTH("south", 2, "v"),
    EAST("east", 3, ">");
    
    private static final Pattern SUFFIX = Pattern.compile("_(north|south|east|west)$");
    
    private final String suffix;
    private final int rotation;
    private final String pointer;
    
    CompassDirection(String suffix, int rotation, String pointer) {
        this.suffix = suffix;
        this.rotation = rotation;
        this.pointer = pointer;
    }
    
    public String getSuffix() { return suffix; }
    
    /** Quarter turns from north: 0..3. */
    public int getRotation() { return rotation; }
    
    /** Arrow glyph for buildings facing this way. */
    public String getPointer() { return pointer; }
    
    /**
     * Direction the type string ends with, if any.
     */
    public static Optional<CompassDirection> fromType(String type) {
        Matcher m = SUFFIX.matcher(type);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(fromSuffix(m.group(1)));
    }
    
    /**
     * Type string with a trailing compass suffix removed. Unchanged if there is none.
     */
    public static String strip(String type) {
        return SUFFIX.matcher(type).replaceFirst("");
    }
    
    private static CompassDirection fromSuffix(String suffix) {
        for (CompassDirection d : values()) {
            if (d.suffix.equals(suffix)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown direction: " + suffix);
    }
}
