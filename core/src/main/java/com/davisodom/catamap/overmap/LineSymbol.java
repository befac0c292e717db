package com.davisodom.catamap.overmap;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Connection patterns of linear overmap terrain (roads, rivers, sewers, ...)
 * and the box-drawing glyph the game shows for each.
 * 
 * The connection bitmask uses bit 3 for north, bit 2 for east, bit 1 for
 * south and bit 0 for west.
 */
public enum LineSymbol {
    END_SOUTH("end_south", "│", "VLINE", 0b1010, 1, 2),
    END_NORTH("end_north", "│", "VLINE", 0b1010, 4, 2),
    NS("ns", "│", "VLINE", 0b1010, 5, 0),
    END_WEST("end_west", "─", "HLINE", 0b0101, 2, 2),
    END_EAST("end_east", "─", "HLINE", 0b0101, 8, 2),
    EW("ew", "─", "HLINE", 0b0101, 10, 0),
    NE("ne", "└", "LLCORNER", 0b1100, 3, 1),
    ES("es", "┌", "ULCORNER", 0b0110, 6, 1),
    SW("sw", "┐", "URCORNER", 0b0011, 12, 1),
    WN("wn", "┘", "LRCORNER", 0b1001, 9, 1),
    NES("nes", "├", "LTEE", 0b1110, 7, 3),
    NEW("new", "┴", "BTEE", 0b1101, 11, 3),
    NSW("nsw", "┤", "RTEE", 0b1011, 13, 3),
    ESW("esw", "┬", "TTEE", 0b0111, 14, 3),
    ISOLATED("isolated", "┼", "PLUS", 0b1111, 0, 4),
    NESW("nesw", "┼", "PLUS", 0b1111, 15, 4);
    
    private static final Pattern SUFFIX = Pattern.compile("_("
            + Arrays.stream(values()).map(LineSymbol::getSuffix).collect(Collectors.joining("|"))
            + ")$");
    
    private final String suffix;
    private final String glyph;
    private final String cursesName;
    private final int connections;
    private final int lineId;
    private final int rotationClass;
    
    LineSymbol(String suffix, String glyph, String cursesName, int connections, int lineId, int rotationClass) {
        this.suffix = suffix;
        this.glyph = glyph;
        this.cursesName = cursesName;
        this.connections = connections;
        this.lineId = lineId;
        this.rotationClass = rotationClass;
    }
    
    public String getSuffix() { return suffix; }
    public String getGlyph() { return glyph; }
    public String getCursesName() { return cursesName; }
    
    /** 4-bit NESW connection mask. */
    public int getConnections() { return connections; }
    
    /** The game's own index for this line shape. */
    public int getLineId() { return lineId; }
    
    /** 0 straight, 1 corner, 2 end, 3 tee, 4 cross. */
    public int getRotationClass() { return rotationClass; }
    
    /**
     * Linear suffix the type string ends with, if any.
     */
    public static Optional<LineSymbol> fromType(String type) {
        Matcher m = SUFFIX.matcher(type);
        if (!m.find()) {
            return Optional.empty();
        }
        String suffix = m.group(1);
        for (LineSymbol s : values()) {
            if (s.suffix.equals(suffix)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
    
    /**
     * Type string with a trailing linear suffix removed. Unchanged if there is none.
     */
    public static String strip(String type) {
        return SUFFIX.matcher(type).replaceFirst("");
    }
    
    /**
     * First entry drawn with this glyph.
     */
    public static Optional<LineSymbol> fromGlyph(String glyph) {
        if (glyph == null) {
            return Optional.empty();
        }
        for (LineSymbol s : values()) {
            if (s.glyph.equals(glyph)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
    
    public static boolean isLineGlyph(String glyph) {
        return fromGlyph(glyph).isPresent();
    }
    
    /**
     * First entry with exactly these connections.
     */
    public static Optional<LineSymbol> fromConnections(int connections) {
        for (LineSymbol s : values()) {
            if (s.connections == connections) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
    
    /**
     * Rotate a 4-bit connection mask left by {@code quarterTurns}, wrapping
     * bits shifted past bit 3 back to bit 0. Turns are taken mod 4.
     */
    public static int rotate(int connections, int quarterTurns) {
        int turns = Math.floorMod(quarterTurns, 4);
        int shifted = (connections & 0b1111) << turns;
        return (shifted & 0b1111) | ((shifted & 0b11110000) >> 4);
    }
    
    /**
     * Glyph for this glyph's shape turned {@code quarterTurns} times.
     * Unknown glyphs come back unchanged.
     */
    public static String rotateGlyph(String glyph, int quarterTurns) {
        Optional<LineSymbol> base = fromGlyph(glyph);
        if (base.isEmpty()) {
            return glyph;
        }
        int rotated = rotate(base.get().connections, quarterTurns);
        return fromConnections(rotated).map(LineSymbol::getGlyph).orElse(glyph);
    }
}
