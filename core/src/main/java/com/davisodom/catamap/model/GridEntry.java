package com.davisodom.catamap.model;

import java.util.Objects;

/**
 * Render-ready overmap square: glyph, colour name, display name and terrain id.
 * Placeholders carry a null id.
 */
public final class GridEntry {
    
    public static final GridEntry UNEXPLORED = new GridEntry("#", "gray", "Unexplored", null);
    public static final GridEntry UNKNOWN = new GridEntry("!", "gray", "Unknown", null);
    public static final GridEntry MISSING_SYMBOL = new GridEntry("?", "gray", "Unknown", null);
    
    private final String symbol;
    private final String color;
    private final String name;
    private final String id;
    
    public GridEntry(String symbol, String color, String name, String id) {
        this.symbol = symbol;
        this.color = color;
        this.name = name;
        this.id = id;
    }
    
    public String getSymbol() { return symbol; }
    public String getColor() { return color; }
    public String getName() { return name; }
    public String getId() { return id; }
    
    public boolean isPlaceholder() {
        return id == null;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridEntry)) return false;
        GridEntry other = (GridEntry) o;
        return Objects.equals(symbol, other.symbol)
                && Objects.equals(color, other.color)
                && Objects.equals(name, other.name)
                && Objects.equals(id, other.id);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(symbol, color, name, id);
    }
    
    @Override
    public String toString() {
        return "(" + symbol + ", " + color + ", " + name + ", " + id + ")";
    }
}
