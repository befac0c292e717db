package com.davisodom.catamap.model;

import java.util.Objects;

/**
 * A single overmap position decoded from a save tile.
 * 
 * Position and raw type are fixed at decode time. Symbol resolution later
 * attaches the matching terrain {@link Definition} (owned by the game data,
 * only referenced here) and, for oriented terrain, an override glyph.
 */
public class OvermapCell {
    
    private final int x;
    private final int y;
    private final int z;
    private final String type;
    
    private Definition terrain;
    private String overrideSymbol;
    
    public OvermapCell(int x, int y, int z, String type) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.type = Objects.requireNonNull(type, "type cannot be null");
    }
    
    public int getX() { return x; }
    public int getY() { return y; }
    public int getZ() { return z; }
    
    /** Raw type string as stored in the save, suffix included. */
    public String getType() { return type; }
    
    public Definition getTerrain() { return terrain; }
    public String getOverrideSymbol() { return overrideSymbol; }
    
    public boolean isResolved() {
        return terrain != null;
    }
    
    public void setTerrain(Definition terrain) {
        this.terrain = terrain;
    }
    
    public void setOverrideSymbol(String overrideSymbol) {
        this.overrideSymbol = overrideSymbol;
    }
    
    /**
     * Glyph to draw: the override when set, otherwise the terrain's own {@code sym}.
     * Null when neither is available.
     */
    public String getEffectiveSymbol() {
        if (overrideSymbol != null) {
            return overrideSymbol;
        }
        return terrain == null ? null : terrain.getSymbol();
    }
    
    @Override
    public String toString() {
        return String.format("OvermapCell[<%d,%d,%d> %s sym=%s]", x, y, z, type, getEffectiveSymbol());
    }
}
