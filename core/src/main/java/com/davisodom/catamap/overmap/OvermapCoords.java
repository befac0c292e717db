package com.davisodom.catamap.overmap;

/**
 * Overmap geometry constants and coordinate conversions.
 */
public final class OvermapCoords {
    
    /** Side length of one overmap tile, in map squares. */
    public static final int OMT_SIZE = 180;
    
    /** Squares per z-level of one overmap tile. */
    public static final int CELLS_PER_LEVEL = OMT_SIZE * OMT_SIZE;
    
    /** Side length of a save segment, in overmap squares. */
    public static final int SEGMENT_SIZE = 32;
    
    public static final int Z_MIN = -10;
    public static final int Z_MAX = 10;
    public static final int Z_LEVELS = Z_MAX - Z_MIN + 1;
    
    private OvermapCoords() {}
    
    /**
     * Row-major index to x.
     */
    public static int indexToX(int index) {
        return index % OMT_SIZE;
    }
    
    /**
     * Row-major index to y.
     */
    public static int indexToY(int index) {
        return index / OMT_SIZE;
    }
    
    public static int toIndex(int x, int y) {
        return y * OMT_SIZE + x;
    }
    
    public static boolean inBounds(int x, int y) {
        return x >= 0 && x < OMT_SIZE && y >= 0 && y < OMT_SIZE;
    }
    
    public static boolean isValidZ(int z) {
        return z >= Z_MIN && z <= Z_MAX;
    }
    
    /**
     * Segment holding an overmap position. Rounds toward negative infinity so
     * that -1 lands in segment -1, not 0.
     * 
     * @return {segX, segY, z}
     */
    public static int[] toSegment(int x, int y, int z) {
        return new int[] { Math.floorDiv(x, SEGMENT_SIZE), Math.floorDiv(y, SEGMENT_SIZE), z };
    }
}
