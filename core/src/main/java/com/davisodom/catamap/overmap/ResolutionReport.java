package com.davisodom.catamap.overmap;

/**
 * Totals from resolving one tile's symbols.
 */
public class ResolutionReport {
    
    private final int cells;
    private final int resolved;
    private final int unmatched;
    private final int linear;
    private final int oriented;
    
    public ResolutionReport(int cells, int resolved, int unmatched, int linear, int oriented) {
        this.cells = cells;
        this.resolved = resolved;
        this.unmatched = unmatched;
        this.linear = linear;
        this.oriented = oriented;
    }
    
    public int getCells() { return cells; }
    public int getResolved() { return resolved; }
    
    /** Cells whose type matched no terrain definition. */
    public int getUnmatched() { return unmatched; }
    
    /** Cells drawn from a linear suffix (roads, rivers, ...). */
    public int getLinear() { return linear; }
    
    /** Cells whose glyph was turned to face their stored direction. */
    public int getOriented() { return oriented; }
    
    @Override
    public String toString() {
        return String.format("ResolutionReport[cells=%d resolved=%d unmatched=%d linear=%d oriented=%d]",
                cells, resolved, unmatched, linear, oriented);
    }
}
