package com.davisodom.catamap.overmap;

import com.davisodom.catamap.model.OvermapCell;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One overmap tile: 180 x 180 squares on each of 21 z-levels.
 * 
 * Positions the save never described stay empty and project as unexplored.
 */
public class OvermapTile {
    
    private final int tileX;
    private final int tileY;
    private final Path sourceFile;
    
    // [z - Z_MIN][row-major index]
    private final OvermapCell[][] levels = new OvermapCell[OvermapCoords.Z_LEVELS][OvermapCoords.CELLS_PER_LEVEL];
    private int cellCount;
    
    public OvermapTile(int tileX, int tileY, Path sourceFile) {
        this.tileX = tileX;
        this.tileY = tileY;
        this.sourceFile = sourceFile;
    }
    
    public int getTileX() { return tileX; }
    public int getTileY() { return tileY; }
    public Path getSourceFile() { return sourceFile; }
    
    /**
     * Number of positions holding a cell, over all levels.
     */
    public int getCellCount() {
        return cellCount;
    }
    
    void setCell(int index, int z, OvermapCell cell) {
        OvermapCell[] level = levels[z - OvermapCoords.Z_MIN];
        if (level[index] == null) {
            cellCount++;
        }
        level[index] = cell;
    }
    
    /**
     * Cell at (x, y, z), or empty when out of range or never decoded.
     */
    public Optional<OvermapCell> getCell(int x, int y, int z) {
        if (!OvermapCoords.inBounds(x, y) || !OvermapCoords.isValidZ(z)) {
            return Optional.empty();
        }
        return Optional.ofNullable(levels[z - OvermapCoords.Z_MIN][OvermapCoords.toIndex(x, y)]);
    }
    
    /**
     * Decoded cells of one level in row-major order. Empty positions are skipped.
     */
    public List<OvermapCell> getLevel(int z) {
        if (!OvermapCoords.isValidZ(z)) {
            return Collections.emptyList();
        }
        List<OvermapCell> out = new ArrayList<>();
        for (OvermapCell cell : levels[z - OvermapCoords.Z_MIN]) {
            if (cell != null) {
                out.add(cell);
            }
        }
        return out;
    }
    
    /**
     * Every decoded cell, lowest level first.
     */
    public List<OvermapCell> getCells() {
        List<OvermapCell> out = new ArrayList<>(cellCount);
        for (int z = OvermapCoords.Z_MIN; z <= OvermapCoords.Z_MAX; z++) {
            out.addAll(getLevel(z));
        }
        return out;
    }
    
    @Override
    public String toString() {
        return String.format("OvermapTile[<%d,%d> cells=%d from=%s]", tileX, tileY, cellCount, sourceFile);
    }
}
