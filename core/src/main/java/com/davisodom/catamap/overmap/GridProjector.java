package com.davisodom.catamap.overmap;

import com.davisodom.catamap.DebugFlags;
import com.davisodom.catamap.model.Definition;
import com.davisodom.catamap.model.GridEntry;
import com.davisodom.catamap.model.OvermapCell;
import com.davisodom.catamap.obs.Metrics;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Flattens one z-level of a resolved tile into a [y][x] grid of
 * (glyph, colour, name, id) ready for a renderer.
 */
public class GridProjector {
    
    private final Logger logger;
    private final Metrics metrics;
    
    public GridProjector(Logger logger, Metrics metrics) {
        this.logger = logger;
        this.metrics = metrics;
    }
    
    /**
     * Project a level. Squares never decoded are {@link GridEntry#UNEXPLORED};
     * squares without a terrain match are {@link GridEntry#UNKNOWN}; matched
     * terrain with no glyph at all is {@link GridEntry#MISSING_SYMBOL}.
     */
    public GridEntry[][] project(OvermapTile tile, int z) {
        if (!OvermapCoords.isValidZ(z)) {
            throw new IllegalArgumentException("z must be within " + OvermapCoords.Z_MIN + ".." + OvermapCoords.Z_MAX + ", got " + z);
        }
        long start = System.currentTimeMillis();
        int placeholders = 0;
        int unknown = 0;
        GridEntry[][] grid = new GridEntry[OvermapCoords.OMT_SIZE][OvermapCoords.OMT_SIZE];
        for (int y = 0; y < OvermapCoords.OMT_SIZE; y++) {
            for (int x = 0; x < OvermapCoords.OMT_SIZE; x++) {
                GridEntry entry = entryFor(tile.getCell(x, y, z), x, y);
                if (entry.isPlaceholder()) {
                    placeholders++;
                }
                if (entry == GridEntry.UNKNOWN) {
                    unknown++;
                }
                grid[y][x] = entry;
            }
        }
        if (unknown > 0) {
            logger.warning(String.format("missing overmap terrain data for %d square(s) on z=%d of %s", unknown, z, tile));
        }
        metrics.recordStage("project", System.currentTimeMillis() - start);
        DebugFlags.debugProjection(String.format("projected z=%d of %s (%d placeholder squares)", z, tile, placeholders));
        return grid;
    }
    
    GridEntry entryFor(Optional<OvermapCell> maybeCell, int x, int y) {
        if (maybeCell.isEmpty()) {
            return GridEntry.UNEXPLORED;
        }
        OvermapCell cell = maybeCell.get();
        Definition terrain = cell.getTerrain();
        if (terrain == null) {
            logger.fine(String.format("missing overmap terrain data at <%d,%d> (type=%s)", x, y, cell.getType()));
            return GridEntry.UNKNOWN;
        }
        String sym = cell.getEffectiveSymbol();
        if (sym == null || sym.isEmpty()) {
            logger.warning(String.format("missing symbol for <%d,%d> (type=%s)", x, y, cell.getType()));
            metrics.increment("cells.missingSymbol");
            return GridEntry.MISSING_SYMBOL;
        }
        return new GridEntry(sym, terrain.getColor(), terrain.getName(), terrain.getId());
    }
    
    /**
     * Plain text rendering of a projected level, one line per row.
     */
    public static String toText(GridEntry[][] grid) {
        StringBuilder sb = new StringBuilder();
        for (GridEntry[] row : grid) {
            for (GridEntry entry : row) {
                sb.append(entry.getSymbol());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
