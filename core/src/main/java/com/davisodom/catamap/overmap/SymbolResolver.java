package com.davisodom.catamap.overmap;

import com.davisodom.catamap.DebugFlags;
import com.davisodom.catamap.data.DefinitionCategory;
import com.davisodom.catamap.data.GameData;
import com.davisodom.catamap.model.Definition;
import com.davisodom.catamap.model.OvermapCell;
import com.davisodom.catamap.obs.Metrics;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Matches decoded overmap cells to terrain definitions and picks the glyph
 * each one is drawn with.
 * 
 * Save types carry orientation in their suffix. Linear terrain such as roads
 * ends in a connection pattern ({@code road_nesw}); rotated buildings end in
 * a compass direction ({@code house_west}). Terrain definitions only exist for
 * the bare type, and their {@code sym} is the north-facing glyph, so the
 * suffix decides which glyph is actually shown.
 */
public class SymbolResolver {
    
    public static final String LINEAR_FLAG = "LINEAR";
    public static final String POINTER_SYMBOL = "^";
    
    enum Outcome {
        LINEAR,
        ORIENTED,
        PLAIN,
        UNMATCHED
    }
    
    private final GameData gameData;
    private final Logger logger;
    private final Metrics metrics;
    private final String terrainType;
    
    public SymbolResolver(GameData gameData, Logger logger, Metrics metrics) {
        this.gameData = gameData;
        this.logger = logger;
        this.metrics = metrics;
        this.terrainType = gameData.getConfig().overmap.terrainType;
    }
    
    /**
     * Resolve every cell of a tile.
     * 
     * @throws MissingCategoryException if no terrain definitions were loaded
     */
    public ResolutionReport resolve(OvermapTile tile) {
        DefinitionCategory terrain = gameData.getCategory(terrainType).orElseThrow(() -> {
            logger.severe(terrainType + " not loaded, cannot resolve " + tile);
            return new MissingCategoryException(terrainType);
        });
        DebugFlags.debugResolving(terrainType + " holds " + terrain.size() + " definition(s)");
        
        long start = System.currentTimeMillis();
        Set<String> reported = new HashSet<>();
        int cells = 0;
        int unmatched = 0;
        int linear = 0;
        int oriented = 0;
        for (OvermapCell cell : tile.getCells()) {
            cells++;
            Outcome outcome = resolveCell(cell, terrain, reported);
            switch (outcome) {
                case UNMATCHED:
                    unmatched++;
                    break;
                case LINEAR:
                    linear++;
                    break;
                case ORIENTED:
                    oriented++;
                    break;
                default:
                    break;
            }
        }
        
        metrics.increment("cells.resolved", cells - unmatched);
        metrics.increment("cells.unmatched", unmatched);
        metrics.recordStage("resolveSymbols", System.currentTimeMillis() - start);
        ResolutionReport report = new ResolutionReport(cells, cells - unmatched, unmatched, linear, oriented);
        logger.info("Resolved " + tile + ": " + report);
        return report;
    }
    
    /**
     * Resolve one cell against the terrain category.
     */
    Outcome resolveCell(OvermapCell cell, DefinitionCategory terrain, Set<String> reported) {
        String type = cell.getType();
        cell.setTerrain(null);
        cell.setOverrideSymbol(null);
        
        // Linear terrain: the suffix is the connection pattern
        Optional<LineSymbol> line = LineSymbol.fromType(type);
        if (line.isPresent()) {
            String base = LineSymbol.strip(type);
            Optional<Definition> linearTerrain = terrain.get(base);
            if (linearTerrain.isPresent() && linearTerrain.get().hasFlag(LINEAR_FLAG)) {
                cell.setTerrain(linearTerrain.get());
                cell.setOverrideSymbol(line.get().getGlyph());
                return Outcome.LINEAR;
            }
            if (linearTerrain.isEmpty()) {
                DebugFlags.debugResolving("no matching " + terrainType + " for " + base);
            }
        }
        
        Optional<CompassDirection> direction = CompassDirection.fromType(type);
        String base = CompassDirection.strip(type);
        Definition definition = terrain.get(base).orElse(null);
        if (definition == null) {
            if (reported.add(base)) {
                logger.warning("failed to get " + terrainType + " for " + base);
            }
            return Outcome.UNMATCHED;
        }
        cell.setTerrain(definition);
        
        String sym = definition.getSymbol();
        if (POINTER_SYMBOL.equals(sym)) {
            // Buildings point the way they face
            if (direction.isPresent()) {
                cell.setOverrideSymbol(direction.get().getPointer());
                return Outcome.ORIENTED;
            }
            if (reported.add(type)) {
                logger.warning("no direction match for " + type);
            }
            return Outcome.PLAIN;
        }
        if (LineSymbol.isLineGlyph(sym)) {
            // Stored glyph faces north; turn it to the stored direction
            int turns = direction.map(CompassDirection::getRotation).orElse(0);
            cell.setOverrideSymbol(LineSymbol.rotateGlyph(sym, turns));
            return turns == 0 ? Outcome.PLAIN : Outcome.ORIENTED;
        }
        return Outcome.PLAIN;
    }
}
