package com.davisodom.catamap;

import com.davisodom.catamap.data.GameData;
import com.davisodom.catamap.data.LoadReport;
import com.davisodom.catamap.model.GridEntry;
import com.davisodom.catamap.obs.Metrics;
import com.davisodom.catamap.overmap.GridProjector;
import com.davisodom.catamap.overmap.OvermapTile;
import com.davisodom.catamap.overmap.ResolutionReport;
import com.davisodom.catamap.overmap.SymbolResolver;
import com.davisodom.catamap.overmap.TileDecoder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Entry point tying the pieces together.
 * 
 * Opening a game directory loads and resolves its content once; tiles are
 * then decoded, resolved against it and projected level by level.
 */
public class Catamap {
    
    private final Logger logger;
    private final CatamapConfig config;
    private final Metrics metrics;
    private final GameData gameData;
    private final TileDecoder tileDecoder;
    private final SymbolResolver symbolResolver;
    private final GridProjector gridProjector;
    private final LoadReport loadReport;
    
    private Catamap(Path gameDir, CatamapConfig config, Logger logger) {
        this.logger = logger;
        this.config = config;
        this.metrics = new Metrics(logger);
        
        DebugFlags.initialize(config, logger);
        
        this.gameData = new GameData(config, logger, metrics);
        this.loadReport = gameData.load(gameDir);
        if (!loadReport.isSuccess()) {
            logger.warning(loadReport.getFilesFailed() + " content file(s) failed to load");
        }
        
        this.tileDecoder = new TileDecoder(logger, metrics);
        this.symbolResolver = new SymbolResolver(gameData, logger, metrics);
        this.gridProjector = new GridProjector(logger, metrics);
    }
    
    /**
     * Load a game directory with the bundled default configuration.
     */
    public static Catamap open(Path gameDir) {
        return open(gameDir, CatamapConfig.defaults(), Logger.getLogger("catamap"));
    }
    
    public static Catamap open(Path gameDir, CatamapConfig config, Logger logger) {
        return new Catamap(gameDir, config, logger);
    }
    
    /**
     * Decode a tile save and resolve its symbols.
     * 
     * @throws IOException if the tile file cannot be read or decoded
     * @throws com.davisodom.catamap.overmap.MissingCategoryException if no terrain was loaded
     */
    public OvermapTile loadTile(Path tileFile) throws IOException {
        OvermapTile tile = tileDecoder.read(tileFile);
        ResolutionReport report = symbolResolver.resolve(tile);
        if (report.getUnmatched() > 0) {
            logger.warning(report.getUnmatched() + " square(s) of " + tile + " have no terrain definition");
        }
        return tile;
    }
    
    /**
     * Render-ready grid of one level of a loaded tile.
     */
    public GridEntry[][] overmap(OvermapTile tile, int z) {
        return gridProjector.project(tile, z);
    }
    
    public GameData getGameData() { return gameData; }
    public LoadReport getLoadReport() { return loadReport; }
    public Metrics getMetrics() { return metrics; }
    public CatamapConfig getConfig() { return config; }
}
