package com.davisodom.catamap;

import java.util.logging.Logger;

/**
 * Debug flags and tagged logging helpers.
 * Lines are prefixed with [GAMEDATA], [OVERMAP] or [GRID] so a run can be grepped by stage.
 */
public class DebugFlags {
    
    private static boolean debugLoading = false;
    private static boolean debugResolving = false;
    private static boolean debugProjection = false;
    private static Logger logger;
    
    /**
     * Initialize debug flags from configuration.
     */
    public static void initialize(CatamapConfig config, Logger log) {
        logger = log;
        debugLoading = config.debug.loading;
        debugResolving = config.debug.resolving;
        debugProjection = config.debug.projection;
        
        if (isAnyDebugEnabled()) {
            logger.info("[GAMEDATA] Debug flags initialized: loading=" + debugLoading +
                       ", resolving=" + debugResolving +
                       ", projection=" + debugProjection);
        }
    }
    
    /**
     * Turn everything off and drop the logger.
     */
    public static void reset() {
        debugLoading = false;
        debugResolving = false;
        debugProjection = false;
        logger = null;
    }
    
    public static boolean isDebugLoading() { return debugLoading; }
    public static boolean isDebugResolving() { return debugResolving; }
    public static boolean isDebugProjection() { return debugProjection; }
    
    public static boolean isAnyDebugEnabled() {
        return debugLoading || debugResolving || debugProjection;
    }
    
    /**
     * Log a content loading event if debug enabled.
     */
    public static void debugLoading(String message) {
        if (debugLoading && logger != null) {
            logger.info("[GAMEDATA] DEBUG: " + message);
        }
    }
    
    /**
     * Log a symbol resolution event if debug enabled.
     */
    public static void debugResolving(String message) {
        if (debugResolving && logger != null) {
            logger.info("[OVERMAP] DEBUG: " + message);
        }
    }
    
    /**
     * Log a projection event if debug enabled.
     */
    public static void debugProjection(String message) {
        if (debugProjection && logger != null) {
            logger.info("[GRID] DEBUG: " + message);
        }
    }
    
    /**
     * Log a stage timing.
     */
    public static void logPerformance(String operation, long durationMs) {
        if (logger != null) {
            logger.info(String.format("[GAMEDATA] Performance: %s took %dms", operation, durationMs));
        }
    }
}
