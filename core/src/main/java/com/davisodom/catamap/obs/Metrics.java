package com.davisodom.catamap.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Counters and stage timings for a loading/resolution run.
 * 
 * Counter names used across the project:
 * files.loaded, files.failed, definitions.stored, definitions.untyped,
 * definitions.collisions, definitions.schemaWarnings, definitions.resolved,
 * definitions.missingParent, definitions.cycles, cells.decoded,
 * cells.resolved, cells.unmatched, cells.missingSymbol
 */
public class Metrics {
    
    private final Logger logger;
    private final Map<String, Long> counters;
    private final Map<String, StageStats> stageStats;
    
    public Metrics(Logger logger) {
        this.logger = logger;
        this.counters = new LinkedHashMap<>();
        this.stageStats = new LinkedHashMap<>();
    }
    
    /**
     * Increment a counter
     */
    public void increment(String counterName) {
        counters.merge(counterName, 1L, Long::sum);
    }
    
    /**
     * Increment a counter by a specific amount
     */
    public void increment(String counterName, long amount) {
        counters.merge(counterName, amount, Long::sum);
    }
    
    /**
     * Get current counter value
     */
    public long getCounter(String counterName) {
        return counters.getOrDefault(counterName, 0L);
    }
    
    /**
     * Record how long a stage (load, resolve, decode, project) took
     */
    public void recordStage(String stage, long millis) {
        stageStats.computeIfAbsent(stage, k -> new StageStats()).record(millis);
    }
    
    public StageStats getStageStats(String stage) {
        return stageStats.get(stage);
    }
    
    /**
     * Get metrics snapshot for reporting
     */
    public MetricsSnapshot getSnapshot() {
        return new MetricsSnapshot(
            new LinkedHashMap<>(counters),
            new LinkedHashMap<>(stageStats)
        );
    }
    
    /**
     * Write every counter and stage on one line each.
     */
    public void logSummary() {
        for (Map.Entry<String, Long> e : counters.entrySet()) {
            logger.info(String.format("metric %s = %d", e.getKey(), e.getValue()));
        }
        for (Map.Entry<String, StageStats> e : stageStats.entrySet()) {
            StageStats s = e.getValue();
            logger.info(String.format("stage %s: runs=%d avg=%dms max=%dms",
                e.getKey(), s.getCount(), s.getAverageMillis(), s.getMaxMillis()));
        }
    }
    
    /**
     * Reset all metrics (for testing)
     */
    public void reset() {
        counters.clear();
        stageStats.clear();
    }
    
    public static class StageStats {
        private long count = 0;
        private long totalMillis = 0;
        private long maxMillis = 0;
        
        public void record(long millis) {
            count++;
            totalMillis += millis;
            maxMillis = Math.max(maxMillis, millis);
        }
        
        public long getCount() { return count; }
        public long getAverageMillis() { return count > 0 ? totalMillis / count : 0; }
        public long getMaxMillis() { return maxMillis; }
    }
    
    /**
     * Metrics snapshot for serialization
     */
    public static class MetricsSnapshot {
        public final Map<String, Long> counters;
        public final Map<String, StageStats> stageStats;
        
        public MetricsSnapshot(Map<String, Long> counters, Map<String, StageStats> stageStats) {
            this.counters = counters;
            this.stageStats = stageStats;
        }
    }
}
