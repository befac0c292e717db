package com.davisodom.catamap.obs;

import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class MetricsTest {
    
    @Test
    void testCountersAndStages() {
        Logger logger = mock(Logger.class);
        Metrics metrics = new Metrics(logger);
        
        metrics.increment("files.loaded");
        metrics.increment("files.loaded", 4);
        metrics.recordStage("load", 10);
        metrics.recordStage("load", 30);
        
        assertEquals(5, metrics.getCounter("files.loaded"));
        assertEquals(0, metrics.getCounter("files.failed"));
        assertEquals(2, metrics.getStageStats("load").getCount());
        assertEquals(20, metrics.getStageStats("load").getAverageMillis());
        assertEquals(30, metrics.getStageStats("load").getMaxMillis());
        assertEquals(5L, metrics.getSnapshot().counters.get("files.loaded"));
        
        metrics.logSummary();
        verify(logger).info(contains("metric files.loaded = 5"));
        
        metrics.reset();
        assertEquals(0, metrics.getCounter("files.loaded"));
        assertNull(metrics.getStageStats("load"));
    }
}
