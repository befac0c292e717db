package com.davisodom.catamap.overmap;

import com.davisodom.catamap.CatamapConfig;
import com.davisodom.catamap.data.GameData;
import com.davisodom.catamap.model.OvermapCell;
import com.davisodom.catamap.obs.Metrics;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Glyph selection for linear, pointing and line-drawn terrain.
 */
public class SymbolResolverTest {
    
    private static final String TERRAIN = "["
            + "{'type':'overmap_terrain','id':'road','name':'road','sym':'│','color':'dark_gray','flags':['LINEAR']},"
            + "{'type':'overmap_terrain','id':'field','name':'field','sym':'.','color':'brown'},"
            + "{'type':'overmap_terrain','abstract':'generic_house','sym':'^','color':'light_green'},"
            + "{'type':'overmap_terrain','id':'house','name':'house','copy-from':'generic_house'},"
            + "{'type':'overmap_terrain','id':'bridge','name':'bridge','sym':'│','color':'white'},"
            + "{'type':'overmap_terrain','id':'office_tower_1','name':'office tower','sym':'┌','color':'light_gray'},"
            + "{'type':'overmap_terrain','id':'bunker','name':'bunker','sym':'B'},"
            + "{'type':'overmap_terrain','id':'bunker_ew','name':'bunker wing','sym':'b'}"
            + "]";
    
    @TempDir
    Path gameDir;
    
    private Logger logger;
    private Metrics metrics;
    private GameData gameData;
    private SymbolResolver resolver;
    
    @BeforeEach
    void setUp() throws IOException {
        Path overmap = gameDir.resolve("data/json/overmap");
        Files.createDirectories(overmap);
        Files.writeString(overmap.resolve("terrain.json"), TERRAIN.replace('\'', '"'), StandardCharsets.UTF_8);
        
        logger = mock(Logger.class);
        metrics = new Metrics(logger);
        gameData = new GameData(new CatamapConfig(), logger, metrics);
        gameData.load(gameDir);
        resolver = new SymbolResolver(gameData, logger, metrics);
    }
    
    private OvermapTile tileOf(String... types) throws IOException {
        ObjectNode save = TileDecoderTest.emptySave();
        for (String type : types) {
            TileDecoderTest.addRun(save, 0, type, 1);
        }
        return new TileDecoder(logger, metrics).decode(save, 0, 0, null);
    }
    
    private OvermapCell resolveSingle(String type) throws IOException {
        OvermapTile tile = tileOf(type);
        resolver.resolve(tile);
        return tile.getCell(0, 0, 0).orElseThrow();
    }
    
    @Test
    void testLinearTerrain_UsesSuffixGlyph() throws IOException {
        OvermapCell cell = resolveSingle("road_ew");
        
        assertEquals("road", cell.getTerrain().getId());
        assertEquals("─", cell.getEffectiveSymbol());
        
        assertEquals("┼", resolveSingle("road_nesw").getEffectiveSymbol());
        assertEquals("├", resolveSingle("road_nes").getEffectiveSymbol());
        assertEquals("│", resolveSingle("road_end_north").getEffectiveSymbol());
        assertEquals("┘", resolveSingle("road_wn").getEffectiveSymbol());
    }
    
    @Test
    void testBuildingPointer_FollowsCompassSuffix() throws IOException {
        assertEquals("^", resolveSingle("house_north").getEffectiveSymbol());
        assertEquals("v", resolveSingle("house_south").getEffectiveSymbol());
        assertEquals(">", resolveSingle("house_east").getEffectiveSymbol());
        assertEquals("<", resolveSingle("house_west").getEffectiveSymbol());
        assertEquals("house", resolveSingle("house_west").getTerrain().getId());
    }
    
    @Test
    void testBuildingPointer_WithoutSuffixKeepsDefault() throws IOException {
        OvermapCell cell = resolveSingle("house");
        
        assertNull(cell.getOverrideSymbol());
        assertEquals("^", cell.getEffectiveSymbol());
        verify(logger).warning(contains("no direction match for house"));
    }
    
    @Test
    void testLineDrawnStructure_IsRotatedToStoredDirection() throws IOException {
        assertEquals("│", resolveSingle("bridge_north").getEffectiveSymbol());
        assertEquals("─", resolveSingle("bridge_west").getEffectiveSymbol());
        assertEquals("│", resolveSingle("bridge_south").getEffectiveSymbol());
        assertEquals("─", resolveSingle("bridge_east").getEffectiveSymbol());
        
        assertEquals("┌", resolveSingle("office_tower_1_north").getEffectiveSymbol());
        assertEquals("└", resolveSingle("office_tower_1_west").getEffectiveSymbol());
        assertEquals("┘", resolveSingle("office_tower_1_south").getEffectiveSymbol());
        assertEquals("┐", resolveSingle("office_tower_1_east").getEffectiveSymbol());
    }
    
    @Test
    void testLineDrawnStructure_WithoutSuffixIsUnrotated() throws IOException {
        assertEquals("┌", resolveSingle("office_tower_1").getEffectiveSymbol());
    }
    
    @Test
    void testLinearSuffixOnNonLinearTerrain_FallsThrough() throws IOException {
        OvermapCell cell = resolveSingle("bunker_ew");
        
        assertEquals("bunker_ew", cell.getTerrain().getId(), "Full type is looked up when the base is not LINEAR");
        assertEquals("b", cell.getEffectiveSymbol());
    }
    
    @Test
    void testPlainTerrain_HasNoOverride() throws IOException {
        OvermapCell cell = resolveSingle("field");
        
        assertNull(cell.getOverrideSymbol());
        assertEquals(".", cell.getEffectiveSymbol());
        assertEquals("brown", cell.getTerrain().getColor());
    }
    
    @Test
    void testUnknownType_IsCountedNotThrown() throws IOException {
        OvermapTile tile = tileOf("alien_spire_north", "alien_spire_south", "field");
        
        ResolutionReport report = resolver.resolve(tile);
        
        assertEquals(3, report.getCells());
        assertEquals(2, report.getUnmatched());
        assertEquals(1, report.getResolved());
        assertFalse(tile.getCell(0, 0, 0).orElseThrow().isResolved());
        assertTrue(tile.getCell(2, 0, 0).orElseThrow().isResolved());
        verify(logger, times(1)).warning(contains("failed to get overmap_terrain for alien_spire"));
        assertEquals(2, metrics.getCounter("cells.unmatched"));
    }
    
    @Test
    void testReportCountsLinearAndOriented() throws IOException {
        OvermapTile tile = tileOf("road_ns", "house_east", "bridge_west", "field");
        
        ResolutionReport report = resolver.resolve(tile);
        
        assertEquals(1, report.getLinear());
        assertEquals(2, report.getOriented());
        assertEquals(0, report.getUnmatched());
    }
    
    @Test
    void testMissingTerrainCategory_IsHardFailure() throws IOException {
        GameData empty = new GameData(new CatamapConfig(), logger, metrics);
        SymbolResolver noTerrain = new SymbolResolver(empty, logger, metrics);
        OvermapTile tile = tileOf("field");
        
        MissingCategoryException e = assertThrows(MissingCategoryException.class, () -> noTerrain.resolve(tile));
        assertEquals("overmap_terrain", e.getCategory());
    }
    
    @Test
    void testResolveTwice_IsStable() throws IOException {
        OvermapTile tile = tileOf("house_west");
        
        resolver.resolve(tile);
        resolver.resolve(tile);
        
        assertEquals("<", tile.getCell(0, 0, 0).orElseThrow().getEffectiveSymbol());
    }
}
