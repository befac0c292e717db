package com.davisodom.catamap.overmap;

import com.davisodom.catamap.model.OvermapCell;
import com.davisodom.catamap.obs.Metrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Run-length expansion of overmap tile saves.
 */
public class TileDecoderTest {
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    @TempDir
    Path saveDir;
    
    private TileDecoder decoder;
    private Metrics metrics;
    
    @BeforeEach
    void setUp() {
        Logger logger = mock(Logger.class);
        metrics = new Metrics(logger);
        decoder = new TileDecoder(logger, metrics);
    }
    
    /**
     * Save JSON with 21 empty layers; callers fill the ones they need.
     */
    static ObjectNode emptySave() {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode layers = root.putArray("layers");
        for (int i = 0; i < OvermapCoords.Z_LEVELS; i++) {
            layers.addArray();
        }
        return root;
    }
    
    static void addRun(ObjectNode save, int z, String type, int length) {
        ArrayNode layer = (ArrayNode) save.get("layers").get(z - OvermapCoords.Z_MIN);
        layer.addArray().add(type).add(length);
    }
    
    @Test
    void testFullLevel_ProducesEveryCellInRowMajorOrder() throws IOException {
        ObjectNode save = emptySave();
        addRun(save, 0, "field", 200);
        addRun(save, 0, "forest", 1);
        addRun(save, 0, "field", OvermapCoords.CELLS_PER_LEVEL - 201);
        
        OvermapTile tile = decoder.decode(save, 0, 0, null);
        
        List<OvermapCell> level = tile.getLevel(0);
        assertEquals(OvermapCoords.CELLS_PER_LEVEL, level.size(), "No gaps, no overlaps");
        for (int i = 0; i < level.size(); i++) {
            OvermapCell cell = level.get(i);
            assertEquals(i % OvermapCoords.OMT_SIZE, cell.getX());
            assertEquals(i / OvermapCoords.OMT_SIZE, cell.getY());
            assertEquals(0, cell.getZ());
        }
        // index 200 -> (20, 1)
        assertEquals("forest", tile.getCell(20, 1, 0).orElseThrow().getType());
        assertEquals("field", tile.getCell(19, 1, 0).orElseThrow().getType());
        assertEquals("field", tile.getCell(21, 1, 0).orElseThrow().getType());
        assertEquals(OvermapCoords.CELLS_PER_LEVEL, tile.getCellCount());
        assertEquals(OvermapCoords.CELLS_PER_LEVEL, metrics.getCounter("cells.decoded"));
    }
    
    @Test
    void testLayersMapToLevelsFromBottom() throws IOException {
        ObjectNode save = emptySave();
        addRun(save, -10, "deep_rock", 1);
        addRun(save, 10, "open_air", 1);
        
        OvermapTile tile = decoder.decode(save, 0, 0, null);
        
        assertEquals("deep_rock", tile.getCell(0, 0, -10).orElseThrow().getType());
        assertEquals("open_air", tile.getCell(0, 0, 10).orElseThrow().getType());
        assertTrue(tile.getCell(0, 0, 0).isEmpty());
    }
    
    @Test
    void testShortLevel_LeavesRestEmpty() throws IOException {
        ObjectNode save = emptySave();
        addRun(save, 0, "field", 10);
        
        OvermapTile tile = decoder.decode(save, 0, 0, null);
        
        assertTrue(tile.getCell(9, 0, 0).isPresent());
        assertTrue(tile.getCell(10, 0, 0).isEmpty());
        assertEquals(10, tile.getCellCount());
    }
    
    @Test
    void testOverflowingRuns_AreTruncated() throws IOException {
        ObjectNode save = emptySave();
        addRun(save, 0, "field", OvermapCoords.CELLS_PER_LEVEL + 50);
        
        OvermapTile tile = decoder.decode(save, 0, 0, null);
        
        assertEquals(OvermapCoords.CELLS_PER_LEVEL, tile.getCellCount());
        assertTrue(tile.getCell(179, 179, 0).isPresent());
    }
    
    @Test
    void testWrongLayerCount_IsRejected() {
        ObjectNode save = MAPPER.createObjectNode();
        save.putArray("layers").addArray();
        
        assertThrows(TileFormatException.class, () -> decoder.decode(save, 0, 0, null));
    }
    
    @Test
    void testMissingLayers_IsRejected() {
        assertThrows(TileFormatException.class, () -> decoder.decode(MAPPER.createObjectNode(), 0, 0, null));
    }
    
    @Test
    void testMalformedRun_IsRejected() {
        ObjectNode save = emptySave();
        ((ArrayNode) save.get("layers").get(10)).addArray().add("field");
        
        assertThrows(TileFormatException.class, () -> decoder.decode(save, 0, 0, null));
    }
    
    @Test
    void testRead_SkipsCommentHeaderAndParsesName() throws IOException {
        ObjectNode save = emptySave();
        addRun(save, 0, "field", OvermapCoords.CELLS_PER_LEVEL);
        Path file = saveDir.resolve("o.-1.2");
        Files.writeString(file, "# version 33\n" + MAPPER.writeValueAsString(save), StandardCharsets.UTF_8);
        
        OvermapTile tile = decoder.read(file);
        
        assertEquals(-1, tile.getTileX());
        assertEquals(2, tile.getTileY());
        assertEquals(file, tile.getSourceFile());
        assertEquals("field", tile.getCell(5, 5, 0).orElseThrow().getType());
    }
    
    @Test
    void testRead_WithoutHeader() throws IOException {
        ObjectNode save = emptySave();
        addRun(save, 1, "field", 3);
        Path file = saveDir.resolve("tile.json");
        Files.writeString(file, MAPPER.writeValueAsString(save), StandardCharsets.UTF_8);
        
        OvermapTile tile = decoder.read(file);
        
        assertEquals(0, tile.getTileX());
        assertEquals(3, tile.getLevel(1).size());
    }
    
    @Test
    void testRead_BadJsonOrMissingFile() throws IOException {
        Path bad = saveDir.resolve("o.0.0");
        Files.writeString(bad, "# header\n{ not json", StandardCharsets.UTF_8);
        
        assertThrows(TileFormatException.class, () -> decoder.read(bad));
        assertThrows(TileFormatException.class, () -> decoder.read(saveDir.resolve("o.9.9")));
    }
    
    @Test
    void testStripHeader() {
        assertEquals("{}", TileDecoder.stripHeader("# comment\n{}"));
        assertEquals("{}", TileDecoder.stripHeader("{}"));
        assertEquals("", TileDecoder.stripHeader("# only a comment"));
    }
}
