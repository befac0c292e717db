package com.davisodom.catamap.overmap;

import com.davisodom.catamap.DebugFlags;
import com.davisodom.catamap.model.OvermapCell;
import com.davisodom.catamap.obs.Metrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads overmap tile saves ({@code o.X.Y}) and expands their run-length
 * encoded layers into cells.
 * 
 * File layout: an optional first line starting with {@code #} (save version
 * header), then JSON whose {@code layers} array holds one entry per z-level
 * from -10 up to 10. Each entry is a list of {@code [type, count]} runs
 * covering the level's squares in row-major order.
 */
public class TileDecoder {
    
    private static final Pattern TILE_FILE = Pattern.compile("^o\\.(-?\\d+)\\.(-?\\d+)$");
    private static final String COMMENT_MARKER = "#";
    
    private final Logger logger;
    private final Metrics metrics;
    private final ObjectMapper mapper;
    
    public TileDecoder(Logger logger, Metrics metrics) {
        this.logger = logger;
        this.metrics = metrics;
        this.mapper = new ObjectMapper();
    }
    
    /**
     * Read and decode a tile file. Tile coordinates come from an
     * {@code o.X.Y} file name and default to 0,0 otherwise.
     */
    public OvermapTile read(Path file) throws IOException {
        long start = System.currentTimeMillis();
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TileFormatException("Failed to read tile file " + file + ": " + e.getMessage(), e);
        }
        
        int tileX = 0;
        int tileY = 0;
        Matcher name = TILE_FILE.matcher(file.getFileName().toString());
        if (name.matches()) {
            tileX = Integer.parseInt(name.group(1));
            tileY = Integer.parseInt(name.group(2));
        }
        
        JsonNode root;
        try {
            root = mapper.readTree(stripHeader(text));
        } catch (JsonProcessingException e) {
            throw new TileFormatException("Failed to parse JSON file '" + file + "': " + e.getOriginalMessage(), e);
        }
        
        OvermapTile tile = decode(root, tileX, tileY, file);
        metrics.recordStage("decode", System.currentTimeMillis() - start);
        return tile;
    }
    
    /**
     * Drop the first line when it is a comment header.
     */
    static String stripHeader(String text) {
        if (!text.startsWith(COMMENT_MARKER)) {
            return text;
        }
        int newline = text.indexOf('\n');
        return newline < 0 ? "" : text.substring(newline + 1);
    }
    
    /**
     * Expand the {@code layers} of an already parsed save into a tile.
     */
    public OvermapTile decode(JsonNode root, int tileX, int tileY, Path source) throws TileFormatException {
        JsonNode layers = root == null ? null : root.get("layers");
        if (layers == null || !layers.isArray()) {
            throw new TileFormatException("No 'layers' array in " + source);
        }
        if (layers.size() != OvermapCoords.Z_LEVELS) {
            throw new TileFormatException(String.format("Expected %d layers in %s, found %d",
                    OvermapCoords.Z_LEVELS, source, layers.size()));
        }
        
        OvermapTile tile = new OvermapTile(tileX, tileY, source);
        int z = OvermapCoords.Z_MIN;
        for (JsonNode layer : layers) {
            decodeLayer(layer, z, tile);
            z++;
        }
        metrics.increment("cells.decoded", tile.getCellCount());
        DebugFlags.debugResolving("decoded " + tile);
        return tile;
    }
    
    private void decodeLayer(JsonNode layer, int z, OvermapTile tile) throws TileFormatException {
        if (!layer.isArray()) {
            throw new TileFormatException("Layer z=" + z + " is not an array");
        }
        int index = 0;
        boolean overflowed = false;
        for (JsonNode run : layer) {
            if (!run.isArray() || run.size() != 2 || !run.get(0).isTextual() || !run.get(1).canConvertToInt()) {
                throw new TileFormatException("Malformed run " + run + " on layer z=" + z);
            }
            String type = run.get(0).asText();
            int length = run.get(1).asInt();
            if (length < 0) {
                throw new TileFormatException("Negative run length " + length + " on layer z=" + z);
            }
            for (int i = 0; i < length; i++) {
                if (index >= OvermapCoords.CELLS_PER_LEVEL) {
                    overflowed = true;
                    break;
                }
                int x = OvermapCoords.indexToX(index);
                int y = OvermapCoords.indexToY(index);
                tile.setCell(index, z, new OvermapCell(x, y, z, type));
                index++;
            }
        }
        if (overflowed) {
            logger.warning(String.format("Layer z=%d runs exceed %d squares, extra squares dropped",
                    z, OvermapCoords.CELLS_PER_LEVEL));
        } else if (index < OvermapCoords.CELLS_PER_LEVEL) {
            logger.warning(String.format("Layer z=%d covers %d of %d squares, the rest stays unexplored",
                    z, index, OvermapCoords.CELLS_PER_LEVEL));
        }
    }
}
