package com.davisodom.catamap;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Settings for content loading, overmap resolution and debug logging.
 * 
 * Read from YAML. Missing keys keep the defaults below, which match the
 * bundled {@code catamap.yml}.
 */
public class CatamapConfig {
    
    public static final String DEFAULT_RESOURCE = "catamap.yml";
    
    public Content content = new Content();
    public Overmap overmap = new Overmap();
    public Debug debug = new Debug();
    
    public CatamapConfig() {} // For Jackson
    
    /**
     * Load configuration from a YAML file.
     */
    public static CatamapConfig load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Config file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }
    
    /**
     * Load the bundled defaults from the classpath.
     */
    public static CatamapConfig defaults() {
        try (InputStream in = CatamapConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return new CatamapConfig();
            }
            return read(in);
        } catch (IOException e) {
            throw new IllegalStateException("Bundled " + DEFAULT_RESOURCE + " is unreadable", e);
        }
    }
    
    private static CatamapConfig read(InputStream in) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        CatamapConfig config = yamlMapper.readValue(in, CatamapConfig.class);
        if (config == null) {
            return new CatamapConfig();
        }
        config.validate();
        return config;
    }
    
    private void validate() throws IOException {
        if (content == null) content = new Content();
        if (overmap == null) overmap = new Overmap();
        if (debug == null) debug = new Debug();
        if (content.maxChainDepth < 1) {
            throw new IOException("content.maxChainDepth must be at least 1, got " + content.maxChainDepth);
        }
        if (overmap.terrainType == null || overmap.terrainType.isBlank()) {
            throw new IOException("overmap.terrainType must be set");
        }
    }
    
    /**
     * Where content lives and how categories are stored.
     */
    public static class Content {
        /** Subdirectories of data/json walked for *.json files. */
        public List<String> directories = new ArrayList<>(Arrays.asList("mapgen", "overmap"));
        
        /** Types kept as plain lists instead of id-indexed maps. */
        public List<String> sequentialTypes = new ArrayList<>(Arrays.asList("mapgen", "monstergroup", "snippet"));
        
        /** Most copy-from hops followed from a single definition. */
        public int maxChainDepth = 16;
    }
    
    public static class Overmap {
        public String terrainType = "overmap_terrain";
    }
    
    public static class Debug {
        public boolean loading = false;
        public boolean resolving = false;
        public boolean projection = false;
    }
}
