package com.davisodom.catamap.data;

import com.davisodom.catamap.CatamapConfig;
import com.davisodom.catamap.DebugFlags;
import com.davisodom.catamap.model.Definition;
import com.davisodom.catamap.model.StorageShape;
import com.davisodom.catamap.obs.Metrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads the game's JSON content and holds it by type and id.
 * 
 * Usage: construct, call {@link #load(Path)} once, then query. Loading and
 * copy-from resolution mutate the store; after that it is read-only.
 * Every instance owns its own storage.
 */
public class GameData {
    
    private final CatamapConfig config;
    private final Logger logger;
    private final Metrics metrics;
    private final ObjectMapper mapper;
    private final SchemaValidator validator;
    private final DefinitionResolver resolver;
    private final Set<String> sequentialTypes;
    private final Map<String, DefinitionCategory> categories = new LinkedHashMap<>();
    
    private final LoadReport report = new LoadReport();
    
    public GameData(CatamapConfig config, Logger logger, Metrics metrics) {
        this.config = config;
        this.logger = logger;
        this.metrics = metrics;
        this.mapper = new ObjectMapper();
        this.validator = new SchemaValidator(logger);
        this.resolver = new DefinitionResolver(logger, config.content.maxChainDepth);
        this.sequentialTypes = new HashSet<>(config.content.sequentialTypes);
    }
    
    /**
     * Content root for a game directory: the path itself when it is already
     * the {@code json} directory, otherwise {@code <path>/data/json}.
     */
    public static Path resolveContentRoot(Path gameDir) {
        Path dir = gameDir.toAbsolutePath().normalize();
        Path name = dir.getFileName();
        if (name != null && name.toString().equals("json")) {
            return dir;
        }
        return dir.resolve("data").resolve("json");
    }
    
    /**
     * Load every configured content directory under a game directory, then
     * resolve copy-from chains.
     */
    public LoadReport load(Path gameDir) {
        long start = System.currentTimeMillis();
        Path root = resolveContentRoot(gameDir);
        logger.info("Loading game data from " + root);
        
        for (String subdir : config.content.directories) {
            loadDirectory(root.resolve(subdir));
        }
        resolveDependencies();
        
        long took = System.currentTimeMillis() - start;
        metrics.recordStage("load", took);
        DebugFlags.logPerformance("game data load", took);
        logger.info("Loaded " + report.getDefinitionsStored() + " definition(s) in "
                + categories.size() + " type(s) from " + report.getFilesTotal() + " file(s) ("
                + report.getFilesFailed() + " failed)");
        return report;
    }
    
    /**
     * Recursively load JSON files, top-down: a directory's own files (by name)
     * before any of its subdirectories. Symbolic links to directories are not followed.
     * 
     * @return number of files that failed to parse (zero on success)
     */
    public int loadDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            logger.warning("Content directory not found: " + dir);
            return 0;
        }
        DebugFlags.debugLoading("loading " + dir);
        int[] totals = new int[2];
        walk(dir, totals);
        DebugFlags.debugLoading(String.format("finished loading %d JSON files (%d failed) from %s",
                totals[0], totals[1], dir));
        return totals[1];
    }
    
    private void walk(Path dir, int[] totals) {
        List<Path> files = new ArrayList<>();
        List<Path> subdirs = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            for (Path entry : entries.sorted().collect(Collectors.toList())) {
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    subdirs.add(entry);
                } else if (entry.getFileName().toString().endsWith(".json")) {
                    files.add(entry);
                }
            }
        } catch (IOException e) {
            logger.severe("Failed to list " + dir + ": " + e.getMessage());
            return;
        }
        DebugFlags.debugLoading(String.format("enter: %s (%d files, %d subdirs)", dir, files.size(), subdirs.size()));
        
        for (Path file : files) {
            totals[0]++;
            if (!loadFile(file)) {
                totals[1]++;
            }
        }
        for (Path subdir : subdirs) {
            walk(subdir, totals);
        }
    }
    
    /**
     * Load a single JSON file holding one object or an array of objects.
     * 
     * @return false if the file could not be read or parsed
     */
    public boolean loadFile(Path file) {
        report.fileSeen();
        metrics.increment("files.loaded");
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            logger.severe("Failed to load " + file + ": " + e.getMessage());
            return fail();
        }
        
        List<ObjectNode> objects = new ArrayList<>();
        if (root != null && root.isObject()) {
            objects.add((ObjectNode) root);
        } else if (root != null && root.isArray()) {
            for (JsonNode element : root) {
                if (element.isObject()) {
                    objects.add((ObjectNode) element);
                } else {
                    logger.warning(file + ": skipping non-object entry " + element.getNodeType());
                }
            }
        } else {
            logger.severe("Failed to load " + file + ": expected an object or array");
            return fail();
        }
        
        for (ObjectNode object : objects) {
            insert(object, file);
        }
        return true;
    }
    
    private boolean fail() {
        report.fileFailed();
        metrics.increment("files.failed");
        return false;
    }
    
    private void insert(ObjectNode object, Path file) {
        Definition definition = new Definition(object, file);
        String type = definition.getType();
        if (type == null || type.isEmpty()) {
            logger.warning("'type' not defined in " + file + ", skipping object");
            report.untypedSkipped();
            metrics.increment("definitions.untyped");
            return;
        }
        
        for (String problem : validator.validateDefinition(object)) {
            logger.warning(file + ": " + problem);
            report.schemaWarning();
            metrics.increment("definitions.schemaWarnings");
        }
        
        DefinitionCategory category = categories.computeIfAbsent(type,
                t -> new DefinitionCategory(t, shapeFor(t)));
        
        if (!category.isIndexed()) {
            category.append(definition);
            stored();
            return;
        }
        
        JsonNode idNode = object.get(Definition.FIELD_ID);
        if (idNode != null && idNode.isArray()) {
            insertEach(category, object, idNode, file);
            return;
        }
        
        String id = definition.getId();
        if (id == null) {
            logger.warning(file + ": expected 'id' field for type " + type + ", but none defined");
            return;
        }
        store(category, id, definition);
    }
    
    /**
     * One object describing several ids, e.g. all four rotations of a building.
     */
    private void insertEach(DefinitionCategory category, ObjectNode object, JsonNode ids, Path file) {
        if (ids.isEmpty()) {
            logger.warning(file + ": empty 'id' list for type " + category.getName() + ", skipping object");
            return;
        }
        for (JsonNode each : ids) {
            if (!each.isTextual() || each.asText().isEmpty()) {
                logger.warning(file + ": skipping non-string id " + each + " for type " + category.getName());
                continue;
            }
            ObjectNode copy = object.deepCopy();
            copy.put(Definition.FIELD_ID, each.asText());
            store(category, each.asText(), new Definition(copy, file));
        }
    }
    
    private void store(DefinitionCategory category, String id, Definition definition) {
        Optional<Definition> previous = category.put(id, definition);
        if (previous.isPresent()) {
            logger.warning(String.format("%s: type=%s id=%s already exists (from %s), redefining",
                    definition.getSourceFile(), category.getName(), id, previous.get().getSourceFile()));
            report.collision();
            metrics.increment("definitions.collisions");
            return;
        }
        stored();
    }
    
    private void stored() {
        report.definitionStored();
        metrics.increment("definitions.stored");
    }
    
    /**
     * Resolve copy-from chains: abstract definitions across every type first,
     * then the rest.
     */
    public void resolveDependencies() {
        long start = System.currentTimeMillis();
        int resolvedBefore = report.getResolved();
        int missingBefore = report.getMissingParents();
        int cyclesBefore = report.getCycles();
        for (DefinitionResolver.Pass pass : DefinitionResolver.Pass.values()) {
            DebugFlags.debugLoading("resolving dependencies in gamedata: pass " + pass);
            for (DefinitionCategory category : categories.values()) {
                resolver.resolvePass(category, pass, report);
            }
        }
        metrics.increment("definitions.resolved", report.getResolved() - resolvedBefore);
        metrics.increment("definitions.missingParent", report.getMissingParents() - missingBefore);
        metrics.increment("definitions.cycles", report.getCycles() - cyclesBefore);
        metrics.recordStage("resolveDependencies", System.currentTimeMillis() - start);
    }
    
    /**
     * Storage shape used for a type, fixed by configuration.
     */
    public StorageShape shapeFor(String type) {
        return sequentialTypes.contains(type) ? StorageShape.SEQUENTIAL : StorageShape.INDEXED;
    }
    
    public Optional<DefinitionCategory> getCategory(String type) {
        return Optional.ofNullable(categories.get(type));
    }
    
    public boolean hasCategory(String type) {
        return categories.containsKey(type);
    }
    
    /**
     * Flattened definition by type and id.
     */
    public Optional<Definition> getDefinition(String type, String id) {
        DefinitionCategory category = categories.get(type);
        if (category == null) {
            return Optional.empty();
        }
        return category.get(id);
    }
    
    public Set<String> categoryNames() {
        return Collections.unmodifiableSet(categories.keySet());
    }
    
    public LoadReport getReport() {
        return report;
    }
    
    public CatamapConfig getConfig() {
        return config;
    }
}
