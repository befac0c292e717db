package com.davisodom.catamap.data;

import com.davisodom.catamap.DebugFlags;
import com.davisodom.catamap.model.Definition;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Flattens copy-from chains inside one indexed category.
 * 
 * Resolution runs in two passes so that templates are complete before
 * anything concrete inherits from them:
 * <ol>
 *   <li>abstract definitions that have a copy-from</li>
 *   <li>every other definition that has a copy-from</li>
 * </ol>
 * Each chain is walked through the category's current contents, nearest
 * parent first, for at most {@code maxDepth} hops. Fields are merged furthest
 * ancestor first and the definition's own fields last, so the most specific
 * value wins. The flattened record replaces the original in its id slot.
 */
public class DefinitionResolver {
    
    public enum Pass {
        ABSTRACT,
        CONCRETE
    }
    
    private final Logger logger;
    private final int maxDepth;
    
    public DefinitionResolver(Logger logger, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        this.logger = logger;
        this.maxDepth = maxDepth;
    }
    
    public int getMaxDepth() {
        return maxDepth;
    }
    
    /**
     * Run one pass over a category. Sequential categories are left alone.
     */
    public void resolvePass(DefinitionCategory category, Pass pass, LoadReport report) {
        if (!category.isIndexed()) {
            DebugFlags.debugLoading("skipping sequential type '" + category.getName() + "'");
            return;
        }
        // Snapshot ids: slots are overwritten while we go
        List<String> ids = new ArrayList<>(category.ids());
        for (String id : ids) {
            Definition definition = category.get(id).orElse(null);
            if (definition == null || !definition.hasCopyFrom()) {
                continue;
            }
            boolean wantAbstract = pass == Pass.ABSTRACT;
            if (definition.isAbstract() != wantAbstract) {
                continue;
            }
            resolveOne(category, id, definition, report);
        }
    }
    
    /**
     * Flatten a single definition and store the result under {@code id}.
     * 
     * @return true if at least one ancestor was merged in
     */
    boolean resolveOne(DefinitionCategory category, String id, Definition definition, LoadReport report) {
        List<Definition> ancestors = new ArrayList<>();
        List<String> chainIds = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(id);
        
        String childId = id;
        String nextId = definition.getCopyFrom();
        while (nextId != null && ancestors.size() < maxDepth) {
            if (seen.contains(nextId)) {
                logger.severe(String.format("%s: copy-from cycle at '%s' (chain %s->%s)",
                        id, nextId, id, String.join("->", chainIds)));
                report.cycle();
                break;
            }
            Optional<Definition> parent = category.get(nextId);
            if (parent.isEmpty()) {
                logger.severe(String.format("%s: missing copy-from dependency '%s'", childId, nextId));
                report.missingParent();
                break;
            }
            ancestors.add(parent.get());
            chainIds.add(nextId);
            seen.add(nextId);
            childId = nextId;
            nextId = parent.get().getCopyFrom();
        }
        
        if (ancestors.isEmpty()) {
            return false;
        }
        
        DebugFlags.debugLoading("resolve deps: " + id + "->" + String.join("->", chainIds));
        
        ObjectNode merged = JsonNodeFactory.instance.objectNode();
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            merged.setAll(ancestors.get(i).toJson());
        }
        // Template and parent markers belong to the ancestor, not the child
        merged.remove(Definition.FIELD_ABSTRACT);
        merged.remove(Definition.FIELD_COPY_FROM);
        merged.remove(Definition.FIELD_COPY_FROM_ALIAS);
        merged.setAll(definition.toJson());
        
        category.put(id, new Definition(merged, definition.getSourceFile()));
        report.resolved();
        return true;
    }
}
