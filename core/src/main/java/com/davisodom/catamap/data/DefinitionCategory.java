package com.davisodom.catamap.data;

import com.davisodom.catamap.model.Definition;
import com.davisodom.catamap.model.StorageShape;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * All definitions of one content type, stored according to its {@link StorageShape}.
 * Insertion order is kept for both shapes.
 */
public class DefinitionCategory {
    
    private final String name;
    private final StorageShape shape;
    private final Map<String, Definition> indexed;
    private final List<Definition> sequential;
    
    public DefinitionCategory(String name, StorageShape shape) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.shape = Objects.requireNonNull(shape, "shape cannot be null");
        this.indexed = shape == StorageShape.INDEXED ? new LinkedHashMap<>() : null;
        this.sequential = shape == StorageShape.SEQUENTIAL ? new ArrayList<>() : null;
    }
    
    public String getName() { return name; }
    public StorageShape getShape() { return shape; }
    
    public boolean isIndexed() {
        return shape == StorageShape.INDEXED;
    }
    
    /**
     * Store under an id. Only valid for indexed categories.
     * 
     * @return the definition previously held under that id, if any
     */
    Optional<Definition> put(String id, Definition definition) {
        requireShape(StorageShape.INDEXED);
        Objects.requireNonNull(id, "id cannot be null");
        return Optional.ofNullable(indexed.put(id, definition));
    }
    
    /**
     * Append to a sequential category.
     */
    void append(Definition definition) {
        requireShape(StorageShape.SEQUENTIAL);
        sequential.add(definition);
    }
    
    public Optional<Definition> get(String id) {
        if (!isIndexed() || id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(indexed.get(id));
    }
    
    public boolean contains(String id) {
        return isIndexed() && indexed.containsKey(id);
    }
    
    /**
     * Ids in load order. Empty for sequential categories.
     */
    public Set<String> ids() {
        return isIndexed() ? Collections.unmodifiableSet(indexed.keySet()) : Collections.emptySet();
    }
    
    /**
     * Every stored definition, in load order.
     */
    public Collection<Definition> definitions() {
        return isIndexed()
                ? Collections.unmodifiableCollection(indexed.values())
                : Collections.unmodifiableList(sequential);
    }
    
    public int size() {
        return isIndexed() ? indexed.size() : sequential.size();
    }
    
    private void requireShape(StorageShape expected) {
        if (shape != expected) {
            throw new IllegalStateException("Category " + name + " is " + shape + ", not " + expected);
        }
    }
    
    @Override
    public String toString() {
        return "DefinitionCategory[" + name + " " + shape + " size=" + size() + "]";
    }
}
