package com.davisodom.catamap.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One content record from the game's JSON database.
 * 
 * Wraps the raw JSON object and exposes the handful of fields that loading,
 * copy-from resolution and symbol lookup care about. Everything else stays
 * in the underlying node and is reachable through {@link #get(String)}.
 * The node itself is never handed out: callers get copies, so a stored
 * definition cannot be changed after load.
 */
public class Definition {
    
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_ID = "id";
    public static final String FIELD_ABSTRACT = "abstract";
    public static final String FIELD_COPY_FROM = "copy-from";
    public static final String FIELD_COPY_FROM_ALIAS = "copy_from";
    
    private final ObjectNode data;
    private final Path sourceFile;
    
    public Definition(ObjectNode data, Path sourceFile) {
        this.data = Objects.requireNonNull(data, "data cannot be null");
        this.sourceFile = sourceFile;
    }
    
    /**
     * Category of this record (its {@code type} field), or null when absent.
     */
    public String getType() {
        return text(FIELD_TYPE);
    }
    
    /**
     * Key used in indexed categories: {@code id}, falling back to the string
     * form of {@code abstract}.
     */
    public String getId() {
        String id = text(FIELD_ID);
        if (id != null && !id.isEmpty()) {
            return id;
        }
        JsonNode abs = data.get(FIELD_ABSTRACT);
        if (abs != null && abs.isTextual() && !abs.asText().isEmpty()) {
            return abs.asText();
        }
        return null;
    }
    
    /**
     * True for template-only records. The game writes {@code "abstract": "some_id"};
     * {@code "abstract": true} is accepted too. {@code false} and null are not abstract.
     */
    public boolean isAbstract() {
        JsonNode abs = data.get(FIELD_ABSTRACT);
        if (abs == null || abs.isNull()) {
            return false;
        }
        if (abs.isBoolean()) {
            return abs.booleanValue();
        }
        return true;
    }
    
    /**
     * Parent id this record inherits from, if any.
     */
    public String getCopyFrom() {
        String parent = text(FIELD_COPY_FROM);
        if (parent == null || parent.isEmpty()) {
            parent = text(FIELD_COPY_FROM_ALIAS);
        }
        return parent == null || parent.isEmpty() ? null : parent;
    }
    
    public boolean hasCopyFrom() {
        return getCopyFrom() != null;
    }
    
    public String getName() {
        JsonNode name = data.get("name");
        if (name == null || name.isNull()) {
            return null;
        }
        // Newer content stores names as {"str": "..."}
        if (name.isObject()) {
            return name.path("str").asText(null);
        }
        return name.asText();
    }
    
    public String getSymbol() {
        return text("sym");
    }
    
    public String getColor() {
        return text("color");
    }
    
    public List<String> getFlags() {
        JsonNode flags = data.get("flags");
        if (flags == null || !flags.isArray()) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        for (JsonNode flag : flags) {
            out.add(flag.asText());
        }
        return out;
    }
    
    public boolean hasFlag(String flag) {
        return getFlags().contains(flag);
    }
    
    public boolean has(String field) {
        return data.has(field);
    }
    
    /**
     * Copy of one field's value. Editing it does not touch this definition.
     */
    public Optional<JsonNode> get(String field) {
        JsonNode value = data.get(field);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }
    
    public int fieldCount() {
        return data.size();
    }
    
    /**
     * Detached deep copy of the underlying JSON, free for the caller to modify.
     */
    public ObjectNode toJson() {
        return data.deepCopy();
    }
    
    public Path getSourceFile() {
        return sourceFile;
    }
    
    private String text(String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
    
    @Override
    public String toString() {
        return String.format("Definition[%s:%s%s from=%s]",
                getType(), getId(), isAbstract() ? " abstract" : "",
                sourceFile == null ? "?" : sourceFile.getFileName());
    }
}
