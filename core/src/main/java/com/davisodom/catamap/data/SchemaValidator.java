package com.davisodom.catamap.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * JSON Schema check for content definitions.
 * 
 * Only the fields resolution depends on are constrained (type, id, abstract,
 * copy-from, flags). A failed check is reported, never fatal: the caller
 * still stores the definition.
 */
public class SchemaValidator {
    
    public static final String DEFINITION_SCHEMA = "definition.json";
    
    private final Logger logger;
    private final JsonSchema definitionSchema;
    
    public SchemaValidator(Logger logger) {
        this.logger = logger;
        JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        this.definitionSchema = loadSchema(schemaFactory, DEFINITION_SCHEMA);
    }
    
    private JsonSchema loadSchema(JsonSchemaFactory schemaFactory, String schemaName) {
        try (InputStream schemaStream = getClass().getClassLoader()
                .getResourceAsStream("schemas/" + schemaName)) {
            if (schemaStream == null) {
                logger.severe("Schema not found: " + schemaName + ", definitions will not be checked");
                return null;
            }
            return schemaFactory.getSchema(schemaStream);
        } catch (IOException e) {
            logger.severe("Failed to read schema " + schemaName + ": " + e.getMessage());
            return null;
        }
    }
    
    /**
     * Validate one definition object.
     * 
     * @param definition JSON object as loaded
     * @return human readable problems, empty when valid
     */
    public List<String> validateDefinition(JsonNode definition) {
        if (definitionSchema == null) {
            return Collections.emptyList();
        }
        Set<ValidationMessage> errors = definitionSchema.validate(definition);
        if (errors.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> messages = new ArrayList<>(errors.size());
        for (ValidationMessage error : errors) {
            messages.add(error.getMessage());
        }
        return messages;
    }
    
    public boolean isAvailable() {
        return definitionSchema != null;
    }
}
