package io.clientforge.generators.java;

import io.clientforge.spec.model.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named types of one generation run. A name is reserved for one schema before the schema's
 * properties are resolved and defined afterwards, so each schema maps to one type and each
 * name to at most one definition. Schemas are told apart by identity: a component reached
 * through any number of references is the same schema.
 */
public final class SchemaRegistry {

    private final Map<String, ResolvedType> types = new LinkedHashMap<>();
    private final Map<String, String> schemaPaths = new HashMap<>();
    private final Map<Schema, ResolvedType> bySchema = new IdentityHashMap<>();
    private final Map<String, SchemaDefinition> definitions = new HashMap<>();

    public ResolvedType lookup(String name) {
        return types.get(name);
    }

    /** The type already reserved for {@code schema}, or {@code null}. */
    public ResolvedType lookup(Schema schema) {
        return bySchema.get(schema);
    }

    /** Where the schema that reserved {@code name} was found, or {@code null}. */
    public String schemaPath(String name) {
        return schemaPaths.get(name);
    }

    Set<String> names() {
        return Collections.unmodifiableSet(types.keySet());
    }

    void reserve(String name, Schema schema, String schemaPath, ResolvedType type) {
        if (types.putIfAbsent(name, type) != null) {
            throw new IllegalStateException("Type name '" + name + "' is already reserved by "
                + schemaPaths.get(name));
        }
        schemaPaths.put(name, schemaPath);
        bySchema.put(schema, type);
    }

    void define(SchemaDefinition definition) {
        if (!types.containsKey(definition.name())) {
            throw new IllegalStateException("Type name '" + definition.name() + "' was never reserved");
        }
        if (definitions.putIfAbsent(definition.name(), definition) != null) {
            throw new IllegalStateException("Type '" + definition.name() + "' is already defined");
        }
    }

    /** Definitions in the order their names were first reserved. */
    public List<SchemaDefinition> definitions() {
        List<SchemaDefinition> result = new ArrayList<>();
        for (String name : types.keySet()) {
            SchemaDefinition definition = definitions.get(name);
            if (definition != null) {
                result.add(definition);
            }
        }
        return result;
    }

    public SchemaDefinition definition(String name) {
        return definitions.get(name);
    }

    public int size() {
        return definitions.size();
    }
}
