package io.clientforge.generators.java;

import com.squareup.javapoet.ClassName;
import io.clientforge.spec.Names;
import io.clientforge.spec.ReferenceResolver;
import io.clientforge.spec.model.AdditionalProperties;
import io.clientforge.spec.model.RefOr;
import io.clientforge.spec.model.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps schemas to Java types. Named object schemas are registered in the {@link SchemaRegistry}
 * as a side effect, once per schema. A different schema whose name is already taken gets a
 * numbered name ({@code FooBar2}).
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>references are followed; a name derived from the pointer wins over the supplied one</li>
 *   <li>an unnamed schema with a parent and a property name is named {@code Parent + Property}</li>
 *   <li>{@code object} with properties becomes a named class ({@code Void} when the map is empty)</li>
 *   <li>{@code object} with an {@code additionalProperties} schema becomes {@code Map<String, V>}</li>
 *   <li>{@code object} with only a description is an opaque marker ({@code Void})</li>
 *   <li>{@code array} becomes {@code List<T>}</li>
 *   <li>{@code string}, {@code integer}, {@code number}, {@code boolean} map to boxed types</li>
 * </ol>
 */
public final class TypeResolver {

    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    private final ReferenceResolver references;
    private final String schemasPackage;
    private final SchemaRegistry registry;

    public TypeResolver(ReferenceResolver references, String schemasPackage, SchemaRegistry registry) {
        this.references = Objects.requireNonNull(references, "references");
        this.schemasPackage = Objects.requireNonNull(schemasPackage, "schemasPackage");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Resolves {@code schema}, deriving the schema path for error messages from the arguments.
     *
     * @param name         the type name to use when the schema is not a reference, or {@code null}
     * @param schema       the schema or reference
     * @param parentName   the enclosing type name, or {@code null}
     * @param propertyName the property of the enclosing type, or {@code null}
     */
    public ResolvedType resolveType(String name, RefOr<Schema> schema, String parentName, String propertyName) {
        String path;
        if (schema instanceof RefOr.Ref<Schema> ref) {
            path = ref.pointer();
        } else if (parentName != null && propertyName != null) {
            path = parentName + "/properties/" + propertyName;
        } else {
            path = name != null ? name : "(inline schema)";
        }
        return resolveType(name, schema, parentName, propertyName, path);
    }

    /**
     * Resolves {@code schema}; {@code schemaPath} locates it in errors.
     *
     * @throws TypeResolutionException if the schema cannot be mapped
     * @throws io.clientforge.spec.UnresolvableReferenceException if a reference is dangling
     */
    public ResolvedType resolveType(String name, RefOr<Schema> schema, String parentName, String propertyName,
                                    String schemaPath) {
        Objects.requireNonNull(schema, "schema");
        String path = schema instanceof RefOr.Ref<Schema> ref ? ref.pointer() : schemaPath;
        ReferenceResolver.Resolved<Schema> resolved =
            references.resolveFully(schema, Schema.class, name == null ? null : Names.toTypeName(name));

        String typeName = resolved.name();
        if (typeName == null && parentName != null && propertyName != null) {
            typeName = parentName + Names.toTypeName(propertyName);
        }
        Schema s = resolved.get();

        return switch (classify(s, path)) {
            case "object" -> resolveObject(typeName, s, parentName, propertyName, path);
            case "array" -> resolveArray(typeName, s, parentName, propertyName, path);
            default -> resolvePrimitive(s, path);
        };
    }

    private static String classify(Schema s, String path) {
        if (s.type != null) {
            return s.type;
        }
        if (s.properties != null || s.additionalProperties != null) {
            return "object";
        }
        if (s.items != null) {
            return "array";
        }
        throw new UnknownPrimitiveTypeException(null, path);
    }

    private ResolvedType resolveObject(String name, Schema s, String parentName, String propertyName, String path) {
        if (s.properties != null) {
            if (s.properties.isEmpty()) {
                return ResolvedType.UNIT;
            }
            if (name == null) {
                throw new SchemaMissingNameException(path);
            }
            return resolveNamedObject(name, s, path);
        }
        if (s.additionalProperties instanceof AdditionalProperties.Flag flag) {
            throw new InvalidAdditionalPropertiesException(flag.allowed(), path);
        }
        if (s.additionalProperties instanceof AdditionalProperties.Typed typed) {
            ResolvedType value = resolveType(name == null ? null : name + "Value", typed.schema(),
                parentName, propertyName, path + "/additionalProperties");
            return ResolvedType.mapOf(value);
        }
        if (s.description != null && !s.description.isEmpty()) {
            return ResolvedType.UNIT;
        }
        throw new TypeResolutionException(
            "Schema is of type 'object' but has no properties, additionalProperties or description", path);
    }

    private ResolvedType resolveNamedObject(String requestedName, Schema s, String path) {
        ResolvedType existing = registry.lookup(s);
        if (existing != null) {
            return existing;
        }
        String name = JavaNames.unique(requestedName, registry.names());
        if (!name.equals(requestedName)) {
            log.warn("{}: type name {} is taken by {}, using {}", path, requestedName,
                registry.schemaPath(requestedName), name);
        }
        ClassName className = ClassName.get(schemasPackage, name);
        ResolvedType type = ResolvedType.of(className);
        registry.reserve(name, s, path, type);

        List<SchemaField> fields = new ArrayList<>();
        Set<String> fieldNames = new HashSet<>();
        for (Map.Entry<String, RefOr<Schema>> property : s.properties.entrySet()) {
            String jsonName = property.getKey();
            ResolvedType fieldType = resolveType(null, property.getValue(), name, jsonName,
                path + "/properties/" + jsonName);
            String fieldName = JavaNames.unique(JavaNames.memberName(jsonName), fieldNames);
            fieldNames.add(fieldName);
            fields.add(new SchemaField(jsonName, fieldName, fieldType, s.isRequired(jsonName),
                describe(property.getValue())));
        }
        registry.define(new SchemaDefinition(name, className, s.description, fields, path));
        log.debug("Registered schema {} with {} field(s)", name, fields.size());
        return type;
    }

    private ResolvedType resolveArray(String name, Schema s, String parentName, String propertyName, String path) {
        if (s.items == null) {
            throw new TypeResolutionException("Schema is of type 'array' but has no items", path);
        }
        ResolvedType item = resolveType(name == null ? null : name + "Item", s.items,
            parentName, propertyName, path + "/items");
        return ResolvedType.listOf(item);
    }

    private static ResolvedType resolvePrimitive(Schema s, String path) {
        return switch (s.type) {
            case "string" -> ResolvedType.of(String.class);
            case "integer" -> "int64".equals(s.format) ? ResolvedType.of(Long.class) : ResolvedType.of(Integer.class);
            case "number" -> "float".equals(s.format) ? ResolvedType.of(Float.class) : ResolvedType.of(Double.class);
            case "boolean" -> ResolvedType.of(Boolean.class);
            default -> throw new UnknownPrimitiveTypeException(s.type, path);
        };
    }

    /** Inline property descriptions; referenced schemas document themselves. */
    private static String describe(RefOr<Schema> property) {
        return property instanceof RefOr.Value<Schema> value ? value.value().description : null;
    }
}
