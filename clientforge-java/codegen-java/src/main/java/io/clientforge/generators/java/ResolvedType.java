package io.clientforge.generators.java;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The Java type a schema maps to.
 *
 * @param shortName     the type as written after imports, e.g. {@code List<Team>}
 * @param qualifiedName the fully qualified name of the element type; containers inherit it
 *                      from their element, so {@code List<Team>} reports {@code com.x.schemas.Team}
 * @param typeName      the JavaPoet form used when rendering source
 */
public record ResolvedType(String shortName, String qualifiedName, TypeName typeName) {

    private static final ClassName LIST = ClassName.get(List.class);
    private static final ClassName MAP = ClassName.get(Map.class);

    /** Schemas that carry no data: empty objects and description-only markers. */
    public static final ResolvedType UNIT = of(ClassName.get(Void.class));

    public ResolvedType {
        Objects.requireNonNull(shortName, "shortName");
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        Objects.requireNonNull(typeName, "typeName");
    }

    public static ResolvedType of(ClassName className) {
        return new ResolvedType(String.join(".", className.simpleNames()), className.canonicalName(), className);
    }

    public static ResolvedType of(Class<?> type) {
        return of(ClassName.get(type));
    }

    public static ResolvedType listOf(ResolvedType item) {
        return new ResolvedType("List<" + item.shortName + ">", item.qualifiedName,
            ParameterizedTypeName.get(LIST, item.typeName));
    }

    public static ResolvedType mapOf(ResolvedType value) {
        return new ResolvedType("Map<String, " + value.shortName + ">", value.qualifiedName,
            ParameterizedTypeName.get(MAP, ClassName.get(String.class), value.typeName));
    }

    public boolean isUnit() {
        return UNIT.typeName.equals(typeName);
    }
}
