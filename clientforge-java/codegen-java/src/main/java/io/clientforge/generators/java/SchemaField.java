package io.clientforge.generators.java;

/**
 * One property of a named object schema.
 *
 * @param jsonName    the property name in the document
 * @param fieldName   the Java field name
 * @param type        the resolved property type
 * @param required    whether the owning schema lists the property as required
 * @param description the property's description, or {@code null}
 */
public record SchemaField(String jsonName, String fieldName, ResolvedType type, boolean required,
                          String description) {
}
