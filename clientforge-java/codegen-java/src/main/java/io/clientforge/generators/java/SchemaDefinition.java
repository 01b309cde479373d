package io.clientforge.generators.java;

import com.squareup.javapoet.ClassName;

import java.util.List;

/**
 * A named object schema to be written as its own class. Fields keep document order.
 */
public record SchemaDefinition(String name, ClassName className, String description, List<SchemaField> fields,
                               String schemaPath) {

    public SchemaDefinition {
        fields = List.copyOf(fields);
    }

    public SchemaField field(String jsonName) {
        for (SchemaField field : fields) {
            if (field.jsonName().equals(jsonName)) {
                return field;
            }
        }
        return null;
    }
}
