package io.clientforge.generators.java;

public class UnknownPrimitiveTypeException extends TypeResolutionException {

    private final String type;

    public UnknownPrimitiveTypeException(String type, String schemaPath) {
        super(type == null
            ? "Schema has no type and its shape does not imply one"
            : "Unknown schema type '" + type + "'", schemaPath);
        this.type = type;
    }

    /** The offending {@code type} value, {@code null} when the schema had none. */
    public String getType() {
        return type;
    }
}
