package io.clientforge.generators.java;

/**
 * A schema cannot be mapped to a Java type. The message ends with the schema path, e.g.
 * {@code #/components/schemas/Team/properties/id}.
 */
public class TypeResolutionException extends RuntimeException {

    public TypeResolutionException(String message, String schemaPath) {
        super(message + " (at " + schemaPath + ")");
    }
}
