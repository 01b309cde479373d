package io.clientforge.generators.java;

public class InvalidAdditionalPropertiesException extends TypeResolutionException {

    public InvalidAdditionalPropertiesException(boolean flag, String schemaPath) {
        super("Boolean additionalProperties (" + flag + ") supplied where a schema was expected", schemaPath);
    }
}
