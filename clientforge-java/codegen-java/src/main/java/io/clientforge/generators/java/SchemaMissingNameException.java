package io.clientforge.generators.java;

/**
 * An object schema with properties that neither a reference nor its context could name.
 */
public class SchemaMissingNameException extends TypeResolutionException {

    public SchemaMissingNameException(String schemaPath) {
        super("Object schema with properties has no name and none can be derived", schemaPath);
    }
}
