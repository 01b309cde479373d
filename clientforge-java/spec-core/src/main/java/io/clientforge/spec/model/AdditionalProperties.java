package io.clientforge.spec.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * The {@code additionalProperties} keyword: either a boolean flag or a value schema.
 */
@JsonDeserialize(using = AdditionalPropertiesDeserializer.class)
public interface AdditionalProperties {

  static AdditionalProperties flag(boolean allowed) {
    return new Flag(allowed);
  }

  static AdditionalProperties schema(RefOr<Schema> schema) {
    return new Typed(schema);
  }

  record Flag(boolean allowed) implements AdditionalProperties {
  }

  record Typed(RefOr<Schema> schema) implements AdditionalProperties {
  }
}
