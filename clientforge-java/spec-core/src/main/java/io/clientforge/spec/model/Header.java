package io.clientforge.spec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Header {
  public String description;
  public boolean required;
  public boolean deprecated;
  public boolean allowEmptyValue;
  public String style;
  public Boolean explode;
  public boolean allowReserved;
  public RefOr<Schema> schema;
  public JsonNode example;
  public Map<String, RefOr<Example>> examples;
  public Map<String, MediaType> content;
}
