package io.clientforge.spec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Link {
  public String operationRef;
  public String operationId;
  /** Constant values or runtime expressions. */
  public Map<String, JsonNode> parameters;
  public JsonNode requestBody;
  public String description;
  public OpenApiDocument.Server server;
}
