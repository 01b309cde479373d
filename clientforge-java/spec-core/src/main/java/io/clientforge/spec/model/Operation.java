package io.clientforge.spec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Operation {
  public List<String> tags;
  public String summary;
  public String description;
  public OpenApiDocument.ExternalDocumentation externalDocs;
  public String operationId;
  public List<RefOr<Parameter>> parameters;
  public RefOr<RequestBody> requestBody;
  /** Keyed by HTTP status code ("200", "2XX") or "default". */
  public Map<String, RefOr<Response>> responses;
  public Map<String, RefOr<Callback>> callbacks;
  public boolean deprecated;
  public List<Map<String, List<String>>> security;
  public List<OpenApiDocument.Server> servers;
}
