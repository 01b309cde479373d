package io.clientforge.spec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Response {
  public String description;
  public Map<String, RefOr<Header>> headers;
  /** Media type name to content, e.g. {@code application/json}. */
  public Map<String, MediaType> content;
  public Map<String, RefOr<Link>> links;
}
