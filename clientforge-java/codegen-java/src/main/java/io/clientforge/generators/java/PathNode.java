package io.clientforge.generators.java;

import io.clientforge.spec.model.HttpMethod;
import io.clientforge.spec.model.Operation;
import io.clientforge.spec.model.PathItem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One URL segment of the route tree. Children keep the order in which they were first seen.
 */
public final class PathNode {

    private final String segment;
    private final String parameter;
    private final Map<String, PathNode> children = new LinkedHashMap<>();
    private String url;
    private PathItem pathItem;

    PathNode(String segment) {
        this.segment = segment;
        this.parameter = isParameter(segment) ? segment.substring(1, segment.length() - 1) : null;
    }

    static boolean isParameter(String segment) {
        return segment.length() > 2 && segment.startsWith("{") && segment.endsWith("}");
    }

    /** The raw segment text, e.g. {@code teams} or {@code {id}}; empty for the root. */
    public String segment() {
        return segment;
    }

    /** The parameter name without braces when the segment is {@code {name}}, otherwise {@code null}. */
    public String parameter() {
        return parameter;
    }

    /** The full URL template when this node is an endpoint, otherwise {@code null}. */
    public String url() {
        return url;
    }

    public PathItem pathItem() {
        return pathItem;
    }

    public boolean isEndpoint() {
        return url != null;
    }

    public Map<HttpMethod, Operation> operations() {
        return pathItem == null ? Map.of() : pathItem.operations();
    }

    public boolean hasOperations() {
        return !operations().isEmpty();
    }

    public Map<String, PathNode> children() {
        return Collections.unmodifiableMap(children);
    }

    PathNode child(String segment) {
        return children.computeIfAbsent(segment, PathNode::new);
    }

    void attach(String url, PathItem pathItem) {
        this.url = url;
        this.pathItem = pathItem;
    }

    @Override
    public String toString() {
        return "PathNode{" + segment + ", url=" + url + ", children=" + children.keySet() + "}";
    }
}
