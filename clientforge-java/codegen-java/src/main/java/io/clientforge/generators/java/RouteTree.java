package io.clientforge.generators.java;

import io.clientforge.spec.InvalidSpecException;
import io.clientforge.spec.model.PathItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The document's paths arranged as a tree of URL segments under a synthetic root.
 *
 * <pre>
 * /a/{id}, /a/{id}/b, /a/c
 *
 * /
 *     a/
 *         {id}/ *
 *             b/ [id] *
 *         c/ *
 * </pre>
 */
public final class RouteTree {

    private final PathNode root;

    private RouteTree(PathNode root) {
        this.root = root;
    }

    /**
     * Builds the tree. Empty segments are ignored, so {@code /} attaches to the root, and
     * intermediate nodes are shared between every URL that passes through them. The root's
     * url is always {@code /}.
     *
     * @throws InvalidSpecException if two URLs end on the same node
     */
    public static RouteTree build(Map<String, PathItem> paths) {
        PathNode root = new PathNode("");
        for (Map.Entry<String, PathItem> entry : paths.entrySet()) {
            String url = entry.getKey();
            PathNode node = root;
            for (String segment : segments(url)) {
                node = node.child(segment);
            }
            if (node.isEndpoint()) {
                throw new InvalidSpecException("Paths '" + node.url() + "' and '" + url + "' map to the same route");
            }
            node.attach(url, entry.getValue());
        }
        if (!root.isEndpoint()) {
            root.attach("/", null);
        }
        return new RouteTree(root);
    }

    static List<String> segments(String url) {
        List<String> segments = new ArrayList<>();
        for (String segment : url.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    public PathNode root() {
        return root;
    }

    /**
     * One line per node: tab indentation, {@code segment/}, the parameters bound by ancestors
     * in brackets, and {@code *} when the node has operations.
     */
    public String print() {
        StringBuilder sb = new StringBuilder();
        print(root, 0, List.of(), sb);
        return sb.toString();
    }

    private static void print(PathNode node, int depth, List<String> inherited, StringBuilder sb) {
        sb.append("\t".repeat(depth)).append(node.segment()).append('/');
        if (!inherited.isEmpty()) {
            sb.append(" [").append(String.join(", ", inherited)).append(']');
        }
        if (node.hasOperations()) {
            sb.append(" *");
        }
        sb.append('\n');

        List<String> bound = inherited;
        if (node.parameter() != null) {
            bound = new ArrayList<>(inherited);
            bound.add(node.parameter());
        }
        for (PathNode child : node.children().values()) {
            print(child, depth + 1, bound, sb);
        }
    }
}
