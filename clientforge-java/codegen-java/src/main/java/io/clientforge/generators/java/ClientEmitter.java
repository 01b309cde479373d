package io.clientforge.generators.java;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import io.clientforge.spec.Names;
import io.clientforge.spec.ReferenceResolver;
import io.clientforge.spec.model.HttpMethod;
import io.clientforge.spec.model.MediaType;
import io.clientforge.spec.model.OpenApiDocument;
import io.clientforge.spec.model.Operation;
import io.clientforge.spec.model.Parameter;
import io.clientforge.spec.model.RefOr;
import io.clientforge.spec.model.RequestBody;
import io.clientforge.spec.model.Response;
import io.clientforge.spec.model.Schema;
import io.clientforge.template.TemplateArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders the client class: one nested scope class per route tree node and one static method
 * per operation. Types of parameters, bodies and responses go through the {@link TypeResolver},
 * which registers the named schemas the client refers to.
 */
public final class ClientEmitter {

    private static final Logger log = LoggerFactory.getLogger(ClientEmitter.class);

    private static final Pattern PATH_PARAMETER = Pattern.compile("\\{([^}/]+)}");
    private static final String JSON = "application/json";

    /** Imports of the transport code every client carries. */
    private static final List<String> CLIENT_IMPORTS = List.of(
        "com.fasterxml.jackson.core.type.TypeReference",
        "com.fasterxml.jackson.databind.ObjectMapper",
        "java.io.IOException",
        "java.io.UncheckedIOException",
        "java.net.URI",
        "java.net.URLEncoder",
        "java.net.http.HttpClient",
        "java.net.http.HttpRequest",
        "java.net.http.HttpResponse",
        "java.nio.charset.StandardCharsets",
        "java.util.LinkedHashMap",
        "java.util.List",
        "java.util.Map",
        "java.util.Optional");

    /** Names a scope class must not take because generated code refers to them unqualified. */
    private static final Set<String> RESERVED_TYPE_NAMES = Set.of(
        "TypeReference", "ObjectMapper", "IOException", "UncheckedIOException", "URI", "URLEncoder",
        "HttpClient", "HttpRequest", "HttpResponse", "StandardCharsets", "LinkedHashMap", "List", "Map",
        "Optional", "Object", "String", "StringBuilder", "Integer", "Long", "Double", "Float", "Boolean",
        "Void", "Thread", "IllegalStateException", "InterruptedException", "Deprecated", "Override");

    /** Locals of every generated method. */
    private static final Set<String> RESERVED_LOCALS = Set.of("url", "query", "headers", "body");

    private final OpenApiDocument api;
    private final GeneratorConfig config;
    private final ReferenceResolver references;
    private final TypeResolver types;

    private final Set<String> scopeNames = new HashSet<>();
    private final Map<String, String> importsBySimpleName = new HashMap<>();
    private final Set<String> imports = new TreeSet<>();

    public ClientEmitter(OpenApiDocument api, GeneratorConfig config, ReferenceResolver references,
                         TypeResolver types) {
        this.api = Objects.requireNonNull(api, "api");
        this.config = Objects.requireNonNull(config, "config");
        this.references = Objects.requireNonNull(references, "references");
        this.types = Objects.requireNonNull(types, "types");
    }

    /** A route tree node with the class name chosen for it. */
    private record Scope(PathNode node, String name, String contextName, List<Scope> children) {
    }

    /** A method parameter bound to a path, query or header parameter. */
    private record MethodParameter(String name, String in, String memberName, ResolvedType type, boolean required) {
    }

    /**
     * Renders the complete client source file.
     */
    public String emit(RouteTree tree) {
        scopeNames.clear();
        imports.clear();
        importsBySimpleName.clear();
        for (String name : CLIENT_IMPORTS) {
            imports.add(name);
            importsBySimpleName.put(name.substring(name.lastIndexOf('.') + 1), name);
        }

        Scope root = nameScope(tree.root(), config.clientClassName(), "", Set.of());

        List<String> endpoints = new ArrayList<>();
        String rootFunctions = functions(root);
        if (!rootFunctions.isEmpty()) {
            endpoints.add(rootFunctions);
        }
        for (Scope child : root.children()) {
            endpoints.add(scope(child));
        }

        OpenApiDocument.Info info = api.info;
        boolean hasDescription = info.description != null && !info.description.isBlank();
        List<OpenApiDocument.Server> servers = api.servers == null ? List.of() : api.servers;

        String source = ClientTemplates.ROOT.build(TemplateArguments.create()
            .with("package", config.basePackage())
            .with("imports", imports)
            .with("title", JavaNames.javadoc(info.title))
            .with("version", JavaNames.javadoc(info.version))
            .with("hasDescription", hasDescription)
            .with("description", hasDescription ? javadocLines(info.description) : "")
            .with("className", config.clientClassName())
            .with("hasServers", !servers.isEmpty())
            .with("servers", servers(servers))
            .with("hasEndpoints", !endpoints.isEmpty())
            .with("endpoints", String.join("\n\n", endpoints)));
        log.debug("Rendered client {} with {} top-level scope(s)", config.clientClassName(), root.children().size());
        return source;
    }

    private Scope nameScope(PathNode node, String name, String contextName, Set<String> enclosing) {
        scopeNames.add(name);
        Set<String> inner = new HashSet<>(enclosing);
        inner.add(name);

        Set<String> siblings = new HashSet<>();
        List<Scope> children = new ArrayList<>();
        for (PathNode child : node.children().values()) {
            String base = Names.toTypeName(child.segment());
            if (inner.contains(base) || RESERVED_TYPE_NAMES.contains(base)) {
                base = base + "Path";
            }
            Set<String> taken = new HashSet<>(siblings);
            taken.addAll(inner);
            String unique = JavaNames.unique(base, taken);
            siblings.add(unique);
            children.add(nameScope(child, unique, contextName + unique, inner));
        }
        return new Scope(node, name, contextName, children);
    }

    private String scope(Scope scope) {
        String functions = functions(scope);
        List<String> children = new ArrayList<>();
        for (Scope child : scope.children()) {
            children.add(scope(child));
        }
        PathNode node = scope.node();
        boolean hasFunctions = !functions.isEmpty();
        boolean hasChildren = !children.isEmpty();
        return ClientTemplates.SCOPE.build(TemplateArguments.create()
            .with("hasUrl", node.isEndpoint())
            .with("url", node.isEndpoint() ? JavaNames.javadoc(node.url()) : "")
            .with("name", scope.name())
            .with("isEndpoint", hasFunctions)
            .with("functions", functions)
            .with("space", hasFunctions && hasChildren)
            .with("hasChildren", hasChildren)
            .with("children", String.join("\n\n", children)));
    }

    private String functions(Scope scope) {
        List<String> methods = new ArrayList<>();
        for (Map.Entry<HttpMethod, Operation> entry : scope.node().operations().entrySet()) {
            methods.add(method(scope, entry.getKey(), entry.getValue()));
        }
        return String.join("\n\n", methods);
    }

    private String method(Scope scope, HttpMethod method, Operation operation) {
        PathNode node = scope.node();
        String verb = method.fieldName();
        String context = scope.contextName() + Names.capitalize(verb);
        String where = "#/paths/" + node.url().replace("~", "~0").replace("/", "~1") + "/" + verb;

        List<MethodParameter> parameters = parameters(node, operation, context, where);
        RequestBody requestBody = operation.requestBody == null ? null
            : references.resolveFully(operation.requestBody, RequestBody.class, null).get();
        ResolvedType bodyType = requestBody == null ? null : requestBodyType(requestBody, context, where);
        ResolvedType returnType = responseType(operation, context, where);

        List<String> signature = new ArrayList<>();
        List<String> doc = new ArrayList<>();
        List<String> queryPuts = new ArrayList<>();
        List<String> headerPuts = new ArrayList<>();
        Map<String, String> pathMembers = new HashMap<>();
        for (MethodParameter p : parameters) {
            signature.add(render(p.type().typeName()) + " " + p.memberName());
            if (!p.required()) {
                doc.add("@param " + p.memberName() + " optional, may be {@code null}");
            }
            switch (p.in()) {
                case "path" -> pathMembers.put(p.name(), p.memberName());
                case "query" -> queryPuts.add("query.put(" + JavaNames.literal(p.name()) + ", " + p.memberName() + ");");
                case "header" -> headerPuts.add("headers.put(" + JavaNames.literal(p.name()) + ", " + p.memberName() + ");");
                default -> throw new IllegalStateException("Unexpected parameter location " + p.in());
            }
        }
        if (bodyType != null) {
            signature.add(render(bodyType.typeName()) + " body");
            if (!requestBody.required) {
                doc.add("@param body optional request body, may be {@code null}");
            }
        }

        List<String> summary = new ArrayList<>();
        if (operation.summary != null && !operation.summary.isBlank()) {
            summary.add(operation.summary);
        }
        if (operation.description != null && !operation.description.isBlank()) {
            if (!summary.isEmpty()) {
                summary.add("");
            }
            summary.addAll(operation.description.lines().collect(Collectors.toList()));
        }
        if (!summary.isEmpty() && !doc.isEmpty()) {
            summary.add("");
        }
        summary.addAll(doc);

        String call;
        String returns;
        String bodyArgument = bodyType != null ? "body" : "null";
        String methodLiteral = JavaNames.literal(method.name());
        if (returnType == null) {
            returns = "void";
            call = "send(" + methodLiteral + ", url, query, headers, " + bodyArgument + ", null);";
        } else {
            String valueType = render(returnType.typeName());
            returns = "Optional<" + valueType + ">";
            call = "return send(" + methodLiteral + ", url, query, headers, " + bodyArgument
                + ", new TypeReference<" + valueType + ">() {});";
        }

        return ClientTemplates.METHOD.build(TemplateArguments.create()
            .with("hasDoc", !summary.isEmpty())
            .with("doc", javadoc(summary))
            .with("deprecated", operation.deprecated)
            .with("returnType", returns)
            .with("name", verb)
            .with("parameters", String.join(", ", signature))
            .with("url", urlExpression(node.url(), pathMembers))
            .with("hasQuery", !queryPuts.isEmpty())
            .with("queryParams", String.join("\n", queryPuts))
            .with("hasHeaders", !headerPuts.isEmpty())
            .with("headerParams", String.join("\n", headerPuts))
            .with("call", call));
    }

    /**
     * Path-item parameters merged with the operation's, the operation winning on
     * {@code (name, in)}. Path placeholders without a declared parameter become required
     * {@code String} parameters. Cookie parameters are skipped.
     */
    private List<MethodParameter> parameters(PathNode node, Operation operation, String context, String where) {
        Map<String, Parameter> merged = new LinkedHashMap<>();
        List<RefOr<Parameter>> declared = new ArrayList<>();
        if (node.pathItem() != null && node.pathItem().parameters != null) {
            declared.addAll(node.pathItem().parameters);
        }
        if (operation.parameters != null) {
            declared.addAll(operation.parameters);
        }
        for (RefOr<Parameter> ref : declared) {
            Parameter p = references.resolveFully(ref, Parameter.class, null).get();
            merged.put(p.in + ":" + p.name, p);
        }

        Set<String> taken = new HashSet<>(RESERVED_LOCALS);
        List<MethodParameter> result = new ArrayList<>();
        Matcher m = PATH_PARAMETER.matcher(node.url());
        while (m.find()) {
            String name = m.group(1);
            if (!merged.containsKey("path:" + name)) {
                log.warn("{} has no declaration for path parameter '{}', using String", where, name);
                result.add(new MethodParameter(name, "path", member(name, taken), ResolvedType.of(String.class), true));
            }
        }
        for (Parameter p : merged.values()) {
            if ("cookie".equals(p.in)) {
                log.warn("{}: cookie parameter '{}' is not supported and was skipped", where, p.name);
                continue;
            }
            ResolvedType type = parameterType(p, context, where);
            boolean required = p.required || "path".equals(p.in);
            result.add(new MethodParameter(p.name, p.in, member(p.name, taken), type, required));
        }
        return result;
    }

    private static String member(String name, Set<String> taken) {
        String base = JavaNames.memberName(name);
        if (RESERVED_LOCALS.contains(base)) {
            base = base + "Param";
        }
        String unique = JavaNames.unique(base, taken);
        taken.add(unique);
        return unique;
    }

    private ResolvedType parameterType(Parameter p, String context, String where) {
        RefOr<Schema> schema = p.schema;
        if (schema == null) {
            MediaType media = preferredMedia(p.content);
            schema = media == null ? null : media.schema;
        }
        if (schema == null) {
            return ResolvedType.of(String.class);
        }
        return types.resolveType(null, schema, context, p.name, where + "/parameters/" + p.name);
    }

    private ResolvedType requestBodyType(RequestBody body, String context, String where) {
        MediaType media = preferredMedia(body.content);
        if (media == null || media.schema == null) {
            return null;
        }
        ResolvedType type = types.resolveType(context + "Request", media.schema, null, null, where + "/requestBody");
        return type.isUnit() ? null : type;
    }

    /**
     * The type of the first 2xx response's content, or {@code null} when there is no such
     * response, it has no content or the content carries no data.
     */
    private ResolvedType responseType(Operation operation, String context, String where) {
        for (Map.Entry<String, RefOr<Response>> entry : operation.responses.entrySet()) {
            if (!entry.getKey().startsWith("2")) {
                continue;
            }
            Response response = references.resolveFully(entry.getValue(), Response.class, null).get();
            MediaType media = preferredMedia(response.content);
            if (media == null || media.schema == null) {
                return null;
            }
            ResolvedType type = types.resolveType(context + "Response", media.schema, null, null,
                where + "/responses/" + entry.getKey());
            return type.isUnit() ? null : type;
        }
        return null;
    }

    private static MediaType preferredMedia(Map<String, MediaType> content) {
        if (content == null || content.isEmpty()) {
            return null;
        }
        MediaType json = content.get(JSON);
        return json != null ? json : content.values().iterator().next();
    }

    private static String urlExpression(String url, Map<String, String> pathMembers) {
        List<String> parts = new ArrayList<>();
        Matcher m = PATH_PARAMETER.matcher(url);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) {
                parts.add(JavaNames.literal(url.substring(last, m.start())));
            }
            parts.add("encode(" + pathMembers.get(m.group(1)) + ")");
            last = m.end();
        }
        if (last < url.length() || parts.isEmpty()) {
            parts.add(JavaNames.literal(url.substring(last)));
        }
        return String.join(" + ", parts);
    }

    /**
     * Writes {@code type} with simple names where an import makes that unambiguous. Schema
     * classes that share a name with a scope class are written fully qualified.
     */
    private String render(TypeName type) {
        if (type instanceof ParameterizedTypeName parameterized) {
            return render(parameterized.rawType) + parameterized.typeArguments.stream()
                .map(this::render)
                .collect(Collectors.joining(", ", "<", ">"));
        }
        if (type instanceof ClassName className) {
            String simple = className.simpleName();
            String canonical = className.canonicalName();
            if (scopeNames.contains(simple)) {
                return canonical;
            }
            if (className.packageName().equals("java.lang")) {
                return simple;
            }
            String imported = importsBySimpleName.putIfAbsent(simple, canonical);
            if (imported != null && !imported.equals(canonical)) {
                return canonical;
            }
            imports.add(canonical);
            return simple;
        }
        return type.toString();
    }

    private static String javadoc(List<String> lines) {
        StringBuilder sb = new StringBuilder("/**\n");
        for (String line : lines) {
            sb.append(line.isBlank() ? " *" : " * " + JavaNames.javadoc(line)).append('\n');
        }
        return sb.append(" */").toString();
    }

    private static String javadocLines(String text) {
        return text.strip().lines()
            .map(line -> line.isBlank() ? " *" : " * " + JavaNames.javadoc(line))
            .collect(Collectors.joining("\n"));
    }

    private static String servers(List<OpenApiDocument.Server> servers) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < servers.size(); i++) {
            OpenApiDocument.Server server = servers.get(i);
            StringBuilder line = new StringBuilder(JavaNames.literal(server.url));
            if (i < servers.size() - 1) {
                line.append(',');
            }
            if (server.description != null && !server.description.isBlank()) {
                line.append(" // ").append(server.description.lines().findFirst().orElse(""));
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }
}
