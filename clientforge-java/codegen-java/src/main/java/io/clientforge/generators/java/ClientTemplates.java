package io.clientforge.generators.java;

import io.clientforge.template.Template;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Templates of the generated client source.
 */
final class ClientTemplates {

    private ClientTemplates() {
    }

    static final Template ROOT = Template.builder("""
        package %package%;

        %imports%

        /**
         * %title% [v%version%]
        %~hasDescription -> " *\\n%description%"~%
         */
        public final class %className% {

            private static final List<String> SERVERS = List.of(
                %~hasServers -> "%servers%"~%
            );

            private static final HttpClient CLIENT = HttpClient.newHttpClient();
            private static final ObjectMapper MAPPER = new ObjectMapper();
            private static final Map<String, String> DEFAULT_HEADERS = new LinkedHashMap<>();

            private %className%() {
            }

            /**
             * Adds a header sent with every request, e.g. an API key.
             */
            public static void setHeader(String name, String value) {
                DEFAULT_HEADERS.put(name, value);
            }

            private static <T> Optional<T> send(String method, String path, Map<String, Object> query,
                                                Map<String, Object> headers, Object body, TypeReference<T> type) {
                StringBuilder target = new StringBuilder(SERVERS.isEmpty() ? "" : SERVERS.get(0)).append(path);
                String separator = "?";
                for (Map.Entry<String, Object> entry : query.entrySet()) {
                    if (entry.getValue() != null) {
                        target.append(separator).append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
                        separator = "&";
                    }
                }
                try {
                    HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(target.toString()))
                        .header("Accept", "application/json");
                    DEFAULT_HEADERS.forEach(request::header);
                    headers.forEach((name, value) -> {
                        if (value != null) {
                            request.header(name, String.valueOf(value));
                        }
                    });
                    HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
                    if (body != null) {
                        request.header("Content-Type", "application/json");
                        publisher = HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body));
                    }
                    HttpResponse<String> response = CLIENT.send(request.method(method, publisher).build(),
                        HttpResponse.BodyHandlers.ofString());
                    if (response.statusCode() / 100 != 2) {
                        throw new IllegalStateException(method + " " + path + " returned status " + response.statusCode());
                    }
                    if (type == null || response.body().isEmpty()) {
                        return Optional.empty();
                    }
                    return Optional.ofNullable(MAPPER.readValue(response.body(), type));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted during " + method + " " + path, e);
                }
            }

            private static String encode(Object value) {
                return URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8);
            }
        %~hasEndpoints -> ""~%
            %~hasEndpoints -> "%endpoints%"~%
        }
        """)
        .declare("imports", Collection.class, ClientTemplates::importLines)
        .build();

    static final Template SCOPE = Template.of("""
        %~hasUrl -> "/**\\n * Endpoint: %url%\\n */"~%
        public static final class %name% {

            private %name%() {
            }

            %~isEndpoint -> "%functions%"~%
        %~space -> ""~%
            %~hasChildren -> "%children%"~%
        }""");

    static final Template METHOD = Template.builder("""
        %~hasDoc -> "%doc%"~%
        %~deprecated -> "@Deprecated"~%
        public static %returnType% %name%(%parameters%) {
            String url = %url%;
            Map<String, Object> query = new LinkedHashMap<>();
            %~hasQuery -> "%queryParams%"~%
            Map<String, Object> headers = new LinkedHashMap<>();
            %~hasHeaders -> "%headerParams%"~%
            %call%
        }""")
        .declare("deprecated", Boolean.class)
        .build();

    private static String importLines(Collection<?> names) {
        return names.stream()
            .map(name -> "import " + name + ";")
            .collect(Collectors.joining("\n"));
    }
}
