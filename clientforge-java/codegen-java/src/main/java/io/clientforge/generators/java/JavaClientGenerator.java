package io.clientforge.generators.java;

import com.squareup.javapoet.JavaFile;
import io.clientforge.spec.ReferenceResolver;
import io.clientforge.spec.SpecValidator;
import io.clientforge.spec.model.OpenApiDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates a Java client for an OpenAPI document.
 *
 * Generates:
 * - {@code <basePackage>.<ClientClassName>}: one nested class per URL segment and one static
 *   method per operation
 * - {@code <basePackage>.schemas.<Type>}: one Jackson-mapped class per named object schema the
 *   client refers to
 *
 * Everything is rendered in memory first; files are written only when no step failed.
 */
public class JavaClientGenerator {

    private static final Logger log = LoggerFactory.getLogger(JavaClientGenerator.class);

    /**
     * @throws io.clientforge.spec.SpecException if the document is invalid or a reference cannot be resolved
     * @throws TypeResolutionException           if a schema cannot be mapped to a Java type
     * @throws IOException                       if writing the files fails
     */
    public GenerationResult generate(OpenApiDocument api, GeneratorConfig config) throws IOException {
        SpecValidator.validate(api);

        RouteTree tree = RouteTree.build(api.paths);
        log.debug("{} path(s) defined, route tree:\n{}", api.paths.size(), tree.print());

        ReferenceResolver references = new ReferenceResolver(api);
        SchemaRegistry registry = new SchemaRegistry();
        TypeResolver types = new TypeResolver(references, config.schemasPackage(), registry);

        String client = new ClientEmitter(api, config, references, types).emit(tree);
        List<SchemaDefinition> definitions = registry.definitions();
        List<JavaFile> schemaFiles = new SchemaFileWriter().render(definitions);

        log.info("Writing {} and {} schema class(es) to {}", config.clientClassName(), schemaFiles.size(),
            config.outputDirectory());
        Path clientFile = config.packageDirectory(config.basePackage()).resolve(config.clientClassName() + ".java");
        Files.createDirectories(clientFile.getParent());
        Files.writeString(clientFile, client, StandardCharsets.UTF_8);

        List<Path> written = new ArrayList<>();
        List<String> names = new ArrayList<>();
        Path schemasDir = config.packageDirectory(config.schemasPackage());
        for (JavaFile file : schemaFiles) {
            file.writeTo(config.outputDirectory());
            written.add(schemasDir.resolve(file.typeSpec.name + ".java"));
            names.add(file.typeSpec.name);
        }
        return new GenerationResult(clientFile, written, names);
    }
}
