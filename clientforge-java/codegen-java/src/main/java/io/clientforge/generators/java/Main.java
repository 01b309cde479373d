package io.clientforge.generators.java;

import io.clientforge.spec.SpecException;
import io.clientforge.spec.SpecLoader;
import io.clientforge.spec.model.OpenApiDocument;
import io.clientforge.template.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entry point for the Java client generator.
 *
 * Usage:
 *   java -jar codegen-java.jar --spec <file-or-url> --package <pkg> --output <dir> [--client-name <Name>]
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String USAGE =
        "Usage: java -jar codegen-java.jar --spec <file-or-url> --package <pkg> --output <dir> [--client-name <Name>]";

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one generation and returns the process exit status.
     */
    static int run(String[] args) {
        String spec = null;
        String packageName = null;
        String outputDir = null;
        String clientName = GeneratorConfig.DEFAULT_CLIENT_CLASS_NAME;

        // Parse arguments
        for (int i = 0; i < args.length; i++) {
            String value = i + 1 < args.length ? args[i + 1] : null;
            switch (args[i]) {
                case "--spec":
                    spec = value;
                    i++;
                    break;
                case "--package":
                    packageName = value;
                    i++;
                    break;
                case "--output":
                    outputDir = value;
                    i++;
                    break;
                case "--client-name":
                    clientName = value;
                    i++;
                    break;
                default:
                    log.warn("Ignoring unknown argument {}", args[i]);
                    break;
            }
        }

        if (spec == null || packageName == null || outputDir == null || clientName == null) {
            System.err.println(USAGE);
            return 1;
        }

        try {
            GeneratorConfig config = new GeneratorConfig(Paths.get(outputDir), packageName, clientName);
            OpenApiDocument api = isUrl(spec) ? SpecLoader.load(new URL(spec)) : SpecLoader.load(Path.of(spec));

            GenerationResult result = new JavaClientGenerator().generate(api, config);

            log.info("Generated {} file(s) in {}", result.allFiles().size(), outputDir);
            log.info("  - {}", result.clientFile());
            for (String name : result.schemaNames()) {
                log.info("  - {}", name);
            }
            return 0;
        } catch (SpecException | TypeResolutionException | TemplateException | IllegalArgumentException e) {
            log.error("{}: {}", e.getClass().getSimpleName(), e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O failure: {}", e.getMessage(), e);
            return 1;
        }
    }

    private static boolean isUrl(String spec) {
        return spec.startsWith("http://") || spec.startsWith("https://") || spec.startsWith("file:");
    }
}
