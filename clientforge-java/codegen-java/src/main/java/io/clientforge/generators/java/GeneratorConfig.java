package io.clientforge.generators.java;

import javax.lang.model.SourceVersion;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and under which names one generation run writes its output.
 *
 * @param outputDirectory source root that receives the package directories
 * @param basePackage     package of the client class; schemas go to {@code <basePackage>.schemas}
 * @param clientClassName simple name of the client class
 */
public record GeneratorConfig(Path outputDirectory, String basePackage, String clientClassName) {

    public static final String DEFAULT_CLIENT_CLASS_NAME = "ApiClient";

    public GeneratorConfig {
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        if (basePackage == null || !SourceVersion.isName(basePackage)) {
            throw new IllegalArgumentException("Not a valid Java package name: " + basePackage);
        }
        if (clientClassName == null || !SourceVersion.isIdentifier(clientClassName)
            || SourceVersion.isKeyword(clientClassName)) {
            throw new IllegalArgumentException("Not a valid Java class name: " + clientClassName);
        }
    }

    public GeneratorConfig(Path outputDirectory, String basePackage) {
        this(outputDirectory, basePackage, DEFAULT_CLIENT_CLASS_NAME);
    }

    public String schemasPackage() {
        return basePackage + ".schemas";
    }

    /** Directory of {@code packageName} below the output directory. */
    public Path packageDirectory(String packageName) {
        Path dir = outputDirectory;
        for (String part : packageName.split("\\.")) {
            dir = dir.resolve(part);
        }
        return dir;
    }
}
