package io.clientforge.generators.java;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Files written by one generation run.
 *
 * @param clientFile  the client source file
 * @param schemaFiles one source file per named schema, in registration order
 * @param schemaNames the names of the emitted schema classes, in the same order
 */
public record GenerationResult(Path clientFile, List<Path> schemaFiles, List<String> schemaNames) {

    public GenerationResult {
        schemaFiles = List.copyOf(schemaFiles);
        schemaNames = List.copyOf(schemaNames);
    }

    public List<Path> allFiles() {
        List<Path> all = new ArrayList<>();
        all.add(clientFile);
        all.addAll(schemaFiles);
        return all;
    }
}
