package com.chromatrace.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Files produced by one solver run. Closing the artifact deletes its whole working
 * directory, including the program source and bitcode.
 *
 * @param workDir      the run's working directory
 * @param bitcode      compiled program
 * @param outputDir    the selected {@code klee-out-*} directory
 * @param traceFiles   {@code *.ktest} files in {@code outputDir}, sorted by name
 * @param solverOutput captured solver stdout and stderr
 */
public record RunArtifact(
    Path workDir,
    Path bitcode,
    Path outputDir,
    List<Path> traceFiles,
    String solverOutput
) implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunArtifact.class);

    public RunArtifact {
        traceFiles = List.copyOf(traceFiles);
    }

    @Override
    public void close() {
        deleteRecursively(workDir);
    }

    static void deleteRecursively(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up working directory {}: {}", root, e.getMessage());
        }
    }
}
