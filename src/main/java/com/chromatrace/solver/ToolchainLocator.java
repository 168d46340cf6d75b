package com.chromatrace.solver;

import com.chromatrace.ChromatraceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds the compiler, the solver and the KLEE headers.
 *
 * <p>A configured tool containing a path separator is taken as a path; a bare name is
 * searched for in each directory of the {@code PATH} value, like a shell would.
 */
public class ToolchainLocator {

    private static final Logger log = LoggerFactory.getLogger(ToolchainLocator.class);

    static final String HEADER = "klee/klee.h";

    private final String searchPath;

    public ToolchainLocator(String searchPath) {
        this.searchPath = searchPath != null ? searchPath : "";
    }

    public static ToolchainLocator fromEnvironment() {
        return new ToolchainLocator(System.getenv("PATH"));
    }

    /**
     * @throws ToolchainConfigurationException naming the first tool that cannot be found
     */
    public Toolchain locate(ChromatraceProperties.Solver config) {
        Path compiler = findExecutable(config.getCompiler())
                .orElseThrow(() -> new ToolchainConfigurationException(
                        "Compiler '" + config.getCompiler() + "' is not on the PATH"));
        Path solver = findExecutable(config.getExecutable())
                .orElseThrow(() -> new ToolchainConfigurationException(
                        "Solver '" + config.getExecutable() + "' is not on the PATH"));
        Path includeDir = findIncludeDir(config.getIncludeDirs())
                .orElseThrow(() -> new ToolchainConfigurationException(
                        "Cannot find " + HEADER + " under any of " + config.getIncludeDirs()));
        var toolchain = new Toolchain(compiler, solver, includeDir);
        log.info("Resolved toolchain: compiler={}, solver={}, include={}", compiler, solver, includeDir);
        return toolchain;
    }

    Optional<Path> findExecutable(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        if (name.contains("/") || name.contains(File.separator)) {
            Path path = Path.of(name);
            return isExecutableFile(path) ? Optional.of(path.toAbsolutePath()) : Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir).resolve(name);
            if (isExecutableFile(candidate)) {
                return Optional.of(candidate.toAbsolutePath());
            }
        }
        return Optional.empty();
    }

    static Optional<Path> findIncludeDir(List<String> candidates) {
        if (candidates == null) {
            return Optional.empty();
        }
        return candidates.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(Path::of)
                .filter(dir -> Files.isRegularFile(dir.resolve(HEADER)))
                .findFirst();
    }

    private static boolean isExecutableFile(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
