package com.chromatrace.solver;

import java.nio.file.Path;

/**
 * Resolved locations of the external tools.
 *
 * @param compiler   clang (or a compatible bitcode compiler)
 * @param solver     the KLEE executable
 * @param includeDir directory containing {@code klee/klee.h}
 */
public record Toolchain(Path compiler, Path solver, Path includeDir) {}
