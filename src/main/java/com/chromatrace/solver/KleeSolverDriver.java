package com.chromatrace.solver;

import com.chromatrace.ChromatraceProperties;
import com.chromatrace.core.concurrent.CancellationToken;
import com.chromatrace.core.trace.TraceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs generated programs through clang and KLEE.
 *
 * <p>Flow per run: reset the session directory -> write {@code program.c} -> compile to
 * bitcode -> run KLEE -> pick the newest {@code klee-out-*} directory -> list its traces.
 * Child output goes to log files inside the working directory, so a chatty tool can never
 * block on a full pipe. On any failure or cancellation the working directory is removed
 * before returning.
 */
public class KleeSolverDriver implements SolverDriver {

    private static final Logger log = LoggerFactory.getLogger(KleeSolverDriver.class);

    static final String SOURCE_FILE = "program.c";
    static final String BITCODE_FILE = "program.bc";
    static final String OUTPUT_PREFIX = "klee-out-";
    private static final long EXIT_GRACE_SECONDS = 5;

    private final Toolchain toolchain;
    private final Path workRoot;
    private final List<String> extraArgs;

    /**
     * Resolves the toolchain from the environment.
     *
     * @throws ToolchainConfigurationException if any tool cannot be found
     */
    public KleeSolverDriver(ChromatraceProperties.Solver config) {
        this(ToolchainLocator.fromEnvironment().locate(config), config);
    }

    public KleeSolverDriver(Toolchain toolchain, ChromatraceProperties.Solver config) {
        this.toolchain = toolchain;
        this.workRoot = Path.of(config.getWorkRoot());
        this.extraArgs = List.copyOf(config.getExtraArgs());
    }

    public Toolchain toolchain() {
        return toolchain;
    }

    @Override
    public SolverOutcome run(SolverRequest request, CancellationToken cancellation) {
        Path workDir = workRoot.resolve(request.sessionId());
        boolean handedOver = false;
        try {
            resetDirectory(workDir);
            Files.writeString(workDir.resolve(SOURCE_FILE), request.sourceText(), StandardCharsets.UTF_8);

            Path bitcode = workDir.resolve(BITCODE_FILE);
            var compile = runStep("compile", List.of(
                    toolchain.compiler().toString(),
                    "-I", toolchain.includeDir().toString(),
                    "-O0", "-g", "-emit-llvm", "-c", SOURCE_FILE, "-o", BITCODE_FILE),
                    workDir, request.timeoutSeconds(), cancellation);
            if (compile.cancelled()) {
                return SolverOutcome.cancelled();
            }
            if (compile.exitCode() != 0 || !Files.isRegularFile(bitcode)) {
                throw new ProgramCompileException(
                        "Compiler exited with code " + compile.exitCode() + " for session " + request.sessionId(),
                        compile.stderr());
            }

            var command = new ArrayList<String>();
            command.add(toolchain.solver().toString());
            command.addAll(extraArgs);
            command.add(BITCODE_FILE);
            var solve = runStep("solve", command, workDir, request.timeoutSeconds(), cancellation);
            if (solve.cancelled()) {
                return SolverOutcome.cancelled();
            }
            if (solve.exitCode() != 0) {
                throw new SolverExecutionException(
                        "Solver exited with code " + solve.exitCode() + ":\n" + solve.stderr());
            }

            Path outputDir = latestOutputDirectory(workDir)
                    .orElseThrow(() -> new SolverExecutionException(
                            "Solver produced no " + OUTPUT_PREFIX + "* directory in " + workDir));
            List<Path> traces = listTraces(outputDir);
            log.debug("Iteration {} produced {} traces in {}", request.iteration(), traces.size(), outputDir);

            handedOver = true;
            return SolverOutcome.completed(new RunArtifact(
                    workDir, bitcode, outputDir, traces, solve.stdout() + solve.stderr()));
        } catch (IOException e) {
            throw new SolverExecutionException("I/O failure in working directory " + workDir, e);
        } finally {
            if (!handedOver) {
                RunArtifact.deleteRecursively(workDir);
            }
        }
    }

    @Override
    public Map<String, String> describe() {
        var details = new LinkedHashMap<String, String>();
        details.put("compiler", toolchain.compiler().toString());
        details.put("solver", toolchain.solver().toString());
        details.put("includeDir", toolchain.includeDir().toString());
        details.put("workRoot", workRoot.toString());
        return details;
    }

    record StepResult(boolean cancelled, int exitCode, String stdout, String stderr) {
        static StepResult wasCancelled() {
            return new StepResult(true, -1, "", "");
        }
    }

    /**
     * Runs one child process to completion, destroying it on timeout or cancellation.
     */
    StepResult runStep(String step, List<String> command, Path workDir,
                       int timeoutSeconds, CancellationToken cancellation) throws IOException {
        if (cancellation.isCancelled()) {
            return StepResult.wasCancelled();
        }
        Path stdoutFile = workDir.resolve(step + ".stdout.log");
        Path stderrFile = workDir.resolve(step + ".stderr.log");
        log.debug("Running {}: {}", step, String.join(" ", command));

        Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile())
                .start();

        try (var registration = cancellation.onCancel(() -> destroy(process))) {
            boolean finished;
            if (timeoutSeconds > 0) {
                finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } else {
                process.waitFor();
                finished = true;
            }
            if (cancellation.isCancelled()) {
                destroy(process);
                awaitExit(process);
                log.info("{} step cancelled", step);
                return StepResult.wasCancelled();
            }
            if (!finished) {
                destroy(process);
                awaitExit(process);
                throw new SolverTimeoutException(step, timeoutSeconds);
            }
            return new StepResult(false, process.exitValue(), readLog(stdoutFile), readLog(stderrFile));
        } catch (InterruptedException e) {
            destroy(process);
            awaitExitUninterruptibly(process);
            Thread.currentThread().interrupt();
            log.info("{} step interrupted, treating as cancellation", step);
            return StepResult.wasCancelled();
        }
    }

    /**
     * The most recently modified {@code klee-out-*} directory; ties go to the later name.
     */
    static Optional<Path> latestOutputDirectory(Path workDir) throws IOException {
        try (Stream<Path> list = Files.list(workDir)) {
            return list
                    .filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString().startsWith(OUTPUT_PREFIX))
                    .max(Comparator.comparing(KleeSolverDriver::lastModified)
                            .thenComparing(p -> p.getFileName().toString()));
        }
    }

    static List<Path> listTraces(Path outputDir) throws IOException {
        try (Stream<Path> list = Files.list(outputDir)) {
            return list
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(TraceParser.TRACE_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    private static void resetDirectory(Path dir) throws IOException {
        RunArtifact.deleteRecursively(dir);
        Files.createDirectories(dir);
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static String readLog(Path file) {
        try {
            // compiler diagnostics may quote bytes that are not valid UTF-8
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    // the working directory is deleted next; give the killed child a moment to release it
    private static void awaitExit(Process process) throws InterruptedException {
        if (!process.waitFor(EXIT_GRACE_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Process {} still alive after forced termination", process.pid());
        }
    }

    // same wait for a thread that was interrupted; the caller restores the flag afterwards
    private static void awaitExitUninterruptibly(Process process) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(EXIT_GRACE_SECONDS);
        while (process.isAlive()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Process {} still alive after forced termination", process.pid());
                return;
            }
            try {
                process.waitFor(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException again) {
                log.debug("Interrupted again while waiting for process {}", process.pid());
            }
        }
    }
}
