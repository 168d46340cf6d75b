package com.chromatrace.solver;

import com.chromatrace.ChromatraceProperties;
import com.chromatrace.core.concurrent.CancellationToken;
import com.chromatrace.core.trace.KTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class KleeSolverDriverTest {

    private static final String COMPILE_OK = "touch program.bc";

    @TempDir
    Path tempDir;

    private Path toolsDir;
    private Path include;
    private Path fixture;
    private ChromatraceProperties.Solver config;

    @BeforeEach
    void setUp() throws IOException {
        toolsDir = Files.createDirectories(tempDir.resolve("tools"));
        include = SolverTestSupport.includeDir(tempDir);
        fixture = KTestFixtures.writeColorTrace(tempDir, "fixture.ktest", 0, 1, 0);
        config = new ChromatraceProperties.Solver();
        config.setWorkRoot(tempDir.resolve("work").toString());
    }

    private KleeSolverDriver driver(String compilerBody, String solverBody) throws IOException {
        Path compiler = SolverTestSupport.script(toolsDir, "clang", compilerBody);
        Path solver = SolverTestSupport.script(toolsDir, "klee", solverBody);
        return new KleeSolverDriver(new Toolchain(compiler, solver, include), config);
    }

    private String copyFixtureInto(String outputDir) {
        return "mkdir -p " + outputDir + " && cp '" + fixture + "' " + outputDir + "/test000001.ktest";
    }

    private static SolverRequest request(int timeoutSeconds) {
        return new SolverRequest("S-1", 1, "int main(void) { return 0; }\n", timeoutSeconds);
    }

    @Nested
    @DisplayName("successful runs")
    class SuccessTests {

        @Test
        @DisplayName("returns the traces of the output directory")
        void returnsTraces() throws IOException {
            var driver = driver(COMPILE_OK, copyFixtureInto("klee-out-0"));

            SolverOutcome outcome = driver.run(request(10), new CancellationToken());

            assertFalse(outcome.isCancelled());
            try (RunArtifact artifact = outcome.artifact()) {
                assertEquals(1, artifact.traceFiles().size());
                assertEquals("test000001.ktest", artifact.traceFiles().get(0).getFileName().toString());
                assertEquals(tempDir.resolve("work").resolve("S-1"), artifact.workDir());
                assertTrue(Files.isRegularFile(artifact.workDir().resolve(KleeSolverDriver.SOURCE_FILE)));
            }
        }

        @Test
        @DisplayName("writes the program source before compiling")
        void writesProgramSource() throws IOException {
            var driver = driver("grep -q 'int main' program.c && touch program.bc", copyFixtureInto("klee-out-0"));

            try (RunArtifact artifact = driver.run(request(10), new CancellationToken()).artifact()) {
                assertEquals("int main(void) { return 0; }\n",
                        Files.readString(artifact.workDir().resolve(KleeSolverDriver.SOURCE_FILE)));
            }
        }

        @Test
        @DisplayName("passes extra solver arguments before the bitcode")
        void passesExtraArgs() throws IOException {
            config.setExtraArgs(List.of("--max-time=5"));
            var driver = driver(COMPILE_OK,
                    "[ \"$1\" = \"--max-time=5\" ] && [ \"$2\" = \"program.bc\" ] || exit 3\n"
                            + copyFixtureInto("klee-out-0"));

            try (RunArtifact artifact = driver.run(request(10), new CancellationToken()).artifact()) {
                assertEquals(1, artifact.traceFiles().size());
            }
        }

        @Test
        @DisplayName("closing the artifact removes the working directory")
        void closeRemovesWorkDir() throws IOException {
            var driver = driver(COMPILE_OK, copyFixtureInto("klee-out-0"));

            RunArtifact artifact = driver.run(request(10), new CancellationToken()).artifact();
            Path workDir = artifact.workDir();
            artifact.close();

            assertFalse(Files.exists(workDir));
        }

        @Test
        @DisplayName("leftovers from an earlier run are cleared first")
        void clearsLeftovers() throws IOException {
            Path stale = tempDir.resolve("work").resolve("S-1").resolve("klee-out-7");
            Files.createDirectories(stale);
            KTestFixtures.writeColorTrace(stale, "test000001.ktest", 1, 1, 1);
            var driver = driver(COMPILE_OK, copyFixtureInto("klee-out-0"));

            try (RunArtifact artifact = driver.run(request(10), new CancellationToken()).artifact()) {
                assertEquals("klee-out-0", artifact.outputDir().getFileName().toString());
            }
        }

        @Test
        @DisplayName("describe reports the toolchain")
        void describe() throws IOException {
            var details = driver(COMPILE_OK, "exit 0").describe();
            assertEquals(toolsDir.resolve("clang").toString(), details.get("compiler"));
            assertEquals(toolsDir.resolve("klee").toString(), details.get("solver"));
            assertEquals(include.toString(), details.get("includeDir"));
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("compiler errors carry the diagnostics")
        void compileError() throws IOException {
            var driver = driver("echo 'program.c:3: error: expected ;' >&2; exit 1", "exit 0");

            var ex = assertThrows(ProgramCompileException.class,
                    () -> driver.run(request(10), new CancellationToken()));

            assertTrue(ex.getDiagnostics().contains("expected ;"));
            assertFalse(Files.exists(tempDir.resolve("work").resolve("S-1")));
        }

        @Test
        @DisplayName("diagnostics that are not valid UTF-8 are kept")
        void nonUtf8Diagnostics() throws IOException {
            var driver = driver("printf 'program.c:3: error: caf\\351\\n' >&2; exit 1", "exit 0");

            var ex = assertThrows(ProgramCompileException.class,
                    () -> driver.run(request(10), new CancellationToken()));

            assertTrue(ex.getDiagnostics().contains("program.c:3: error: caf"));
        }

        @Test
        @DisplayName("missing bitcode counts as a compile error")
        void missingBitcode() throws IOException {
            var driver = driver("exit 0", "exit 0");
            assertThrows(ProgramCompileException.class, () -> driver.run(request(10), new CancellationToken()));
        }

        @Test
        @DisplayName("a failing solver raises SolverExecutionException")
        void solverError() throws IOException {
            var driver = driver(COMPILE_OK, "echo 'KLEE: ERROR: bad bitcode' >&2; exit 2");

            var ex = assertThrows(SolverExecutionException.class,
                    () -> driver.run(request(10), new CancellationToken()));

            assertTrue(ex.getMessage().contains("bad bitcode"));
            assertFalse(Files.exists(tempDir.resolve("work").resolve("S-1")));
        }

        @Test
        @DisplayName("no output directory raises SolverExecutionException")
        void noOutputDirectory() throws IOException {
            var driver = driver(COMPILE_OK, "exit 0");
            var ex = assertThrows(SolverExecutionException.class,
                    () -> driver.run(request(10), new CancellationToken()));
            assertTrue(ex.getMessage().contains("klee-out-"));
        }

        @Test
        @DisplayName("a hung solver times out")
        void timeout() throws IOException {
            var driver = driver(COMPILE_OK, "exec sleep 30");

            var ex = assertThrows(SolverTimeoutException.class,
                    () -> driver.run(request(1), new CancellationToken()));

            assertEquals(1, ex.getTimeoutSeconds());
            assertFalse(Files.exists(tempDir.resolve("work").resolve("S-1")));
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("cancelling kills the running solver")
        void cancelKillsSolver() throws Exception {
            var driver = driver(COMPILE_OK, "touch started\nexec sleep 30");
            var token = new CancellationToken();
            Path marker = tempDir.resolve("work").resolve("S-1").resolve("started");

            var run = CompletableFuture.supplyAsync(() -> driver.run(request(60), token));
            long deadline = System.currentTimeMillis() + 10_000;
            while (!Files.exists(marker) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            long cancelledAt = System.currentTimeMillis();
            token.cancel();

            SolverOutcome outcome = run.get(15, TimeUnit.SECONDS);
            assertTrue(outcome.isCancelled());
            assertNull(outcome.artifact());
            assertTrue(System.currentTimeMillis() - cancelledAt < 10_000);
            assertFalse(Files.exists(tempDir.resolve("work").resolve("S-1")));
        }

        @Test
        @DisplayName("interrupting the caller kills the solver before returning")
        void interruptKillsSolver() throws Exception {
            Path pidFile = tempDir.resolve("solver.pid");
            var driver = driver(COMPILE_OK, "echo $$ > '" + pidFile + "'\nexec sleep 30");
            var outcome = new AtomicReference<SolverOutcome>();
            var interruptKept = new AtomicBoolean();

            var caller = new Thread(() -> {
                outcome.set(driver.run(request(60), new CancellationToken()));
                interruptKept.set(Thread.currentThread().isInterrupted());
            });
            caller.start();
            long deadline = System.currentTimeMillis() + 10_000;
            while (!(Files.exists(pidFile) && Files.size(pidFile) > 0) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            long pid = Long.parseLong(Files.readString(pidFile).trim());

            caller.interrupt();
            caller.join(15_000);

            assertFalse(caller.isAlive());
            assertTrue(outcome.get().isCancelled());
            assertTrue(interruptKept.get());
            assertFalse(ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false));
            assertFalse(Files.exists(tempDir.resolve("work").resolve("S-1")));
        }

        @Test
        @DisplayName("an already cancelled token starts nothing")
        void alreadyCancelled() throws IOException {
            var driver = driver("touch compiled; touch program.bc", "exit 0");
            var token = new CancellationToken();
            token.cancel();

            assertTrue(driver.run(request(10), token).isCancelled());
            assertFalse(Files.exists(tempDir.resolve("work").resolve("S-1").resolve("compiled")));
        }
    }

    @Nested
    @DisplayName("output directory selection")
    class OutputDirectoryTests {

        @Test
        @DisplayName("picks the most recently modified klee-out directory")
        void picksLatest() throws IOException {
            Path workDir = Files.createDirectories(tempDir.resolve("latest"));
            Path older = Files.createDirectories(workDir.resolve("klee-out-5"));
            Path newer = Files.createDirectories(workDir.resolve("klee-out-1"));
            Files.createDirectories(workDir.resolve("other"));
            Files.setLastModifiedTime(older, FileTime.from(Instant.now().minusSeconds(120)));
            Files.setLastModifiedTime(newer, FileTime.from(Instant.now()));

            assertEquals(newer, KleeSolverDriver.latestOutputDirectory(workDir).orElseThrow());
        }

        @Test
        @DisplayName("breaks ties by name")
        void tieBreaksByName() throws IOException {
            Path workDir = Files.createDirectories(tempDir.resolve("tie"));
            FileTime same = FileTime.from(Instant.now().minusSeconds(60));
            Path a = Files.createDirectories(workDir.resolve("klee-out-0"));
            Path b = Files.createDirectories(workDir.resolve("klee-out-1"));
            Files.setLastModifiedTime(a, same);
            Files.setLastModifiedTime(b, same);

            assertEquals(b, KleeSolverDriver.latestOutputDirectory(workDir).orElseThrow());
        }

        @Test
        @DisplayName("lists only ktest files, sorted")
        void listsTraces() throws IOException {
            Path outputDir = Files.createDirectories(tempDir.resolve("klee-out-0"));
            KTestFixtures.writeColorTrace(outputDir, "test000002.ktest", 1);
            KTestFixtures.writeColorTrace(outputDir, "test000001.ktest", 0);
            Files.writeString(outputDir.resolve("info"), "");

            var traces = KleeSolverDriver.listTraces(outputDir);

            assertEquals(List.of(outputDir.resolve("test000001.ktest"), outputDir.resolve("test000002.ktest")), traces);
        }
    }
}
