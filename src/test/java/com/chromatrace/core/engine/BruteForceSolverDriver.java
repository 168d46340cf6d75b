package com.chromatrace.core.engine;

import com.chromatrace.core.concurrent.CancellationToken;
import com.chromatrace.core.trace.KTestFixtures;
import com.chromatrace.core.tree.TreeIndexer;
import com.chromatrace.solver.RunArtifact;
import com.chromatrace.solver.SolverDriver;
import com.chromatrace.solver.SolverOutcome;
import com.chromatrace.solver.SolverRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stands in for clang + KLEE: reads the generated program's constraints back out of the
 * source text, enumerates every vector by brute force, and writes one real ktest file per
 * feasible vector.
 */
class BruteForceSolverDriver implements SolverDriver {

    private static final Pattern NODES = Pattern.compile("#define NODES (\\d+)");
    private static final Pattern COLORS = Pattern.compile("#define COLORS (\\d+)");
    private static final Pattern PAIR = Pattern.compile("klee_assume\\(color\\[(\\d+)] != color\\[(\\d+)]\\);");
    private static final Pattern EXCLUSION = Pattern.compile("klee_assume\\(!\\((.*)\\)\\);");
    private static final Pattern EQUALITY = Pattern.compile("color\\[(\\d+)] == (-?\\d+)");

    private final Path root;
    private final List<SolverRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<Integer, List<byte[]>> injected = new HashMap<>();
    private int perRunLimit = Integer.MAX_VALUE;

    BruteForceSolverDriver(Path root) {
        this.root = root;
    }

    /** Emit at most {@code limit} traces per run, like a solver stopped early. */
    BruteForceSolverDriver limitPerRun(int limit) {
        this.perRunLimit = limit;
        return this;
    }

    /** Extra raw trace files added to the given iteration's output. */
    BruteForceSolverDriver inject(int iteration, byte[]... traces) {
        injected.computeIfAbsent(iteration, i -> new ArrayList<>()).addAll(List.of(traces));
        return this;
    }

    List<SolverRequest> requests() {
        return requests;
    }

    @Override
    public SolverOutcome run(SolverRequest request, CancellationToken cancellation) {
        requests.add(request);
        String source = request.sourceText();
        int n = intGroup(NODES, source);
        int k = intGroup(COLORS, source);

        var pairs = new ArrayList<int[]>();
        Matcher pm = PAIR.matcher(source);
        while (pm.find()) {
            pairs.add(new int[]{Integer.parseInt(pm.group(1)), Integer.parseInt(pm.group(2))});
        }
        var blocked = new ArrayList<int[]>();
        Matcher em = EXCLUSION.matcher(source);
        while (em.find()) {
            int[] values = new int[n];
            Matcher eq = EQUALITY.matcher(em.group(1));
            while (eq.find()) {
                values[Integer.parseInt(eq.group(1))] = Integer.parseInt(eq.group(2));
            }
            blocked.add(values);
        }

        long total = 1;
        for (int i = 0; i < n; i++) {
            total *= k;
        }
        var traces = new ArrayList<byte[]>(injected.getOrDefault(request.iteration(), List.of()));
        int emitted = 0;
        for (long idx = 0; idx < total && emitted < perRunLimit; idx++) {
            int[] vector = TreeIndexer.assignmentFromLeafIndex(idx, k, n).toArray();
            if (feasible(vector, pairs, blocked)) {
                traces.add(KTestFixtures.colorTrace(vector));
                emitted++;
            }
        }
        return SolverOutcome.completed(writeArtifact(request, traces));
    }

    private RunArtifact writeArtifact(SolverRequest request, List<byte[]> traces) {
        Path workDir = root.resolve(request.sessionId() + "-" + request.iteration());
        Path outputDir = workDir.resolve("klee-out-0");
        try {
            Files.createDirectories(outputDir);
            var files = new ArrayList<Path>();
            for (int i = 0; i < traces.size(); i++) {
                files.add(Files.write(outputDir.resolve(String.format("test%06d.ktest", i + 1)), traces.get(i)));
            }
            return new RunArtifact(workDir, workDir.resolve("program.bc"), outputDir, files, "");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static boolean feasible(int[] vector, List<int[]> pairs, List<int[]> blocked) {
        for (int[] pair : pairs) {
            if (vector[pair[0]] == vector[pair[1]]) {
                return false;
            }
        }
        for (int[] excluded : blocked) {
            if (Arrays.equals(vector, excluded)) {
                return false;
            }
        }
        return true;
    }

    private static int intGroup(Pattern pattern, String source) {
        Matcher m = pattern.matcher(source);
        if (!m.find()) {
            throw new IllegalArgumentException("Pattern " + pattern + " not found in program");
        }
        return Integer.parseInt(m.group(1));
    }
}
