package com.chromatrace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "chromatrace")
public class ChromatraceProperties {

    private Solver solver = new Solver();
    private Tree tree = new Tree();

    public Solver getSolver() { return solver; }
    public void setSolver(Solver solver) { this.solver = solver; }
    public Tree getTree() { return tree; }
    public void setTree(Tree tree) { this.tree = tree; }

    public static class Solver {
        /** Compiler producing LLVM bitcode; a bare name is looked up on PATH. */
        private String compiler = "clang";
        /** Symbolic executor; a bare name is looked up on PATH. */
        private String executable = "klee";
        /** Candidate directories holding {@code klee/klee.h}, tried in order. */
        private List<String> includeDirs = new ArrayList<>(List.of(
                "/snap/klee/current/usr/local/include",
                "/usr/local/include",
                "/usr/include"));
        private int timeoutSeconds = 30;
        private String workRoot = System.getProperty("java.io.tmpdir") + "/chromatrace";
        private List<String> extraArgs = new ArrayList<>();

        public String getCompiler() { return compiler; }
        public void setCompiler(String compiler) { this.compiler = compiler; }
        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public List<String> getIncludeDirs() { return includeDirs; }
        public void setIncludeDirs(List<String> includeDirs) { this.includeDirs = includeDirs; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public String getWorkRoot() { return workRoot; }
        public void setWorkRoot(String workRoot) { this.workRoot = workRoot; }
        public List<String> getExtraArgs() { return extraArgs; }
        public void setExtraArgs(List<String> extraArgs) { this.extraArgs = extraArgs; }
    }

    public static class Tree {
        /** Trees with more leaves than this are not materialized for rendering. */
        private long maxLeaves = 2000;
        private double baseGap = 60.0;
        private double levelGap = 90.0;
        private double topMargin = 40.0;

        public long getMaxLeaves() { return maxLeaves; }
        public void setMaxLeaves(long maxLeaves) { this.maxLeaves = maxLeaves; }
        public double getBaseGap() { return baseGap; }
        public void setBaseGap(double baseGap) { this.baseGap = baseGap; }
        public double getLevelGap() { return levelGap; }
        public void setLevelGap(double levelGap) { this.levelGap = levelGap; }
        public double getTopMargin() { return topMargin; }
        public void setTopMargin(double topMargin) { this.topMargin = topMargin; }
    }
}
