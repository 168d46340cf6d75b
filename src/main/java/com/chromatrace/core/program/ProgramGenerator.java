package com.chromatrace.core.program;

import com.chromatrace.core.model.Assignment;
import com.chromatrace.core.model.ColorPair;
import com.chromatrace.core.model.ExclusionSet;
import com.chromatrace.core.model.ProblemSpec;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a coloring problem as a KLEE harness in C.
 *
 * <p>The output is a pure function of its inputs: the same problem and exclusions
 * always produce byte-identical text. Layout of the generated program:
 * <ol>
 *   <li>one {@code int color[NODES]} array made symbolic as a whole, so every trace
 *       carries a single aggregate record named {@link #ARRAY_NAME}</li>
 *   <li>a domain bound per element</li>
 *   <li>an inequality per constraint pair</li>
 *   <li>a blocking assumption per excluded assignment, negating the conjunction of all
 *       its element equalities</li>
 *   <li>an {@code observe} call per element, which branches on every color so the
 *       solver emits one concrete trace per feasible vector</li>
 * </ol>
 * Conjunctions use bitwise {@code &} so assumptions never fork execution on their own.
 */
@Component
public class ProgramGenerator {

    /** Name of the symbolic array, and of the trace record the parser reads back. */
    public static final String ARRAY_NAME = "color";

    private static final String INDENT = "    ";

    /**
     * Generates the harness for {@code problem}, blocking every assignment in {@code exclusions}.
     *
     * @throws IllegalArgumentException if the problem has no variables (a zero-length C array
     *                                  is not a valid program) or an exclusion has the wrong length
     */
    public String generate(ProblemSpec problem, ExclusionSet exclusions) {
        return generate(problem, exclusions.asList());
    }

    /**
     * The harness with no exclusions, for displaying to the user.
     */
    public String preview(ProblemSpec problem) {
        return generate(problem, List.of());
    }

    String generate(ProblemSpec problem, List<Assignment> blocked) {
        if (problem.n() < 1) {
            throw new IllegalArgumentException("Cannot generate a program for a problem without variables");
        }
        var lines = new StringBuilder();

        line(lines, 0, "#include <klee/klee.h>");
        line(lines, 0, "");
        line(lines, 0, "#define NODES " + problem.n());
        line(lines, 0, "#define COLORS " + problem.k());
        line(lines, 0, "");
        line(lines, 0, "static int observe(int value, int colors) {");
        line(lines, 1, "int seen = -1;");
        line(lines, 1, "for (int c = 0; c < colors; c++) {");
        line(lines, 2, "if (value == c) {");
        line(lines, 3, "seen = c;");
        line(lines, 2, "}");
        line(lines, 1, "}");
        line(lines, 1, "return seen;");
        line(lines, 0, "}");
        line(lines, 0, "");
        line(lines, 0, "int main(void) {");
        line(lines, 1, "int " + ARRAY_NAME + "[NODES];");
        line(lines, 1, "klee_make_symbolic(" + ARRAY_NAME + ", sizeof(" + ARRAY_NAME + "), \"" + ARRAY_NAME + "\");");
        line(lines, 0, "");

        line(lines, 1, "// Domains");
        for (int i = 0; i < problem.n(); i++) {
            line(lines, 1, "klee_assume((" + element(i) + " >= 0) & (" + element(i) + " < COLORS));");
        }
        line(lines, 0, "");

        line(lines, 1, "// Pairs");
        for (ColorPair pair : problem.pairs()) {
            line(lines, 1, "klee_assume(" + element(pair.first()) + " != " + element(pair.second()) + ");");
        }
        line(lines, 0, "");

        line(lines, 1, "// Exclusions");
        for (Assignment assignment : blocked) {
            line(lines, 1, "klee_assume(!(" + conjunction(assignment, problem.n()) + "));");
        }
        line(lines, 0, "");

        line(lines, 1, "// Observation");
        line(lines, 1, "int observed = 0;");
        for (int i = 0; i < problem.n(); i++) {
            line(lines, 1, "observed += observe(" + element(i) + ", COLORS);");
        }
        line(lines, 1, "return observed < 0;");
        line(lines, 0, "}");

        return lines.toString();
    }

    private static String conjunction(Assignment assignment, int n) {
        if (assignment.size() != n) {
            throw new IllegalArgumentException(
                    "Excluded assignment " + assignment + " does not have " + n + " elements");
        }
        var sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append(" & ");
            }
            sb.append('(').append(element(i)).append(" == ").append(assignment.get(i)).append(')');
        }
        return sb.toString();
    }

    private static String element(int index) {
        return ARRAY_NAME + "[" + index + "]";
    }

    private static void line(StringBuilder sb, int depth, String text) {
        sb.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
