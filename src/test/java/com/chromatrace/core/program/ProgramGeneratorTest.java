package com.chromatrace.core.program;

import com.chromatrace.core.model.Assignment;
import com.chromatrace.core.model.ColorPair;
import com.chromatrace.core.model.ExclusionSet;
import com.chromatrace.core.model.ProblemSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgramGeneratorTest {

    private final ProgramGenerator generator = new ProgramGenerator();
    private final ProblemSpec problem = ProblemSpec.of(3, 2, List.of(ColorPair.of(0, 1)));

    @Nested
    @DisplayName("structure")
    class StructureTests {

        @Test
        @DisplayName("declares one symbolic array sized by the problem")
        void declaresSymbolicArray() {
            String source = generator.preview(problem);

            assertTrue(source.startsWith("#include <klee/klee.h>\n"));
            assertTrue(source.contains("#define NODES 3\n"));
            assertTrue(source.contains("#define COLORS 2\n"));
            assertTrue(source.contains("    int color[NODES];\n"));
            assertTrue(source.contains("    klee_make_symbolic(color, sizeof(color), \"color\");\n"));
        }

        @Test
        @DisplayName("bounds every element to the color domain")
        void boundsEveryElement() {
            String source = generator.preview(problem);

            for (int i = 0; i < 3; i++) {
                assertTrue(source.contains(
                        "klee_assume((color[" + i + "] >= 0) & (color[" + i + "] < COLORS));"), "element " + i);
            }
        }

        @Test
        @DisplayName("emits one inequality per pair")
        void emitsPairInequalities() {
            var twoPairs = ProblemSpec.of(3, 3, List.of(ColorPair.of(2, 1), ColorPair.of(0, 2)));
            String source = generator.preview(twoPairs);

            int first = source.indexOf("klee_assume(color[0] != color[2]);");
            int second = source.indexOf("klee_assume(color[1] != color[2]);");
            assertTrue(first > 0);
            assertTrue(second > first, "pairs are emitted in sorted order");
        }

        @Test
        @DisplayName("observes every element so each vector becomes its own path")
        void observesEveryElement() {
            String source = generator.preview(problem);

            assertTrue(source.contains("static int observe(int value, int colors) {"));
            for (int i = 0; i < 3; i++) {
                assertTrue(source.contains("    observed += observe(color[" + i + "], COLORS);\n"));
            }
            assertTrue(source.endsWith("    return observed < 0;\n}\n"));
        }

        @Test
        @DisplayName("sections appear in order")
        void sectionOrder() {
            String source = generator.preview(problem);

            int domains = source.indexOf("// Domains");
            int pairs = source.indexOf("// Pairs");
            int exclusions = source.indexOf("// Exclusions");
            int observation = source.indexOf("// Observation");
            assertTrue(domains < pairs && pairs < exclusions && exclusions < observation);
        }
    }

    @Nested
    @DisplayName("exclusions")
    class ExclusionTests {

        @Test
        @DisplayName("blocks an excluded assignment with a negated conjunction")
        void blocksExcludedAssignment() {
            String source = generator.generate(problem, ExclusionSet.of(Assignment.of(0, 1, 0)));

            assertTrue(source.contains(
                    "    klee_assume(!((color[0] == 0) & (color[1] == 1) & (color[2] == 0)));\n"));
        }

        @Test
        @DisplayName("emits exclusions in insertion order")
        void exclusionOrder() {
            String source = generator.generate(problem,
                    ExclusionSet.of(Assignment.of(1, 0, 1), Assignment.of(0, 1, 0)));

            int first = source.indexOf("(color[0] == 1) & (color[1] == 0) & (color[2] == 1)");
            int second = source.indexOf("(color[0] == 0) & (color[1] == 1) & (color[2] == 0)");
            assertTrue(first > 0 && second > first);
        }

        @Test
        @DisplayName("preview matches generate with no exclusions")
        void previewHasNoExclusions() {
            assertEquals(generator.generate(problem, ExclusionSet.empty()), generator.preview(problem));
            assertFalse(generator.preview(problem).contains("klee_assume(!("));
        }

        @Test
        @DisplayName("rejects an exclusion of the wrong length")
        void rejectsWrongLengthExclusion() {
            assertThrows(IllegalArgumentException.class,
                    () -> generator.generate(problem, ExclusionSet.of(Assignment.of(0, 1))));
        }
    }

    @Test
    @DisplayName("output is deterministic")
    void deterministic() {
        var exclusions = ExclusionSet.of(Assignment.of(0, 1, 1), Assignment.of(1, 0, 0));
        var same = ProblemSpec.of(3, 2, List.of(ColorPair.of(1, 0)));

        assertEquals(generator.generate(problem, exclusions), generator.generate(same, exclusions));
    }

    @Test
    @DisplayName("refuses a problem without variables")
    void refusesEmptyProblem() {
        assertThrows(IllegalArgumentException.class, () -> generator.preview(ProblemSpec.of(0, 2, List.of())));
    }
}
