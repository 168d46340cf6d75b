package com.chromatrace.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON exchange format for {@link ProblemSpec}, used by the graph editor:
 * <pre>
 *   {"n": 3, "k": 2, "pairs": [[0, 1], [1, 2]]}
 * </pre>
 */
public final class ProblemSpecJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProblemSpecJson() {}

    record Document(Integer n, Integer k, List<List<Integer>> pairs) {}

    /**
     * Parses a problem document.
     *
     * @throws IllegalArgumentException if the JSON is malformed or describes an invalid problem
     */
    public static ProblemSpec read(String json) {
        Document doc;
        try {
            doc = MAPPER.readValue(json, Document.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed problem JSON: " + e.getOriginalMessage(), e);
        }
        if (doc == null || doc.n() == null || doc.k() == null) {
            throw new IllegalArgumentException("Problem JSON must define both \"n\" and \"k\"");
        }
        var pairs = new ArrayList<ColorPair>();
        if (doc.pairs() != null) {
            for (List<Integer> pair : doc.pairs()) {
                if (pair == null || pair.size() != 2 || pair.contains(null)) {
                    throw new IllegalArgumentException("Each pair must hold exactly two indices, got " + pair);
                }
                pairs.add(new ColorPair(pair.get(0), pair.get(1)));
            }
        }
        return new ProblemSpec(doc.n(), doc.k(), pairs);
    }

    public static String write(ProblemSpec problem) {
        var pairs = problem.pairs().stream()
                .map(p -> List.of(p.first(), p.second()))
                .toList();
        try {
            return MAPPER.writeValueAsString(new Document(problem.n(), problem.k(), pairs));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize problem", e);
        }
    }
}
