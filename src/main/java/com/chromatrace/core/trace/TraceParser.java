package com.chromatrace.core.trace;

import com.chromatrace.core.model.Assignment;
import com.chromatrace.core.program.ProgramGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns a solver output directory into candidate assignments.
 *
 * <p>Every file is decoded on its own: a file that cannot be read or does not follow the
 * ktest grammar is logged and dropped, and the rest of the directory is still processed.
 * Within a file, records whose size is not a whole number of 32-bit integers are skipped.
 */
@Component
public class TraceParser {

    private static final Logger log = LoggerFactory.getLogger(TraceParser.class);

    public static final String TRACE_SUFFIX = ".ktest";

    /**
     * Decodes every {@code *.ktest} file in {@code directory}, in file-name order.
     * Never throws: an unreadable directory yields an empty list.
     */
    public List<TraceFile> parseDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> list = Files.list(directory)) {
            files = list
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(TRACE_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Cannot list trace directory {}: {}", directory, e.getMessage());
            return List.of();
        }
        return parseFiles(files);
    }

    /**
     * Decodes the given trace files in the order supplied, dropping any that fail.
     */
    public List<TraceFile> parseFiles(List<Path> files) {
        var parsed = new ArrayList<TraceFile>(files.size());
        for (Path file : files) {
            try {
                parsed.add(parseFile(file));
            } catch (RuntimeException e) {
                log.warn("Dropping trace {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return parsed;
    }

    /**
     * Decodes a single trace file.
     *
     * @throws TraceParseException if the file is unreadable or malformed
     */
    public TraceFile parseFile(Path file) {
        var records = new LinkedHashMap<String, List<Integer>>();
        for (TraceRecord record : KTestReader.read(file)) {
            try {
                var ints = record.asInts();
                if (ints.isEmpty()) {
                    log.debug("Skipping record '{}' in {}: {} bytes is not a multiple of 4",
                            record.name(), file.getFileName(), record.size());
                    continue;
                }
                records.put(record.name(), ints.get());
            } catch (RuntimeException e) {
                log.debug("Skipping record '{}' in {}: {}", record.name(), file.getFileName(), e.getMessage());
            }
        }
        return new TraceFile(file, records);
    }

    /**
     * Reads the aggregate color record and returns its first {@code n} values.
     *
     * @throws MissingDataException if the record is absent or holds fewer than {@code n} values
     */
    public Assignment extractAssignment(TraceFile trace, int n) {
        List<Integer> values = trace.records().get(ProgramGenerator.ARRAY_NAME);
        if (values == null) {
            throw new MissingDataException("No '" + ProgramGenerator.ARRAY_NAME + "' record in " + trace.path());
        }
        if (values.size() < n) {
            throw new MissingDataException("Record '" + ProgramGenerator.ARRAY_NAME + "' in " + trace.path()
                    + " holds " + values.size() + " values, expected " + n);
        }
        return new Assignment(values.subList(0, n));
    }

    /**
     * Extracts one candidate per trace, in trace order; traces without usable data contribute nothing.
     */
    public List<Assignment> extractAssignments(List<TraceFile> traces, int n) {
        var candidates = new ArrayList<Assignment>(traces.size());
        for (TraceFile trace : traces) {
            try {
                candidates.add(extractAssignment(trace, n));
            } catch (MissingDataException e) {
                log.warn("Trace contributes no candidate: {}", e.getMessage());
            }
        }
        return candidates;
    }
}
