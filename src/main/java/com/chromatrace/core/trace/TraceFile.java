package com.chromatrace.core.trace;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The integer records decoded from one trace file.
 *
 * @param path    the file the records came from
 * @param records record name to decoded values, in file order
 */
public record TraceFile(
    Path path,
    Map<String, List<Integer>> records
) {
    public TraceFile {
        records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }
}
