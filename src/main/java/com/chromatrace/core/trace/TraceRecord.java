package com.chromatrace.core.trace;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One named object from a solver trace: the concrete bytes chosen for a symbolic variable.
 *
 * @param name    the symbolic object's name (e.g. {@code "color"})
 * @param payload raw bytes as stored in the trace
 */
public record TraceRecord(String name, byte[] payload) {

    public TraceRecord {
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int size() {
        return payload.length;
    }

    /**
     * Interprets the payload as little-endian signed 32-bit integers.
     *
     * @return empty when the byte length is not a multiple of 4
     */
    public Optional<List<Integer>> asInts() {
        if (payload.length % Integer.BYTES != 0) {
            return Optional.empty();
        }
        var buffer = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        var values = new ArrayList<Integer>(payload.length / Integer.BYTES);
        while (buffer.hasRemaining()) {
            values.add(buffer.getInt());
        }
        return Optional.of(Collections.unmodifiableList(values));
    }
}
