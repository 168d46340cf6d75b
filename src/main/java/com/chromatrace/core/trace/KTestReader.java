package com.chromatrace.core.trace;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Strict decoder for KLEE's binary {@code .ktest} format.
 *
 * <p>Grammar (every count and length is an unsigned 32-bit big-endian integer):
 * <pre>
 *   file    := magic version args [symArgs] objects
 *   magic   := "KTEST" | "BOUT\n"
 *   args    := count, count x (len, bytes)
 *   symArgs := symArgvs, symArgvLen                     -- version &gt;= 2
 *   objects := count, count x object
 *   object  := nameLen, name, size, payload
 *              [numOffsets, numOffsets x (offset, index)] -- version &gt;= 4
 * </pre>
 * Any deviation raises {@link TraceParseException}; lengths are checked against the
 * bytes actually left before anything is allocated.
 */
public final class KTestReader {

    static final byte[] MAGIC = "KTEST".getBytes(StandardCharsets.US_ASCII);
    static final byte[] LEGACY_MAGIC = "BOUT\n".getBytes(StandardCharsets.US_ASCII);
    static final int MAX_VERSION = 4;

    private KTestReader() {}

    public static List<TraceRecord> read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new TraceParseException("Cannot read trace file " + file, e);
        }
        return decode(bytes);
    }

    public static List<TraceRecord> decode(byte[] bytes) {
        var buffer = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
        try {
            readMagic(buffer);
            long version = readCount(buffer, "version");
            if (version < 1 || version > MAX_VERSION) {
                throw new TraceParseException("Unsupported ktest version " + version);
            }

            long numArgs = readCount(buffer, "argument count");
            for (long i = 0; i < numArgs; i++) {
                readBlock(buffer, "argument " + i);
            }
            if (version >= 2) {
                readCount(buffer, "symArgvs");
                readCount(buffer, "symArgvLen");
            }

            long numObjects = readCount(buffer, "object count");
            var records = new ArrayList<TraceRecord>();
            for (long i = 0; i < numObjects; i++) {
                String name = new String(readBlock(buffer, "name of object " + i), StandardCharsets.UTF_8);
                byte[] payload = readBlock(buffer, "payload of object '" + name + "'");
                if (version >= 4) {
                    long numOffsets = readCount(buffer, "offset count of object '" + name + "'");
                    // each offset entry is two u32 values
                    skip(buffer, numOffsets * 2 * Integer.BYTES, "offsets of object '" + name + "'");
                }
                records.add(new TraceRecord(name, payload));
            }
            if (buffer.hasRemaining()) {
                throw new TraceParseException(buffer.remaining() + " trailing bytes after last object");
            }
            return records;
        } catch (BufferUnderflowException e) {
            throw new TraceParseException("Trace ends prematurely", e);
        }
    }

    private static void readMagic(ByteBuffer buffer) {
        if (buffer.remaining() < MAGIC.length) {
            throw new TraceParseException("Trace too short to hold a header");
        }
        byte[] magic = new byte[MAGIC.length];
        buffer.get(magic);
        if (!Arrays.equals(magic, MAGIC) && !Arrays.equals(magic, LEGACY_MAGIC)) {
            throw new TraceParseException("Not a ktest file (bad magic)");
        }
    }

    private static long readCount(ByteBuffer buffer, String what) {
        if (buffer.remaining() < Integer.BYTES) {
            throw new TraceParseException("Trace ends before " + what);
        }
        return Integer.toUnsignedLong(buffer.getInt());
    }

    private static byte[] readBlock(ByteBuffer buffer, String what) {
        long length = readCount(buffer, "length of " + what);
        if (length > buffer.remaining()) {
            throw new TraceParseException(
                    "Declared length " + length + " of " + what + " exceeds the " + buffer.remaining() + " bytes left");
        }
        byte[] block = new byte[(int) length];
        buffer.get(block);
        return block;
    }

    private static void skip(ByteBuffer buffer, long length, String what) {
        if (length > buffer.remaining()) {
            throw new TraceParseException(
                    "Declared length " + length + " of " + what + " exceeds the " + buffer.remaining() + " bytes left");
        }
        buffer.position(buffer.position() + (int) length);
    }
}
