package com.reduction.core.lines;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Byte offset of the start of each line of a file.
 *
 * <p>The offsets start with 0, continue with the first byte after every newline, and end with the
 * file size, so the final entry marks the end of the last line.
 */
public final class LineOffsets {
    private static final int BLOCK_SIZE = 4 * 1024 * 1024;

    private final Path file;
    private volatile long[] offsets;

    private LineOffsets(Path file) {
        this.file = file;
    }

    public static LineOffsets of(Path file) {
        return new LineOffsets(Objects.requireNonNull(file, "file"));
    }

    public Path file() {
        return file;
    }

    public long[] offsets() throws IOException {
        long[] detected = offsets;
        if (detected == null) {
            detected = detect(file);
            offsets = detected;
        }
        return detected.clone();
    }

    /** 1-based line holding the byte at {@code offset}; empty when the offset lies outside the file. */
    public OptionalInt line(long offset) throws IOException {
        long[] all = offsets();
        if (offset < 0 || offset >= all[all.length - 1]) return OptionalInt.empty();
        int index = Arrays.binarySearch(all, offset);
        int line = index >= 0 ? index + 1 : -index - 1;
        return OptionalInt.of(line);
    }

    public OptionalInt lastLine() throws IOException {
        long[] all = offsets();
        return all.length < 2 ? OptionalInt.empty() : OptionalInt.of(all.length - 1);
    }

    private static long[] detect(Path file) throws IOException {
        long[] found = new long[64];
        int count = 0;
        found[count++] = 0;
        long position = 0;
        byte[] block = new byte[BLOCK_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(block)) != -1) {
                for (int i = 0; i < read; i++) {
                    if (block[i] != '\n') continue;
                    if (count == found.length) found = Arrays.copyOf(found, count * 2);
                    found[count++] = position + i + 1;
                }
                position += read;
            }
        }
        if (found[count - 1] != position) {
            if (count == found.length) found = Arrays.copyOf(found, count + 1);
            found[count++] = position;
        }
        return Arrays.copyOf(found, count);
    }
}
