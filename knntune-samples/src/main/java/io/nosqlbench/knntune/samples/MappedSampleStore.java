/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.knntune.samples;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.DoubleBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * A {@link SampleStore} whose slots live off-heap in a memory-mapped file.
 *
 * <p>The file holds the slots as little-endian doubles in row order, with the same fixed stride
 * as every other store. Any process which maps the same file with {@link #attach} sees the same
 * bytes without copying them.
 *
 * <p>The store which created the file owns it: {@link #close()} on the owner deletes the file.
 * Attached stores only stop reading. Every read after {@link #close()} fails with an
 * {@link IllegalStateException}.
 */
public final class MappedSampleStore implements SampleStore, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(MappedSampleStore.class);

    private static final long MAX_MAPPED_BYTES = Integer.MAX_VALUE;

    private final SampleSchema schema;
    private final List<String> labels;
    private final Path path;
    private final boolean owner;
    private final DoubleBuffer slots;
    private final int stride;
    private final int size;
    private volatile boolean released;

    private MappedSampleStore(SampleSchema schema, List<String> labels, Path path, boolean owner,
                              MappedByteBuffer mapped) {
        this.schema = schema;
        this.labels = List.copyOf(labels);
        this.path = path;
        this.owner = owner;
        this.slots = mapped.order(ByteOrder.LITTLE_ENDIAN).asDoubleBuffer();
        this.stride = schema.dimensions() + 1;
        if (slots.capacity() % stride != 0) {
            throw new IllegalArgumentException(
                "Mapped slot count " + slots.capacity() + " is not a multiple of the row stride " + stride);
        }
        this.size = slots.capacity() / stride;
    }

    /**
     * Write the given slots to a new file in {@code directory} and map it.
     *
     * @param schema    the schema of the rows
     * @param values    the row slots
     * @param labels    the label dictionary
     * @param directory where to create the backing file
     * @return an owning store over the new file
     * @throws IOException if the file cannot be created or mapped
     */
    static MappedSampleStore create(SampleSchema schema, double[] values, List<String> labels, Path directory)
        throws IOException {
        long bytes = (long) values.length * Double.BYTES;
        if (bytes > MAX_MAPPED_BYTES) {
            throw new IllegalArgumentException(
                "Sample data needs " + bytes + " bytes, more than a single mapping can hold");
        }
        Files.createDirectories(directory);
        Path file = Files.createTempFile(directory, "knntune-samples-", ".slots");
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            MappedByteBuffer mapped = channel.map(FileChannel.MapMode.READ_WRITE, 0, bytes);
            mapped.order(ByteOrder.LITTLE_ENDIAN).asDoubleBuffer().put(values);
            mapped.force();
            logger.debug("Mapped {} slots ({} bytes) at {}", values.length, bytes, file);
            return new MappedSampleStore(schema, labels, file, true, mapped);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(file);
            throw e;
        }
    }

    /**
     * Map an existing slot file read-only, as written by an owning store.
     *
     * @param path   the slot file
     * @param schema the schema the file was written with
     * @param labels the label dictionary the file was written with
     * @return a non-owning store over the file
     * @throws IOException if the file cannot be mapped
     */
    public static MappedSampleStore attach(Path path, SampleSchema schema, List<String> labels) throws IOException {
        Objects.requireNonNull(path, "path");
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long bytes = channel.size();
            if (bytes > MAX_MAPPED_BYTES) {
                throw new IllegalArgumentException("Slot file " + path + " is too large to map: " + bytes + " bytes");
            }
            MappedByteBuffer mapped = channel.map(FileChannel.MapMode.READ_ONLY, 0, bytes);
            return new MappedSampleStore(schema, labels, path, false, mapped);
        }
    }

    /**
     * @return the backing file, for attaching from another process
     */
    public Path path() {
        return path;
    }

    /**
     * @return true if this store created its backing file and deletes it on close
     */
    public boolean isOwner() {
        return owner;
    }

    /**
     * @return true once {@link #close()} has been called
     */
    public boolean isReleased() {
        return released;
    }

    @Override
    public SampleSchema schema() {
        return schema;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public double feature(int row, int column) {
        ensureOpen();
        Objects.checkIndex(row, size);
        Objects.checkIndex(column, stride - 1);
        return slots.get(row * stride + column);
    }

    @Override
    public int labelCode(int row) {
        ensureOpen();
        Objects.checkIndex(row, size);
        return (int) slots.get(row * stride + stride - 1);
    }

    @Override
    public List<String> labels() {
        return labels;
    }

    @Override
    public SampleStore copy() {
        ensureOpen();
        double[] values = new double[size * stride];
        slots.duplicate().get(values);
        return new HeapSampleStore(schema, values, labels);
    }

    /**
     * Stop reading the mapping. The owning store also deletes the backing file; pages stay valid
     * for other processes which still have the file mapped.
     */
    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        if (owner) {
            try {
                Files.deleteIfExists(path);
                logger.debug("Released sample store file {}", path);
            } catch (IOException e) {
                logger.warn("Unable to delete sample store file {}: {}", path, e.getMessage());
            }
        }
    }

    private void ensureOpen() {
        if (released) {
            throw new IllegalStateException("Sample store at " + path + " has been released");
        }
    }

    @Override
    public String toString() {
        return "MappedSampleStore{rows=" + size + ", dimensions=" + (stride - 1) + ", path=" + path
            + (released ? ", released" : "") + "}";
    }
}
