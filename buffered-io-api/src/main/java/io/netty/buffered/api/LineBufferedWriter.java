/*
 * Copyright 2021 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.netty.buffered.api;

import io.netty.buffered.api.internal.BufferedDefaults;

import java.io.IOException;
import java.util.Objects;

/**
 * Wraps a {@link Sink} and buffers output to it, flushing whenever a newline ({@code 0x0A}, {@code '\n'}) is
 * written.
 * <p>
 * Every write that contains a newline reaches the sink, up to and including its last newline, before the write
 * returns. Bytes after the last newline stay buffered until a later newline, or an explicit {@link #flush()}.
 * <p>
 * <strong>Note:</strong> like {@link BufferedWriter}, this does NOT write out its buffer when it is discarded.
 *
 * @param <S> The type of the wrapped sink.
 */
public final class LineBufferedWriter<S extends Sink> implements Sink, Decorator<S> {
    private static final byte NEWLINE = '\n';

    private final BufferedWriter<S> writer;

    /**
     * Create a line buffered writer with a buffer of 1 KiB, or what the
     * {@value BufferedDefaults#LINE_CAPACITY_PROPERTY} system property says.
     */
    public LineBufferedWriter(S sink) {
        this(BufferedDefaults.DEFAULT_LINE_CAPACITY, sink);
    }

    public LineBufferedWriter(int capacity, S sink) {
        writer = new BufferedWriter<>(capacity, sink);
    }

    public int capacity() {
        return writer.capacity();
    }

    /**
     * The number of bytes after the last newline that have not yet been written to the sink.
     */
    public int pending() {
        return writer.pending();
    }

    @Override
    public void write(byte[] src, int offset, int length) throws IOException {
        Objects.checkFromIndexSize(offset, length, src.length);
        int newline = lastIndexOf(src, offset, length, NEWLINE);
        if (newline < 0) {
            writer.write(src, offset, length);
            return;
        }
        int lines = newline - offset + 1;
        writer.write(src, offset, lines);
        writer.flush();
        writer.write(src, newline + 1, length - lines);
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
    }

    @Override
    public S inner() throws IOException {
        return writer.inner();
    }

    @Override
    public S innerRef() {
        return writer.innerRef();
    }

    @Override
    public boolean isAccessible() {
        return writer.isAccessible();
    }

    private static int lastIndexOf(byte[] array, int offset, int length, byte value) {
        for (int i = offset + length - 1; i >= offset; i--) {
            if (array[i] == value) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "LineBufferedWriter[" + writer + ']';
    }
}
