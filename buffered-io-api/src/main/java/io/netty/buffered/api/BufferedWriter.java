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

import io.netty.buffered.api.internal.BufferCursor;
import io.netty.buffered.api.internal.BufferedDefaults;
import io.netty.buffered.api.internal.Statics;

import java.io.IOException;
import java.util.Objects;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Wraps a {@link Sink} and buffers output to it.
 * <p>
 * Bytes are collected in the buffer until the next write would not fit, at which point the buffered bytes are
 * written to the sink in one call. Writes larger than the whole buffer go straight to the sink.
 * <p>
 * <strong>Note:</strong> a {@code BufferedWriter} does NOT write out its buffer when it is discarded.
 * Bytes that are still buffered at that point are lost. Call {@link #flush()}, or take the sink back with
 * {@link #inner()}, to make sure everything reaches the sink.
 * <p>
 * Instances are not thread-safe.
 *
 * @param <S> The type of the wrapped sink.
 */
public final class BufferedWriter<S extends Sink> implements Sink, Decorator<S> {
    private S sink;
    private BufferCursor cursor;

    /**
     * Create a writer with the default capacity of 64 KiB, or what the
     * {@value BufferedDefaults#DEFAULT_CAPACITY_PROPERTY} system property says.
     */
    public BufferedWriter(S sink) {
        this(BufferedDefaults.DEFAULT_CAPACITY, sink);
    }

    public BufferedWriter(int capacity, S sink) {
        cursor = new BufferCursor(capacity);
        this.sink = checkNotNull(sink, "sink");
    }

    public int capacity() {
        return cursor().capacity();
    }

    /**
     * The number of bytes written to this writer, that have not yet been written to the sink.
     */
    public int pending() {
        return cursor().readableBytes();
    }

    @Override
    public void write(byte[] src, int offset, int length) throws IOException {
        Objects.checkFromIndexSize(offset, length, src.length);
        BufferCursor cursor = cursor();
        if (length > cursor.writableBytes()) {
            cursor.drainTo(sink);
        }
        if (length > cursor.capacity()) {
            sink.write(src, offset, length);
        } else {
            cursor.append(src, offset, length);
        }
    }

    /**
     * Write a single byte, buffered like any other write.
     */
    public void writeByte(int value) throws IOException {
        BufferCursor cursor = cursor();
        if (cursor.writableBytes() == 0) {
            cursor.drainTo(sink);
        }
        cursor.append((byte) value);
    }

    /**
     * Write any buffered bytes to the sink, and then flush the sink.
     */
    @Override
    public void flush() throws IOException {
        cursor().drainTo(sink);
        sink.flush();
    }

    /**
     * Write any buffered bytes to the sink, and return it. The sink itself is not flushed.
     */
    @Override
    public S inner() throws IOException {
        S inner = innerRef();
        cursor.drainTo(inner);
        sink = null;
        cursor = null;
        return inner;
    }

    @Override
    public S innerRef() {
        if (sink == null) {
            throw Statics.decoratorIsDetached(this);
        }
        return sink;
    }

    @Override
    public boolean isAccessible() {
        return sink != null;
    }

    private BufferCursor cursor() {
        if (cursor == null) {
            throw Statics.decoratorIsDetached(this);
        }
        return cursor;
    }

    @Override
    public String toString() {
        return "BufferedWriter[" + (cursor == null ? "detached" : sink + ", " + cursor) + ']';
    }
}
