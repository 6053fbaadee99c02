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
import java.nio.ByteBuffer;
import java.util.Objects;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Wraps a {@link Source} and buffers input from it.
 * <p>
 * The buffer is only refilled once everything in it has been consumed, and every refill is a single read of
 * up to the full buffer capacity from the source. Reads from this reader are short in the same way reads from the
 * source are: {@link #read(byte[], int, int)} returns whatever is buffered, and never refills more than once to
 * satisfy a request.
 * <p>
 * Instances are not thread-safe.
 *
 * @param <S> The type of the wrapped source.
 */
public final class BufferedReader<S extends Source> implements BufferedSource, Decorator<S> {
    private S source;
    private BufferCursor cursor;

    /**
     * Create a reader with the default capacity of 64 KiB, or what the
     * {@value BufferedDefaults#DEFAULT_CAPACITY_PROPERTY} system property says.
     */
    public BufferedReader(S source) {
        this(BufferedDefaults.DEFAULT_CAPACITY, source);
    }

    public BufferedReader(int capacity, S source) {
        cursor = new BufferCursor(capacity);
        this.source = checkNotNull(source, "source");
    }

    public int capacity() {
        return cursor().capacity();
    }

    /**
     * The number of bytes that can be consumed without reading from the source.
     */
    public int available() {
        return cursor().readableBytes();
    }

    @Override
    public ByteBuffer fill() throws IOException {
        BufferCursor cursor = cursor();
        if (cursor.isExhausted()) {
            cursor.fillFrom(source);
        }
        return cursor.readableView();
    }

    @Override
    public void consume(int amount) {
        cursor().skip(amount);
    }

    @Override
    public int read(byte[] dst, int offset, int length) throws IOException {
        Objects.checkFromIndexSize(offset, length, dst.length);
        ByteBuffer available = fill();
        if (!available.hasRemaining()) {
            return -1;
        }
        int read = Math.min(available.remaining(), length);
        available.get(dst, offset, read);
        consume(read);
        return read;
    }

    /**
     * Only {@code true} when nothing is left in the buffer, and the source is at its end.
     */
    @Override
    public boolean eof() throws IOException {
        return cursor().isExhausted() && source.eof();
    }

    /**
     * Return the source. Any bytes still in the buffer are discarded.
     */
    @Override
    public S inner() {
        S inner = innerRef();
        source = null;
        cursor = null;
        return inner;
    }

    @Override
    public S innerRef() {
        if (source == null) {
            throw Statics.decoratorIsDetached(this);
        }
        return source;
    }

    @Override
    public boolean isAccessible() {
        return source != null;
    }

    private BufferCursor cursor() {
        if (cursor == null) {
            throw Statics.decoratorIsDetached(this);
        }
        return cursor;
    }

    @Override
    public String toString() {
        return "BufferedReader[" + (cursor == null ? "detached" : source + ", " + cursor) + ']';
    }
}
