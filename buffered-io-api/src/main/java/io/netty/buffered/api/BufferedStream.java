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
import java.nio.ByteBuffer;

/**
 * Wraps a {@link Duplex} and buffers input from it and output to it.
 * <p>
 * Input and output are buffered independently. Internally this is a {@link BufferedReader}, whose source is a
 * {@link BufferedWriter} around the duplex object. Reads pass through that writer untouched, straight to the
 * duplex object, so written bytes are never seen by the reading side of this stream.
 * <p>
 * <strong>Note:</strong> a {@code BufferedStream} does NOT flush its output buffer when it is discarded.
 * <p>
 * Instances are not thread-safe.
 *
 * @param <S> The type of the wrapped duplex object.
 */
public final class BufferedStream<S extends Duplex> implements Duplex, BufferedSource, Decorator<S> {
    private final BufferedReader<WriterSource<S>> reader;

    /**
     * Create a stream with default input and output capacities of 64 KiB, or what the
     * {@value BufferedDefaults#DEFAULT_CAPACITY_PROPERTY} system property says.
     */
    public BufferedStream(S inner) {
        this(BufferedDefaults.DEFAULT_CAPACITY, BufferedDefaults.DEFAULT_CAPACITY, inner);
    }

    public BufferedStream(int readerCapacity, int writerCapacity, S inner) {
        BufferedWriter<S> writer = new BufferedWriter<>(writerCapacity, inner);
        reader = new BufferedReader<>(readerCapacity, new WriterSource<>(writer));
    }

    @Override
    public ByteBuffer fill() throws IOException {
        return reader.fill();
    }

    @Override
    public void consume(int amount) {
        reader.consume(amount);
    }

    @Override
    public int read(byte[] dst, int offset, int length) throws IOException {
        return reader.read(dst, offset, length);
    }

    @Override
    public boolean eof() throws IOException {
        return reader.eof();
    }

    @Override
    public void write(byte[] src, int offset, int length) throws IOException {
        writer().write(src, offset, length);
    }

    @Override
    public void flush() throws IOException {
        writer().flush();
    }

    /**
     * Write any buffered output to the duplex object, and return it. Buffered input is discarded.
     */
    @Override
    public S inner() throws IOException {
        S inner = writer().inner();
        reader.inner();
        return inner;
    }

    @Override
    public S innerRef() {
        return writer().innerRef();
    }

    @Override
    public boolean isAccessible() {
        return reader.isAccessible();
    }

    private BufferedWriter<S> writer() {
        return reader.innerRef().writer;
    }

    @Override
    public String toString() {
        return "BufferedStream[" + reader + ']';
    }

    /**
     * Lets the reader use the writer as its source. Reads go directly to the duplex object.
     */
    private static final class WriterSource<S extends Duplex> implements Source {
        final BufferedWriter<S> writer;

        WriterSource(BufferedWriter<S> writer) {
            this.writer = writer;
        }

        @Override
        public int read(byte[] dst, int offset, int length) throws IOException {
            return writer.innerRef().read(dst, offset, length);
        }

        @Override
        public boolean eof() throws IOException {
            return writer.innerRef().eof();
        }

        @Override
        public String toString() {
            return writer.toString();
        }
    }
}
