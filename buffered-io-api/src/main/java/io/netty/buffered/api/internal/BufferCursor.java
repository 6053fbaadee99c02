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
package io.netty.buffered.api.internal;

import io.netty.buffered.api.Sink;
import io.netty.buffered.api.Source;

import java.io.IOException;
import java.nio.ByteBuffer;

import static io.netty.util.internal.ObjectUtil.checkPositive;

/**
 * A fixed capacity byte array, with a position and a limit.
 * <p>
 * The bytes between the position and the limit are the valid content of the buffer.
 * For a read buffer, these are the bytes that have been filled in but not yet consumed.
 * For a write buffer, the position stays at zero and the limit is where the next write goes.
 * <pre>
 *      +-------------------+------------------+------------------+
 *      |  consumed bytes   |   valid bytes    |   unused bytes   |
 *      +-------------------+------------------+------------------+
 *      |                   |                  |                  |
 *      0      <=        position    <=      limit     <=     capacity
 * </pre>
 * Operations that would break this ordering throw {@link IndexOutOfBoundsException} and leave the cursor unchanged.
 */
public final class BufferCursor {
    private final byte[] storage;
    private int position;
    private int limit;

    public BufferCursor(int capacity) {
        storage = new byte[checkPositive(capacity, "capacity")];
    }

    public int capacity() {
        return storage.length;
    }

    public int position() {
        return position;
    }

    public int limit() {
        return limit;
    }

    public int readableBytes() {
        return limit - position;
    }

    public int writableBytes() {
        return storage.length - limit;
    }

    public boolean isExhausted() {
        return position == limit;
    }

    /**
     * Advance the position by the given amount.
     */
    public void skip(int amount) {
        if (amount < 0 || amount > readableBytes()) {
            throw Statics.consumeOutOfBounds(amount, this);
        }
        position += amount;
    }

    /**
     * Replace the contents with one read from the given source, into the whole storage.
     * If the source produced nothing, the cursor is left as it was.
     *
     * @return The result of the read.
     */
    public int fillFrom(Source source) throws IOException {
        int read = source.read(storage, 0, storage.length);
        if (read < -1 || read > storage.length) {
            throw Statics.invalidReadResult(read, storage.length);
        }
        if (read >= 0) {
            position = 0;
            limit = read;
        }
        return read;
    }

    /**
     * A read-only view of the valid bytes. The view shares the storage, so it goes stale on the next fill.
     */
    public ByteBuffer readableView() {
        return ByteBuffer.wrap(storage, position, readableBytes()).slice().asReadOnlyBuffer();
    }

    public void append(byte[] src, int offset, int length) {
        if (length > writableBytes()) {
            throw Statics.appendOutOfBounds(length, this);
        }
        System.arraycopy(src, offset, storage, limit, length);
        limit += length;
    }

    public void append(byte value) {
        if (writableBytes() == 0) {
            throw Statics.appendOutOfBounds(1, this);
        }
        storage[limit++] = value;
    }

    /**
     * Write the valid bytes to the given sink in a single call, then clear the cursor.
     * Nothing is written if there are no valid bytes.
     */
    public void drainTo(Sink sink) throws IOException {
        if (isExhausted()) {
            return;
        }
        sink.write(storage, position, readableBytes());
        clear();
    }

    public void clear() {
        position = 0;
        limit = 0;
    }

    @Override
    public String toString() {
        return "BufferCursor[position " + position + ", limit " + limit + ", capacity " + storage.length + ']';
    }
}
