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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * A {@link Source} with an internal buffer that can be inspected before it is consumed.
 * <p>
 * The {@link #fill()} and {@link #consume(int)} pair let callers look at the buffered bytes, decide how many of them
 * they want, and only then remove them from the source. {@link #readUntil(byte)} is built on this protocol.
 */
public interface BufferedSource extends Source {
    /**
     * Get the buffered bytes that have not yet been consumed.
     * <p>
     * If the buffer is empty, it is refilled with exactly one read from the underlying source.
     * If that read produced nothing, the returned view is empty.
     * No read happens while there are unconsumed bytes in the buffer.
     *
     * @return A read-only view of the available bytes, starting at position zero.
     * The view is only valid until the next call to a method on this source.
     * @throws IOException If refilling the buffer failed.
     */
    ByteBuffer fill() throws IOException;

    /**
     * Mark the given number of bytes, from the start of the last {@link #fill()} view, as consumed.
     *
     * @param amount The number of bytes to consume.
     * @throws IndexOutOfBoundsException If {@code amount} is negative, or more than is currently buffered.
     */
    void consume(int amount);

    /**
     * Read bytes until the given delimiter has been read, or the source is exhausted.
     *
     * @param delimiter The byte that ends the record.
     * @return The bytes read, with the delimiter as the last byte if it was found, or {@code null} if the source
     * was already exhausted.
     * @throws IOException If refilling the buffer failed.
     */
    default byte[] readUntil(byte delimiter) throws IOException {
        byte[] result = null;
        int size = 0;
        boolean found = false;
        while (!found) {
            ByteBuffer available = fill();
            int limit = available.remaining();
            if (limit == 0) {
                break;
            }
            int used = limit;
            for (int i = 0; i < limit; i++) {
                if (available.get(i) == delimiter) {
                    used = i + 1;
                    found = true;
                    break;
                }
            }
            if (result == null) {
                result = new byte[used];
            } else if (size + used > result.length) {
                result = Arrays.copyOf(result, Math.max(result.length << 1, size + used));
            }
            available.get(result, size, used);
            size += used;
            consume(used);
        }
        if (result == null || size == result.length) {
            return result;
        }
        return Arrays.copyOf(result, size);
    }

    /**
     * Read a single byte.
     *
     * @return The byte as an unsigned value from {@code 0} to {@code 255}, or {@code -1} if the source is exhausted.
     * @throws IOException If refilling the buffer failed.
     */
    default int readByte() throws IOException {
        ByteBuffer available = fill();
        if (!available.hasRemaining()) {
            return -1;
        }
        int value = available.get(0) & 0xFF;
        consume(1);
        return value;
    }
}
