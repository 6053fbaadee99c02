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

/**
 * A blocking source of bytes.
 * <p>
 * Reads may be short: a call is free to produce fewer bytes than requested, without that meaning anything about
 * the bytes that are still to come. Running out of data is reported with a {@code -1} result, and can also be
 * queried separately through {@link #eof()}.
 */
public interface Source {
    /**
     * Read up to {@code length} bytes into the given array, starting at {@code offset}.
     *
     * @param dst The array to read into.
     * @param offset The first index in {@code dst} to write to.
     * @param length The maximum number of bytes to read.
     * @return The number of bytes read, or {@code -1} if no bytes could be produced.
     * @throws IOException If the underlying read failed.
     */
    int read(byte[] dst, int offset, int length) throws IOException;

    /**
     * Read up to {@code dst.length} bytes into the given array.
     *
     * @param dst The array to read into.
     * @return The number of bytes read, or {@code -1} if no bytes could be produced.
     * @throws IOException If the underlying read failed.
     * @see #read(byte[], int, int)
     */
    default int read(byte[] dst) throws IOException {
        return read(dst, 0, dst.length);
    }

    /**
     * Check if this source has been exhausted.
     * <p>
     * This is answered independently of the last {@link #read(byte[], int, int)} result; a read that produced no
     * bytes does not by itself mean the source is at its end.
     *
     * @return {@code true} if no more bytes will ever be produced by this source.
     * @throws IOException If the underlying stream could not be queried.
     */
    boolean eof() throws IOException;
}
