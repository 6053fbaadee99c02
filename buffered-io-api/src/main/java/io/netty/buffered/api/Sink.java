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

import java.io.Flushable;
import java.io.IOException;

/**
 * A blocking destination for bytes.
 * <p>
 * A write either consumes all the given bytes, or throws.
 */
public interface Sink extends Flushable {
    /**
     * Write {@code length} bytes from the given array, starting at {@code offset}.
     *
     * @param src The array to write from.
     * @param offset The first index in {@code src} to write.
     * @param length The number of bytes to write.
     * @throws IOException If the underlying write failed.
     */
    void write(byte[] src, int offset, int length) throws IOException;

    /**
     * Write all the bytes in the given array.
     *
     * @param src The bytes to write.
     * @throws IOException If the underlying write failed.
     */
    default void write(byte[] src) throws IOException {
        write(src, 0, src.length);
    }

    /**
     * Force any bytes held by this sink towards their destination.
     * Sinks that keep nothing back can rely on this default, which does nothing.
     *
     * @throws IOException If the underlying flush failed.
     */
    @Override
    default void flush() throws IOException {
    }
}
