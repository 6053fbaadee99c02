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
package io.netty.buffered.mem;

import io.netty.buffered.api.Duplex;

import java.util.Objects;

/**
 * A {@link Duplex} that is always at its end, and discards everything written to it, like {@code /dev/null}.
 */
public final class NullStream implements Duplex {
    public static final NullStream INSTANCE = new NullStream();

    private NullStream() {
    }

    @Override
    public int read(byte[] dst, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, dst.length);
        return -1;
    }

    @Override
    public boolean eof() {
        return true;
    }

    @Override
    public void write(byte[] src, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, src.length);
    }

    @Override
    public String toString() {
        return "NullStream";
    }
}
