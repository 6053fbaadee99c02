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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.buffered.api.Source;

import java.util.Objects;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A {@link Source} that reads the readable bytes of a {@link ByteBuf}.
 * <p>
 * Reads advance the reader index of the buffer. The source is at its end when the buffer has nothing left to read.
 * Releasing the buffer remains the responsibility of the caller.
 */
public final class ByteBufSource implements Source {
    private final ByteBuf buf;

    public ByteBufSource(ByteBuf buf) {
        this.buf = checkNotNull(buf, "buf");
    }

    /**
     * Create a source over a copy of the given bytes.
     */
    public static ByteBufSource of(byte... bytes) {
        return new ByteBufSource(Unpooled.copiedBuffer(bytes));
    }

    public ByteBuf content() {
        return buf;
    }

    @Override
    public int read(byte[] dst, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, dst.length);
        if (!buf.isReadable()) {
            return -1;
        }
        int read = Math.min(length, buf.readableBytes());
        buf.readBytes(dst, offset, read);
        return read;
    }

    @Override
    public boolean eof() {
        return !buf.isReadable();
    }

    @Override
    public String toString() {
        return "ByteBufSource(" + buf + ')';
    }
}
