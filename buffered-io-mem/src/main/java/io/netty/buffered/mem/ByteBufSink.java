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
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.buffered.api.Sink;

import java.util.Objects;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A {@link Sink} that appends everything written to it to a {@link ByteBuf}.
 */
public final class ByteBufSink implements Sink {
    private final ByteBuf buf;

    /**
     * Create a sink over a new, growable, heap buffer.
     */
    public ByteBufSink() {
        this(Unpooled.buffer());
    }

    public ByteBufSink(ByteBuf buf) {
        this.buf = checkNotNull(buf, "buf");
    }

    public ByteBuf content() {
        return buf;
    }

    /**
     * Copy out the readable bytes of the buffer, without changing its indexes.
     */
    public byte[] toByteArray() {
        return ByteBufUtil.getBytes(buf);
    }

    @Override
    public void write(byte[] src, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, src.length);
        buf.writeBytes(src, offset, length);
    }

    @Override
    public String toString() {
        return "ByteBufSink(" + buf + ')';
    }
}
