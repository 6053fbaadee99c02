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
import io.netty.buffered.api.Duplex;

/**
 * A {@link Duplex} over a pair of {@link ByteBuf}s: reads drain the inbound buffer, writes append to the outbound
 * buffer.
 * <p>
 * When both are the same buffer, as with {@link #loopback()}, the bytes that are written come back out on the read
 * side.
 */
public final class ByteBufDuplex implements Duplex {
    private final ByteBufSource inbound;
    private final ByteBufSink outbound;

    public ByteBufDuplex(ByteBuf inbound, ByteBuf outbound) {
        this.inbound = new ByteBufSource(inbound);
        this.outbound = new ByteBufSink(outbound);
    }

    /**
     * Create a duplex object where the given bytes are ready to be read, and writes go to a new heap buffer.
     */
    public static ByteBufDuplex of(byte... inbound) {
        return new ByteBufDuplex(Unpooled.copiedBuffer(inbound), Unpooled.buffer());
    }

    /**
     * Create a duplex object that reads back what has been written to it.
     */
    public static ByteBufDuplex loopback() {
        ByteBuf buf = Unpooled.buffer();
        return new ByteBufDuplex(buf, buf);
    }

    public ByteBuf inbound() {
        return inbound.content();
    }

    public ByteBuf outbound() {
        return outbound.content();
    }

    /**
     * Copy out the bytes written so far, that have not been read back.
     */
    public byte[] written() {
        return outbound.toByteArray();
    }

    @Override
    public int read(byte[] dst, int offset, int length) {
        return inbound.read(dst, offset, length);
    }

    @Override
    public boolean eof() {
        return inbound.eof();
    }

    @Override
    public void write(byte[] src, int offset, int length) {
        outbound.write(src, offset, length);
    }

    @Override
    public String toString() {
        return "ByteBufDuplex(in: " + inbound() + ", out: " + outbound() + ')';
    }
}
