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
package io.netty.buffered.api.tests;

import io.netty.buffered.api.BufferedWriter;
import io.netty.buffered.api.Sink;
import io.netty.buffered.mem.ByteBufSink;
import io.netty.buffered.mem.NullStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.InOrder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class BufferedWriterTest extends BufferedTestSupport {
    @Test
    public void writesMustReachSinkWhenBufferOverflows() throws IOException {
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(2, new ByteBufSink());

        writer.write(bytes(0, 1));
        assertThat(sinkContents(writer)).isEmpty();

        writer.write(bytes(2));
        assertThat(sinkContents(writer)).containsExactly(bytes(0, 1));

        writer.write(bytes(3));
        assertThat(sinkContents(writer)).containsExactly(bytes(0, 1));

        writer.flush();
        assertThat(sinkContents(writer)).containsExactly(bytes(0, 1, 2, 3));

        writer.write(bytes(4));
        writer.write(bytes(5));
        assertThat(sinkContents(writer)).containsExactly(bytes(0, 1, 2, 3));

        writer.write(bytes(6));
        assertThat(sinkContents(writer)).containsExactly(bytes(0, 1, 2, 3, 4, 5));

        writer.write(bytes(7, 8));
        assertThat(sinkContents(writer)).containsExactly(bytes(0, 1, 2, 3, 4, 5, 6));

        writer.write(bytes(9, 10, 11));
        assertThat(sinkContents(writer)).containsExactly(bytes(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11));

        writer.flush();
        assertThat(sinkContents(writer)).containsExactly(bytes(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11));
    }

    @Test
    public void writeThatExactlyFillsBufferMustNotReachSink() throws IOException {
        ByteBufSink sink = spy(new ByteBufSink());
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(4, sink);
        writer.write(bytes(1, 2));
        writer.write(bytes(3, 4));
        assertThat(writer.pending()).isEqualTo(4);
        verify(sink, never()).write(any(byte[].class), anyInt(), anyInt());
    }

    @Test
    public void largeWriteMustFlushOnceThenPassThrough() throws IOException {
        ByteBufSink sink = spy(new ByteBufSink());
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(4, sink);
        byte[] large = bytes(3, 4, 5, 6, 7, 8);

        writer.write(bytes(1, 2));
        writer.write(large);

        InOrder order = inOrder(sink);
        order.verify(sink).write(any(byte[].class), eq(0), eq(2));
        order.verify(sink).write(same(large), eq(0), eq(6));
        verify(sink, times(2)).write(any(byte[].class), anyInt(), anyInt());
        verify(sink, never()).flush();
        assertThat(writer.pending()).isZero();
        assertThat(sink.toByteArray()).containsExactly(bytes(1, 2, 3, 4, 5, 6, 7, 8));
    }

    @Test
    public void largeWriteIntoEmptyBufferMustPassThroughOnce() throws IOException {
        ByteBufSink sink = spy(new ByteBufSink());
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(2, sink);
        writer.write(bytes(1, 2, 3));
        verify(sink, times(1)).write(any(byte[].class), anyInt(), anyInt());
        assertThat(sink.toByteArray()).containsExactly(bytes(1, 2, 3));
    }

    @Test
    public void secondFlushMustNotWriteToSink() throws IOException {
        ByteBufSink sink = spy(new ByteBufSink());
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(4, sink);
        writer.write(bytes(1));
        writer.flush();
        writer.flush();
        verify(sink, times(1)).write(any(byte[].class), anyInt(), anyInt());
        verify(sink, times(2)).flush();
        assertThat(sink.toByteArray()).containsExactly(bytes(1));
    }

    @Test
    public void writeByteMustBeBuffered() throws IOException {
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(2, new ByteBufSink());
        writer.writeByte(1);
        writer.writeByte(2);
        assertThat(sinkContents(writer)).isEmpty();
        writer.writeByte(0xFF);
        assertThat(sinkContents(writer)).containsExactly(bytes(1, 2));
        writer.flush();
        assertThat(sinkContents(writer)).containsExactly(bytes(1, 2, 0xFF));
    }

    @Test
    public void writeMustRespectOffsetAndLength() throws IOException {
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(8, new ByteBufSink());
        writer.write(bytes(1, 2, 3, 4, 5), 1, 3);
        assertThrows(IndexOutOfBoundsException.class, () -> writer.write(bytes(1, 2), 1, 2));
        writer.flush();
        assertThat(sinkContents(writer)).containsExactly(bytes(2, 3, 4));
    }

    @Test
    public void innerMustWritePendingBytes() throws IOException {
        ByteBufSink sink = spy(new ByteBufSink());
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(3, sink);
        writer.write(bytes(0, 1));
        assertThat(sink.toByteArray()).isEmpty();

        assertSame(sink, writer.inner());
        assertThat(sink.toByteArray()).containsExactly(bytes(0, 1));
        verify(sink, never()).flush();
        assertFalse(writer.isAccessible());
        assertThrows(IllegalStateException.class, () -> writer.write(bytes(2)));
        assertThrows(IllegalStateException.class, writer::flush);
        assertThrows(IllegalStateException.class, writer::inner);
    }

    @Test
    public void innerRefMustNotWritePendingBytes() throws IOException {
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(3, new ByteBufSink());
        writer.write(bytes(0, 1));
        assertThat(writer.innerRef().toByteArray()).isEmpty();
        assertThat(writer.pending()).isEqualTo(2);
    }

    @Test
    public void ioExceptionsFromSinkMustPropagate() throws IOException {
        IOException failure = new IOException("boom");
        Sink sink = mock(Sink.class);
        doThrow(failure).when(sink).flush();
        BufferedWriter<Sink> writer = new BufferedWriter<>(4, sink);
        writer.write(bytes(1));
        IOException thrown = assertThrows(IOException.class, writer::flush);
        assertSame(failure, thrown);
    }

    @Test
    public void constructorMustRejectBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> new BufferedWriter<>(-4, NullStream.INSTANCE));
        assertThrows(NullPointerException.class, () -> new BufferedWriter<Sink>(4, null));
    }

    @ParameterizedTest(name = "capacity {0}, largest write {1}")
    @MethodSource("writerCombinations")
    public void writesOfAnySizeMustReachSinkInOrder(int capacity, int maxWriteSize) throws IOException {
        SplittableRandom rng = new SplittableRandom(capacity * 17L + maxWriteSize);
        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        BufferedWriter<ByteBufSink> writer = new BufferedWriter<>(capacity, new ByteBufSink());
        for (int i = 0; i < 200; i++) {
            byte[] chunk = randomBytes(rng.nextInt(0, maxWriteSize + 1), rng.nextLong());
            writer.write(chunk);
            expected.write(chunk, 0, chunk.length);
        }
        writer.flush();
        assertThat(sinkContents(writer)).containsExactly(expected.toByteArray());
    }

    private static byte[] sinkContents(BufferedWriter<ByteBufSink> writer) {
        return writer.innerRef().toByteArray();
    }
}
