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

public interface Statics {
    static IllegalStateException decoratorIsDetached(Object decorator) {
        return new IllegalStateException(
                "This " + decorator.getClass().getSimpleName() + " has already given up its inner object.");
    }

    static IndexOutOfBoundsException consumeOutOfBounds(int amount, BufferCursor cursor) {
        return new IndexOutOfBoundsException(
                "Cannot consume " + amount + " bytes: [position " + cursor.position() + " to limit " +
                cursor.limit() + "].");
    }

    static IndexOutOfBoundsException appendOutOfBounds(int length, BufferCursor cursor) {
        return new IndexOutOfBoundsException(
                "Cannot append " + length + " bytes: [limit " + cursor.limit() + " to capacity " +
                cursor.capacity() + "].");
    }

    static IndexOutOfBoundsException invalidReadResult(int read, int capacity) {
        return new IndexOutOfBoundsException(
                "Source reported reading " + read + " bytes into a buffer of capacity " + capacity +
                " (expected: -1 to " + capacity + ").");
    }
}
