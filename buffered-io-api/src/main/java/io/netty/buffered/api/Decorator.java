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
 * A wrapper that exclusively owns some inner object, and adds behaviour on top of it.
 *
 * @param <T> The type of the wrapped object.
 */
public interface Decorator<T> {
    /**
     * Give up ownership of the wrapped object, and return it.
     * <p>
     * Decorators that hold back written bytes will write them to the inner object before it is returned.
     * Once this method returns, the decorator is no longer {@linkplain #isAccessible() accessible}, and all
     * attempts at using it will throw an {@link IllegalStateException}.
     *
     * @return The wrapped object.
     * @throws IOException If writing held back bytes to the inner object failed.
     * @throws IllegalStateException If ownership has already been given up.
     */
    T inner() throws IOException;

    /**
     * Get the wrapped object, while retaining ownership of it.
     * Nothing is written to the inner object as part of this call.
     *
     * @return The wrapped object.
     * @throws IllegalStateException If ownership has already been given up through {@link #inner()}.
     */
    T innerRef();

    /**
     * Check if this decorator can still be used.
     *
     * @return {@code true} unless {@link #inner()} has been called.
     */
    boolean isAccessible();
}
