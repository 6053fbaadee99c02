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

import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

/**
 * Default buffer capacities, read once from system properties.
 */
public final class BufferedDefaults {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(BufferedDefaults.class);

    public static final String DEFAULT_CAPACITY_PROPERTY = "io.netty.buffered.defaultCapacity";
    public static final String LINE_CAPACITY_PROPERTY = "io.netty.buffered.lineCapacity";

    // 64 KiB is the buffer size libuv recommends for throughput.
    public static final int DEFAULT_CAPACITY;
    // Lines are usually short.
    public static final int DEFAULT_LINE_CAPACITY;

    static {
        DEFAULT_CAPACITY = capacityProperty(DEFAULT_CAPACITY_PROPERTY, 64 * 1024);
        DEFAULT_LINE_CAPACITY = capacityProperty(LINE_CAPACITY_PROPERTY, 1024);

        if (logger.isDebugEnabled()) {
            logger.debug("-D{}: {}", DEFAULT_CAPACITY_PROPERTY, DEFAULT_CAPACITY);
            logger.debug("-D{}: {}", LINE_CAPACITY_PROPERTY, DEFAULT_LINE_CAPACITY);
        }
    }

    /**
     * Read a buffer capacity from the given system property, falling back to the default if it is missing or not
     * positive.
     */
    public static int capacityProperty(String key, int defaultValue) {
        int value = SystemPropertyUtil.getInt(key, defaultValue);
        if (value <= 0) {
            logger.warn("-D{}: {} (expected: > 0), using the default of {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private BufferedDefaults() {
    }
}
