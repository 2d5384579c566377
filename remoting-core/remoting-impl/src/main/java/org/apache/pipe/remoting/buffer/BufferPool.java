/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.pipe.remoting.buffer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.commons.lang3.Validate;

/**
 * Reusable fixed-length receive buffers.
 * <p>
 * The pool is a reuse cache, not a capacity limit: {@link #get()} allocates when no idle buffer is left and
 * {@link #release(byte[])} keeps every buffer of the right length, so the idle set may grow past the initial size.
 */
public class BufferPool {
    private final int bufferSize;
    private final Deque<byte[]> available;
    private final Lock lock = new ReentrantLock();

    public BufferPool(int bufferSize, int poolSize) {
        Validate.isTrue(bufferSize > 0, "bufferSize must be positive: %d", bufferSize);
        Validate.isTrue(poolSize >= 0, "poolSize must not be negative: %d", poolSize);
        this.bufferSize = bufferSize;
        this.available = new ArrayDeque<>(Math.max(poolSize, 1));
        for (int i = 0; i < poolSize; i++) {
            this.available.push(new byte[bufferSize]);
        }
    }

    public byte[] get() {
        lock.lock();
        try {
            byte[] buffer = available.poll();
            if (buffer != null) {
                return buffer;
            }
        } finally {
            lock.unlock();
        }
        return new byte[bufferSize];
    }

    /**
     * Returns a buffer to the pool. Buffers of any other length, and {@code null}, are dropped.
     */
    public void release(byte[] buffer) {
        if (buffer == null) {
            return;
        }
        lock.lock();
        try {
            if (buffer.length == bufferSize) {
                available.push(buffer);
            }
        } finally {
            lock.unlock();
        }
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public int available() {
        lock.lock();
        try {
            return available.size();
        } finally {
            lock.unlock();
        }
    }
}
