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

package org.apache.pipe.remoting.impl.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.util.Arrays;
import org.apache.commons.lang3.Validate;
import org.apache.pipe.remoting.api.exception.RemotingAccessException;
import org.apache.pipe.remoting.api.exception.RemotingConnectionClosedException;
import org.apache.pipe.remoting.api.exception.RemotingTimeoutException;
import org.apache.pipe.remoting.buffer.BufferPool;
import org.apache.pipe.remoting.config.PipeTransportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Length-prefixed frames over one readable and one writable byte stream.
 * <p>
 * Each frame is a 4 byte big-endian unsigned length followed by that many payload bytes. Java streams never
 * translate line endings, so pipes can be handed over as they are.
 * <p>
 * {@link #send(byte[])} may be called from many threads, frames are written whole under a write lock.
 * {@link #receive()} is meant for a single reading thread.
 */
public class FramedTransport implements Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(FramedTransport.class);

    public static final int LENGTH_PREFIX_SIZE = 4;

    private final InputStream in;
    private final OutputStream out;
    private final BufferPool bufferPool;
    private final int maxFrameLength;
    private final Object writeLock = new Object();

    public FramedTransport(InputStream in, OutputStream out) {
        this(in, out, new PipeTransportConfig());
    }

    public FramedTransport(InputStream in, OutputStream out, PipeTransportConfig config) {
        this.in = Validate.notNull(in, "in");
        this.out = Validate.notNull(out, "out");
        this.bufferPool = new BufferPool(config.getBufferSize(), config.getPoolSize());
        this.maxFrameLength = config.getMaxFrameLength();
    }

    /**
     * Writes the length prefix and the payload, flushing after each, so a reader waiting on the prefix sees it
     * even when the stream does not deliver one write atomically.
     */
    public void send(final byte[] data) {
        Validate.notNull(data, "data");
        byte[] prefix = encodeLength(data.length);
        synchronized (writeLock) {
            try {
                out.write(prefix);
                out.flush();
                out.write(data);
                out.flush();
            } catch (ClosedChannelException e) {
                throw new RemotingConnectionClosedException("Pipe closed while sending " + data.length + " bytes", e);
            } catch (IOException e) {
                throw new RemotingAccessException("Failed to send frame of " + data.length + " bytes", e);
            }
        }
        LOG.debug("Sent frame of {} bytes", data.length);
    }

    /**
     * Sends with a retroactive timeout: the write is never interrupted, but an I/O failure observed after
     * {@code timeoutMillis} has elapsed is reported as a {@link RemotingTimeoutException}.
     */
    public void sendWithTimeout(final byte[] data, final long timeoutMillis) {
        long beginTimestamp = System.currentTimeMillis();
        try {
            send(data);
        } catch (RemotingConnectionClosedException e) {
            throw e;
        } catch (RemotingAccessException e) {
            if (isExpired(beginTimestamp, timeoutMillis)) {
                throw new RemotingTimeoutException("Send operation timed out", timeoutMillis, e);
            }
            throw e;
        }
    }

    public byte[] receive() {
        byte[] prefix = readFully(LENGTH_PREFIX_SIZE);
        if (prefix.length == 0) {
            throw new RemotingConnectionClosedException("Pipe closed");
        }
        if (prefix.length < LENGTH_PREFIX_SIZE) {
            throw new RemotingConnectionClosedException("Pipe closed inside a length prefix");
        }

        long length = decodeLength(prefix);
        if (length > maxFrameLength) {
            throw new RemotingConnectionClosedException(
                String.format("Frame length %d over max limit %d", length, maxFrameLength));
        }

        byte[] payload = length <= bufferPool.getBufferSize() ? receivePooled((int) length) : receiveDirect((int) length);
        LOG.debug("Received frame of {} bytes", payload.length);
        return payload;
    }

    /**
     * Receives with a retroactive timeout, see {@link #sendWithTimeout(byte[], long)}. A closed pipe is always
     * reported as such.
     */
    public byte[] receiveWithTimeout(final long timeoutMillis) {
        long beginTimestamp = System.currentTimeMillis();
        try {
            return receive();
        } catch (RemotingConnectionClosedException e) {
            throw e;
        } catch (RemotingAccessException e) {
            if (isExpired(beginTimestamp, timeoutMillis)) {
                throw new RemotingTimeoutException("Receive operation timed out", timeoutMillis, e);
            }
            throw e;
        }
    }

    private byte[] receivePooled(final int length) {
        byte[] buffer = bufferPool.get();
        try {
            int bytesRead = 0;
            while (bytesRead < length) {
                int chunk;
                try {
                    chunk = in.read(buffer, bytesRead, length - bytesRead);
                } catch (ClosedChannelException e) {
                    throw new RemotingConnectionClosedException("Pipe closed during read", e);
                } catch (IOException e) {
                    throw new RemotingAccessException("Failed to read frame payload", e);
                }
                if (chunk <= 0) {
                    throw new RemotingConnectionClosedException(
                        String.format("Pipe closed during read, got %d of %d bytes", bytesRead, length));
                }
                bytesRead += chunk;
            }
            return Arrays.copyOf(buffer, length);
        } finally {
            bufferPool.release(buffer);
        }
    }

    private byte[] receiveDirect(final int length) {
        byte[] data = readFully(length);
        if (data.length < length) {
            throw new RemotingConnectionClosedException(
                String.format("Pipe closed during read, got %d of %d bytes", data.length, length));
        }
        return data;
    }

    private byte[] readFully(final int length) {
        try {
            return in.readNBytes(length);
        } catch (ClosedChannelException e) {
            throw new RemotingConnectionClosedException("Pipe closed during read", e);
        } catch (IOException e) {
            throw new RemotingAccessException("Failed to read from pipe", e);
        }
    }

    public BufferPool getBufferPool() {
        return bufferPool;
    }

    /**
     * Closes both streams. Both are attempted even if the first one fails.
     */
    @Override
    public void close() {
        RemotingAccessException failure = null;
        try {
            in.close();
        } catch (IOException e) {
            failure = new RemotingAccessException("Failed to close input stream", e);
        }
        try {
            out.close();
        } catch (IOException e) {
            if (failure == null) {
                failure = new RemotingAccessException("Failed to close output stream", e);
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    static byte[] encodeLength(final int length) {
        return ByteBuffer.allocate(LENGTH_PREFIX_SIZE).putInt(length).array();
    }

    static long decodeLength(final byte[] prefix) {
        return Integer.toUnsignedLong(ByteBuffer.wrap(prefix).getInt());
    }

    private static boolean isExpired(long beginTimestamp, long timeoutMillis) {
        return timeoutMillis > 0 && System.currentTimeMillis() - beginTimestamp >= timeoutMillis;
    }
}
