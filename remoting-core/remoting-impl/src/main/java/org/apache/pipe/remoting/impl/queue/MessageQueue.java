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

package org.apache.pipe.remoting.impl.queue;

import java.io.Closeable;
import org.apache.commons.lang3.Validate;
import org.apache.pipe.remoting.api.codec.Codec;
import org.apache.pipe.remoting.api.exception.RemotingCodecException;
import org.apache.pipe.remoting.api.exception.RemotingSerializationException;
import org.apache.pipe.remoting.impl.transport.FramedTransport;

/**
 * Typed values over a {@link FramedTransport}: one encoded value per frame.
 */
public class MessageQueue implements Closeable {
    private final FramedTransport transport;
    private final Codec codec;

    public MessageQueue(FramedTransport transport, Codec codec) {
        this.transport = Validate.notNull(transport, "transport");
        this.codec = Validate.notNull(codec, "codec");
    }

    public void put(Object value) {
        put(value, true, 0);
    }

    /**
     * @param block whether to go through the timed send path
     * @param timeoutMillis retroactive timeout of the timed path, {@code 0} for none
     * @throws RemotingSerializationException if the codec rejects the value
     */
    public void put(Object value, boolean block, long timeoutMillis) {
        byte[] serialized;
        try {
            serialized = codec.encode(value);
        } catch (RemotingCodecException e) {
            throw new RemotingSerializationException(value == null ? null : value.getClass(), e);
        }

        if (block) {
            transport.sendWithTimeout(serialized, timeoutMillis);
        } else {
            transport.send(serialized);
        }
    }

    public Object get() {
        return get(true, 0);
    }

    /**
     * Decoding failures are not recovered: a frame that does not decode leaves this call failed with the codec's
     * exception.
     */
    public Object get(boolean block, long timeoutMillis) {
        byte[] data = block ? transport.receiveWithTimeout(timeoutMillis) : transport.receive();
        return codec.decode(data);
    }

    public FramedTransport getTransport() {
        return transport;
    }

    public Codec getCodec() {
        return codec;
    }

    @Override
    public void close() {
        transport.close();
    }
}
