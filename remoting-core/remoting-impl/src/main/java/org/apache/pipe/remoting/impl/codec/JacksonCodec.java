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

package org.apache.pipe.remoting.impl.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.apache.commons.lang3.Validate;
import org.apache.pipe.remoting.api.codec.Codec;
import org.apache.pipe.remoting.api.exception.RemotingCodecException;
import org.msgpack.jackson.dataformat.MessagePackFactory;

/**
 * Jackson implementation of {@link Codec}. The data model is Jackson's untyped one: mappings decode to
 * {@link java.util.LinkedHashMap}, sequences to {@link java.util.ArrayList}, integers to the narrowest of
 * {@link Integer}, {@link Long} and {@link java.math.BigInteger}.
 */
public final class JacksonCodec implements Codec {
    private final ObjectMapper mapper;

    public JacksonCodec(ObjectMapper mapper) {
        this.mapper = Validate.notNull(mapper, "mapper");
    }

    /**
     * MessagePack, the format spoken by the peers of this protocol.
     */
    public static JacksonCodec messagePack() {
        return new JacksonCodec(new ObjectMapper(new MessagePackFactory()));
    }

    public static JacksonCodec json() {
        return new JacksonCodec(new ObjectMapper());
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new RemotingCodecException("Failed to encode value of type "
                + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    @Override
    public Object decode(byte[] data) {
        try {
            return mapper.readValue(data, Object.class);
        } catch (IOException e) {
            throw new RemotingCodecException("Failed to decode " + data.length + " bytes", e);
        }
    }
}
