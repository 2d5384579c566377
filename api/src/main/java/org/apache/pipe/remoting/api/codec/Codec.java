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

package org.apache.pipe.remoting.api.codec;

import org.apache.pipe.remoting.api.exception.RemotingCodecException;

/**
 * Turns values into frame payloads and back. Implementations must be deterministic for a given input and thread
 * safe, one codec instance is shared by every sender and the receiving loop of a queue.
 */
public interface Codec {
    /**
     * @param value a value of the codec's data model, {@code null} included
     * @return the encoded bytes
     * @throws RemotingCodecException if the value is outside the supported model
     */
    byte[] encode(Object value);

    /**
     * @param data bytes produced by {@link #encode(Object)} on either side of the stream
     * @return the decoded value; mappings decode to {@link java.util.Map}, sequences to {@link java.util.List}
     * @throws RemotingCodecException if the bytes are not a valid encoding
     */
    Object decode(byte[] data);
}
