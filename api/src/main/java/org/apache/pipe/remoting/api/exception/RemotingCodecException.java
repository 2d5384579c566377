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

package org.apache.pipe.remoting.api.exception;

/**
 * Raised by a {@link org.apache.pipe.remoting.api.codec.Codec} that cannot encode or decode a value.
 */
public class RemotingCodecException extends RemotingRuntimeException {
    private static final long serialVersionUID = 3164201478016295528L;

    public RemotingCodecException(String message) {
        super(message);
    }

    public RemotingCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
