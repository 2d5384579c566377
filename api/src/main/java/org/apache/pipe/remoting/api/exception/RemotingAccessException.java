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
 * Raised when the underlying byte streams cannot be read or written.
 */
public class RemotingAccessException extends RemotingRuntimeException {
    private static final long serialVersionUID = 2102836911732613025L;

    public RemotingAccessException(String message) {
        super(message);
    }

    public RemotingAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
