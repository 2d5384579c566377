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

package org.apache.pipe.remoting.api;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.pipe.remoting.api.interceptor.Interceptor;

/**
 * One end of a bidirectional command channel. Both ends may register handlers and issue requests.
 */
public interface RemotingService {
    void start();

    void stop();

    void registerHandler(String command, CommandHandler handler);

    void registerAsyncHandler(String command, AsyncCommandHandler handler);

    void setDefaultHandler(DefaultCommandHandler handler);

    void registerInterceptor(Interceptor interceptor);

    /**
     * Sends a command and blocks until the correlated response arrives.
     *
     * @return the {@code result} field of the response
     */
    Object request(String command, Object data, long timeoutMillis);

    /**
     * @return the complete response envelope
     */
    Map<String, Object> invoke(String command, Object data, long timeoutMillis);

    /**
     * @return a future completed with the {@code result} field of the response
     */
    CompletableFuture<Object> asyncRequest(String command, Object data, long timeoutMillis);

    void invokeAsync(String command, Object data, AsyncHandler asyncHandler, long timeoutMillis);

    /**
     * Sends a command without a request id; the peer does not answer.
     */
    void sendOneway(String command, Object data);
}
