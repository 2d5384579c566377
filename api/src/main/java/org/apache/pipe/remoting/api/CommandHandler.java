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

/**
 * Synchronous handler for one command. It runs on a handler executor thread and may block.
 */
public interface CommandHandler {
    /**
     * @param data the {@code data} field of the command, may be {@code null}
     * @param requestId the id to answer to, {@code null} for one-way commands
     * @return the response value; a {@link java.util.Map} is sent as the response mapping itself
     * @throws Exception any failure, converted into an error response
     */
    Object handle(Object data, String requestId) throws Exception;
}
