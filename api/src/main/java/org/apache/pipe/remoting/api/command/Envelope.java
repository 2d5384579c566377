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

package org.apache.pipe.remoting.api.command;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Keys and builders of the mapping carried inside every frame.
 *
 * <pre>
 * command   {"command": name, "data": value, "request_id": id}
 * response  {"result": value, "request_id": id}  or  {..handler mapping.., "request_id": id}
 * error     {"error": message, "traceback": detail, "request_id": id}
 * </pre>
 */
public final class Envelope {
    public static final String COMMAND = "command";
    public static final String DATA = "data";
    public static final String REQUEST_ID = "request_id";
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    public static final String TRACEBACK = "traceback";
    public static final String STATUS = "status";

    private Envelope() {
    }

    public static Map<String, Object> command(String command, @Nullable Object data, @Nullable String requestId) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(COMMAND, command);
        envelope.put(DATA, data);
        if (requestId != null) {
            envelope.put(REQUEST_ID, requestId);
        }
        return envelope;
    }

    /**
     * Builds the reply to a command. A mapping result is copied and tagged with the request id, anything else is
     * wrapped under {@link #RESULT}.
     */
    public static Map<String, Object> reply(@Nullable Object result, String requestId) {
        Map<String, Object> envelope;
        if (result instanceof Map) {
            envelope = copyOf((Map<?, ?>) result);
        } else {
            envelope = new LinkedHashMap<>();
            envelope.put(RESULT, result);
        }
        envelope.put(REQUEST_ID, requestId);
        return envelope;
    }

    /**
     * Copies a decoded mapping, keys turned into strings, order kept.
     */
    public static Map<String, Object> copyOf(Map<?, ?> mapping) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : mapping.entrySet()) {
            envelope.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return envelope;
    }

    public static Map<String, Object> error(String message, @Nullable String traceback) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(ERROR, message);
        if (traceback != null) {
            envelope.put(TRACEBACK, traceback);
        }
        return envelope;
    }

    public static Map<String, Object> status(String status) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(STATUS, status);
        return envelope;
    }

    /**
     * @return the request id of a decoded envelope as a string, or {@code null} if absent
     */
    @Nullable
    public static String requestId(Map<?, ?> envelope) {
        Object value = envelope.get(REQUEST_ID);
        return value == null ? null : value.toString();
    }
}
