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

package org.apache.pipe.remoting.impl.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;

/**
 * Fluent builder of one outbound call with named arguments:
 *
 * <pre>
 * int sum = server.on("add").with("a", 1, "b", 2).timeout(1, TimeUnit.SECONDS).call(Integer.class);
 * </pre>
 */
public class MethodCall {
    private static final ObjectMapper RESULT_MAPPER = new ObjectMapper();

    private final DispatchServer server;
    private final String command;
    private final Map<String, Object> arguments = new LinkedHashMap<>();
    private long timeoutMillis;

    MethodCall(DispatchServer server, String command, long timeoutMillis) {
        this.server = server;
        this.command = command;
        this.timeoutMillis = timeoutMillis;
    }

    public MethodCall with(String name, Object value) {
        arguments.put(name, value);
        return this;
    }

    /**
     * @param namesAndValues alternating argument names and values
     */
    public MethodCall with(Object... namesAndValues) {
        Validate.isTrue(namesAndValues.length % 2 == 0, "Arguments must come in name/value pairs");
        for (int i = 0; i < namesAndValues.length; i += 2) {
            arguments.put(String.valueOf(namesAndValues[i]), namesAndValues[i + 1]);
        }
        return this;
    }

    public MethodCall timeout(long timeout, TimeUnit unit) {
        this.timeoutMillis = unit.toMillis(timeout);
        return this;
    }

    public Object call() {
        return server.call(command, arguments, timeoutMillis);
    }

    public <T> T call(Class<T> resultType) {
        Object result = call();
        if (result == null || resultType.isInstance(result)) {
            return resultType.cast(result);
        }
        return RESULT_MAPPER.convertValue(result, resultType);
    }

    public String getCommand() {
        return command;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
