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

import org.jetbrains.annotations.Nullable;

/**
 * Raised when a value handed to the queue cannot be encoded. Carries the type of the rejected value.
 */
public class RemotingSerializationException extends RemotingCodecException {
    private static final long serialVersionUID = -1860725104475320744L;

    private final String valueType;

    public RemotingSerializationException(@Nullable Class<?> valueType, Throwable cause) {
        super(String.format("Object of type %s is not serializable", typeName(valueType)), cause);
        this.valueType = typeName(valueType);
    }

    public String getValueType() {
        return valueType;
    }

    private static String typeName(Class<?> type) {
        return type == null ? "null" : type.getName();
    }
}
