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

import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.pipe.remoting.api.command.Envelope;

/**
 * Outcome of one handler invocation. Every invocation yields one of these instead of throwing, the dispatch
 * boundary turns it into the wire response.
 */
public final class HandlerResult {
    public enum Kind {
        SUCCESS,
        FAILURE,
        /**
         * The handler answered by itself or must not be answered.
         */
        NO_REPLY
    }

    public enum FailureKind {
        UNKNOWN_COMMAND,
        HANDLER_ERROR,
        REJECTED
    }

    private static final HandlerResult NO_REPLY = new HandlerResult(Kind.NO_REPLY, null, null, null, null);

    private final Kind kind;
    private final Object value;
    private final FailureKind failureKind;
    private final String message;
    private final String detail;

    private HandlerResult(Kind kind, Object value, FailureKind failureKind, String message, String detail) {
        this.kind = kind;
        this.value = value;
        this.failureKind = failureKind;
        this.message = message;
        this.detail = detail;
    }

    public static HandlerResult success(Object value) {
        return new HandlerResult(Kind.SUCCESS, value, null, null, null);
    }

    public static HandlerResult noReply() {
        return NO_REPLY;
    }

    public static HandlerResult unknownCommand(String command) {
        return failure(FailureKind.UNKNOWN_COMMAND, "Unknown command: " + command, null);
    }

    public static HandlerResult failure(FailureKind failureKind, String message, String detail) {
        return new HandlerResult(Kind.FAILURE, null, failureKind, message, detail);
    }

    public static HandlerResult failure(Throwable cause) {
        Throwable root = unwrap(cause);
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getName();
        return failure(FailureKind.HANDLER_ERROR, message, ExceptionUtils.getStackTrace(root));
    }

    /**
     * @return the response envelope for {@code requestId}, or {@code null} if nothing is to be sent
     */
    public Map<String, Object> toEnvelope(String requestId) {
        switch (kind) {
            case SUCCESS:
                return Envelope.reply(value, requestId);
            case FAILURE:
                return Envelope.reply(Envelope.error(message, detail), requestId);
            default:
                return null;
        }
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFailure() {
        return kind == Kind.FAILURE;
    }

    public Object getValue() {
        return value;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    private static Throwable unwrap(Throwable cause) {
        Throwable current = cause;
        while ((current instanceof CompletionException || current instanceof ExecutionException
            || current instanceof InvocationTargetException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
